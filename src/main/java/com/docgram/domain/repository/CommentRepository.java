package com.docgram.domain.repository;

import com.docgram.domain.entity.Comment;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Comment entities. */
@Repository
public interface CommentRepository extends JpaRepository<Comment, UUID> {

  /** Comments of a post, oldest first. */
  @Query(
      "SELECT c FROM Comment c JOIN FETCH c.author WHERE c.post.id = :postId "
          + "ORDER BY c.createdAt ASC")
  List<Comment> findByPostId(@Param("postId") UUID postId, Pageable pageable);

  long countByPostId(UUID postId);

  @Modifying
  @Query("DELETE FROM Comment c WHERE c.post.id = :postId")
  int deleteByPostId(@Param("postId") UUID postId);
}
