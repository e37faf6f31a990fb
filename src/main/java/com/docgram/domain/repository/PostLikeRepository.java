package com.docgram.domain.repository;

import com.docgram.domain.entity.PostLike;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for PostLike relations. */
@Repository
public interface PostLikeRepository extends JpaRepository<PostLike, UUID> {

  Optional<PostLike> findByPostIdAndUserId(UUID postId, UUID userId);

  boolean existsByPostIdAndUserId(UUID postId, UUID userId);

  @Query("SELECT l.post.id FROM PostLike l WHERE l.user.id = :userId AND l.post.id IN :postIds")
  List<UUID> findLikedPostIds(
      @Param("userId") UUID userId, @Param("postIds") Collection<UUID> postIds);

  @Modifying
  @Query("DELETE FROM PostLike l WHERE l.post.id = :postId")
  int deleteByPostId(@Param("postId") UUID postId);
}
