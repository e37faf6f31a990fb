package com.docgram.domain.repository;

import com.docgram.domain.entity.Bookmark;
import com.docgram.domain.entity.Post;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Bookmark relations. */
@Repository
public interface BookmarkRepository extends JpaRepository<Bookmark, UUID> {

  Optional<Bookmark> findByPostIdAndUserId(UUID postId, UUID userId);

  boolean existsByPostIdAndUserId(UUID postId, UUID userId);

  /** Posts bookmarked by a user that are still visible to them, newest bookmark first. */
  @Query(
      "SELECT b.post FROM Bookmark b WHERE b.user.id = :userId "
          + "AND (b.post.isPublic = true OR b.post.owner.id = :userId) ORDER BY b.createdAt DESC")
  List<Post> findBookmarkedPosts(@Param("userId") UUID userId, Pageable pageable);

  @Modifying
  @Query("DELETE FROM Bookmark b WHERE b.post.id = :postId")
  int deleteByPostId(@Param("postId") UUID postId);
}
