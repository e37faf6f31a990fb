package com.docgram.domain.repository;

import com.docgram.domain.entity.Post;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Post entities. */
@Repository
public interface PostRepository extends JpaRepository<Post, UUID> {

  /** Public posts, newest first. */
  @Query(
      "SELECT p FROM Post p JOIN FETCH p.owner WHERE p.isPublic = true "
          + "ORDER BY p.createdAt DESC")
  List<Post> findPublicPosts(Pageable pageable);

  /** Public posts whose title contains the query, ignoring case. */
  @Query(
      "SELECT p FROM Post p JOIN FETCH p.owner WHERE p.isPublic = true "
          + "AND LOWER(p.title) LIKE LOWER(CONCAT('%', :query, '%')) ORDER BY p.createdAt DESC")
  List<Post> searchPublicByTitle(@Param("query") String query, Pageable pageable);

  /** The user's own posts plus public posts of everyone the user follows, newest first. */
  @Query(
      "SELECT p FROM Post p JOIN FETCH p.owner o WHERE o.id = :userId "
          + "OR (p.isPublic = true AND o.id IN "
          + "(SELECT f.following.id FROM Follow f WHERE f.follower.id = :userId)) "
          + "ORDER BY p.createdAt DESC")
  List<Post> findFeed(@Param("userId") UUID userId, Pageable pageable);
}
