package com.docgram.domain.repository;

import com.docgram.domain.entity.Follow;
import com.docgram.domain.entity.User;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Follow relations. */
@Repository
public interface FollowRepository extends JpaRepository<Follow, UUID> {

  Optional<Follow> findByFollowerIdAndFollowingId(UUID followerId, UUID followingId);

  boolean existsByFollowerIdAndFollowingId(UUID followerId, UUID followingId);

  /** Users following the given user, most recent first. */
  @Query(
      "SELECT f.follower FROM Follow f WHERE f.following.id = :userId ORDER BY f.createdAt DESC")
  List<User> findFollowers(@Param("userId") UUID userId, Pageable pageable);

  /** Users the given user follows, most recent first. */
  @Query(
      "SELECT f.following FROM Follow f WHERE f.follower.id = :userId ORDER BY f.createdAt DESC")
  List<User> findFollowing(@Param("userId") UUID userId, Pageable pageable);
}
