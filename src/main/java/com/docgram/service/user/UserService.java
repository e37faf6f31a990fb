package com.docgram.service.user;

import com.docgram.api.dto.request.UpdateProfileRequest;
import com.docgram.domain.entity.User;
import java.util.List;
import java.util.UUID;

/** Service interface for profiles and the follow graph. */
public interface UserService {

  /**
   * Gets a user by ID.
   *
   * @throws com.docgram.exception.ResourceNotFoundException if not found
   */
  User getUser(UUID userId);

  /**
   * Applies the non-null fields of the request to the user's profile.
   *
   * @throws com.docgram.exception.InvalidInputException if the new username or email is taken
   */
  User updateProfile(UUID userId, UpdateProfileRequest request);

  UserProfile getProfile(UUID userId, UUID viewerId);

  List<User> getFollowers(UUID userId, int offset, int limit);

  List<User> getFollowing(UUID userId, int offset, int limit);

  /**
   * Follows the target, or unfollows it if already followed.
   *
   * @throws com.docgram.exception.InvalidInputException if the caller targets themselves
   */
  FollowResult toggleFollow(UUID followerId, UUID targetId);
}
