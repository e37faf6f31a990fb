package com.docgram.service.user;

import com.docgram.api.dto.request.UpdateProfileRequest;
import com.docgram.domain.entity.Follow;
import com.docgram.domain.entity.User;
import com.docgram.domain.repository.FollowRepository;
import com.docgram.domain.repository.OffsetLimitRequest;
import com.docgram.domain.repository.UserRepository;
import com.docgram.exception.InvalidInputException;
import com.docgram.exception.ResourceNotFoundException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the UserService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserServiceImpl implements UserService {

  private final UserRepository userRepository;
  private final FollowRepository followRepository;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional(readOnly = true)
  public User getUser(UUID userId) {
    return userRepository
        .findById(userId)
        .orElseThrow(() -> new ResourceNotFoundException("User", userId));
  }

  @Override
  @Transactional
  @Timed(value = "user.update", description = "Time to update a profile")
  public User updateProfile(UUID userId, UpdateProfileRequest request) {
    User user = getUser(userId);

    if (request.getUsername() != null) {
      String username = request.getUsername().trim();
      if (!username.equals(user.getUsername()) && userRepository.existsByUsername(username)) {
        throw new InvalidInputException("Username already registered");
      }
      user.setUsername(username);
    }
    if (request.getEmail() != null) {
      String email = request.getEmail().trim();
      if (!email.equals(user.getEmail()) && userRepository.existsByEmail(email)) {
        throw new InvalidInputException("Email already registered");
      }
      user.setEmail(email);
    }
    if (request.getFirstName() != null) {
      user.setFirstName(request.getFirstName());
    }
    if (request.getLastName() != null) {
      user.setLastName(request.getLastName());
    }
    if (request.getBio() != null) {
      user.setBio(request.getBio());
    }
    if (request.getAvatarUrl() != null) {
      user.setAvatarUrl(request.getAvatarUrl());
    }
    return userRepository.save(user);
  }

  @Override
  @Transactional(readOnly = true)
  public UserProfile getProfile(UUID userId, UUID viewerId) {
    User user = getUser(userId);
    boolean following =
        !userId.equals(viewerId)
            && followRepository.existsByFollowerIdAndFollowingId(viewerId, userId);
    return new UserProfile(user, following);
  }

  @Override
  @Transactional(readOnly = true)
  public List<User> getFollowers(UUID userId, int offset, int limit) {
    getUser(userId);
    return followRepository.findFollowers(userId, OffsetLimitRequest.of(offset, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public List<User> getFollowing(UUID userId, int offset, int limit) {
    getUser(userId);
    return followRepository.findFollowing(userId, OffsetLimitRequest.of(offset, limit));
  }

  @Override
  @Transactional
  @Timed(value = "user.follow", description = "Time to toggle a follow")
  public FollowResult toggleFollow(UUID followerId, UUID targetId) {
    if (followerId.equals(targetId)) {
      throw new InvalidInputException("Cannot follow yourself");
    }
    User target = getUser(targetId);
    User follower = getUser(followerId);

    Optional<Follow> existing =
        followRepository.findByFollowerIdAndFollowingId(followerId, targetId);
    boolean following;
    if (existing.isPresent()) {
      followRepository.delete(existing.get());
      target.decrementFollowers();
      follower.decrementFollowing();
      following = false;
      meterRegistry.counter("user.unfollowed").increment();
    } else {
      followRepository.save(Follow.builder().follower(follower).following(target).build());
      target.incrementFollowers();
      follower.incrementFollowing();
      following = true;
      meterRegistry.counter("user.followed").increment();
    }
    userRepository.save(target);
    userRepository.save(follower);

    log.debug("User {} {} user {}", followerId, following ? "followed" : "unfollowed", targetId);
    return new FollowResult(following, target.getFollowersCount(), follower.getFollowingCount());
  }
}
