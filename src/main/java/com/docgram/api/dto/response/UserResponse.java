package com.docgram.api.dto.response;

import com.docgram.domain.entity.User;
import com.docgram.service.user.UserProfile;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for user data.
 *
 * <p>{@code email} is only present on the caller's own account and {@code is_following} only on
 * profiles viewed by someone else.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

  private UUID id;
  private String username;

  @JsonInclude(JsonInclude.Include.NON_NULL)
  private String email;

  private String firstName;
  private String lastName;
  private String bio;
  private String avatarUrl;
  private int followersCount;
  private int followingCount;
  private int postsCount;
  private LocalDateTime createdAt;

  @JsonProperty("is_following")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  private Boolean isFollowing;

  /** Creates a public view of a user. */
  public static UserResponse fromEntity(User user) {
    return UserResponse.builder()
        .id(user.getId())
        .username(user.getUsername())
        .firstName(user.getFirstName())
        .lastName(user.getLastName())
        .bio(user.getBio())
        .avatarUrl(user.getAvatarUrl())
        .followersCount(user.getFollowersCount())
        .followingCount(user.getFollowingCount())
        .postsCount(user.getPostsCount())
        .createdAt(user.getCreatedAt())
        .build();
  }

  /** Creates the account view shown to the user themselves. */
  public static UserResponse fromOwnAccount(User user) {
    UserResponse response = fromEntity(user);
    response.setEmail(user.getEmail());
    return response;
  }

  public static UserResponse fromProfile(UserProfile profile) {
    UserResponse response = fromEntity(profile.user());
    response.setIsFollowing(profile.following());
    return response;
  }
}
