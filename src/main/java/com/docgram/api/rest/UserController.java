package com.docgram.api.rest;

import com.docgram.api.dto.request.UpdateProfileRequest;
import com.docgram.api.dto.response.FollowResponse;
import com.docgram.api.dto.response.PostResponse;
import com.docgram.api.dto.response.UserResponse;
import com.docgram.domain.entity.Post;
import com.docgram.domain.entity.User;
import com.docgram.security.JwtAuthenticationFilter;
import com.docgram.service.interaction.InteractionService;
import com.docgram.service.user.UserService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for accounts, profiles and the follow graph. */
@RestController
@RequestMapping("/users")
@RequiredArgsConstructor
public class UserController {

  private final UserService userService;
  private final InteractionService interactionService;

  @GetMapping("/me")
  public ResponseEntity<UserResponse> me(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId) {
    return ResponseEntity.ok(UserResponse.fromOwnAccount(userService.getUser(userId)));
  }

  @PutMapping("/profile")
  public ResponseEntity<UserResponse> updateProfile(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @Valid @RequestBody UpdateProfileRequest request) {
    User updated = userService.updateProfile(userId, request);
    return ResponseEntity.ok(UserResponse.fromOwnAccount(updated));
  }

  /** Gets a user's profile with whether the caller follows them. */
  @GetMapping("/{id}/profile")
  public ResponseEntity<UserResponse> getProfile(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID id) {
    return ResponseEntity.ok(UserResponse.fromProfile(userService.getProfile(id, userId)));
  }

  @GetMapping("/{id}/followers")
  public ResponseEntity<List<UserResponse>> getFollowers(
      @PathVariable UUID id,
      @RequestParam(defaultValue = "0") @Min(0) int offset,
      @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
    return ResponseEntity.ok(toResponses(userService.getFollowers(id, offset, limit)));
  }

  @GetMapping("/{id}/following")
  public ResponseEntity<List<UserResponse>> getFollowing(
      @PathVariable UUID id,
      @RequestParam(defaultValue = "0") @Min(0) int offset,
      @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
    return ResponseEntity.ok(toResponses(userService.getFollowing(id, offset, limit)));
  }

  /** Follows or unfollows a user. */
  @PostMapping("/{id}/follow")
  public ResponseEntity<FollowResponse> toggleFollow(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID id) {
    return ResponseEntity.ok(FollowResponse.from(userService.toggleFollow(userId, id)));
  }

  @GetMapping("/me/bookmarks")
  public ResponseEntity<List<PostResponse>> getBookmarks(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @RequestParam(defaultValue = "0") @Min(0) int offset,
      @RequestParam(defaultValue = "20") @Min(1) @Max(50) int limit) {
    List<Post> posts = interactionService.getBookmarks(userId, offset, limit);
    Set<UUID> liked =
        interactionService.findLikedPostIds(userId, posts.stream().map(Post::getId).toList());
    return ResponseEntity.ok(
        posts.stream()
            .map(post -> PostResponse.fromEntity(post, liked.contains(post.getId())))
            .toList());
  }

  private static List<UserResponse> toResponses(List<User> users) {
    return users.stream().map(UserResponse::fromEntity).toList();
  }
}
