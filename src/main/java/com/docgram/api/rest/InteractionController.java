package com.docgram.api.rest;

import com.docgram.api.dto.request.CommentRequest;
import com.docgram.api.dto.response.BookmarkResponse;
import com.docgram.api.dto.response.CommentResponse;
import com.docgram.api.dto.response.LikeResponse;
import com.docgram.security.JwtAuthenticationFilter;
import com.docgram.service.interaction.CommentService;
import com.docgram.service.interaction.InteractionService;
import com.docgram.service.interaction.LikeResult;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for likes, bookmarks and comments on posts. */
@RestController
@RequestMapping("/posts/{postId}")
@RequiredArgsConstructor
public class InteractionController {

  private final InteractionService interactionService;
  private final CommentService commentService;

  @PostMapping("/like")
  public ResponseEntity<LikeResponse> toggleLike(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId) {
    LikeResult result = interactionService.toggleLike(postId, userId);
    return ResponseEntity.ok(new LikeResponse(result.liked(), result.likesCount()));
  }

  @PostMapping("/bookmark")
  public ResponseEntity<BookmarkResponse> toggleBookmark(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId) {
    return ResponseEntity.ok(
        new BookmarkResponse(interactionService.toggleBookmark(postId, userId)));
  }

  @GetMapping("/comments")
  public ResponseEntity<List<CommentResponse>> getComments(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId,
      @RequestParam(defaultValue = "0") @Min(0) int offset,
      @RequestParam(defaultValue = "50") @Min(1) @Max(100) int limit) {
    return ResponseEntity.ok(
        commentService.getComments(postId, userId, offset, limit).stream()
            .map(CommentResponse::fromEntity)
            .toList());
  }

  @PostMapping("/comments")
  public ResponseEntity<CommentResponse> addComment(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId,
      @Valid @RequestBody CommentRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(
            CommentResponse.fromEntity(
                commentService.addComment(postId, userId, request.getContent())));
  }
}
