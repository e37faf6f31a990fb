package com.docgram.api.rest;

import com.docgram.api.dto.request.UpdatePostRequest;
import com.docgram.api.dto.response.PostCreatedResponse;
import com.docgram.api.dto.response.PostResponse;
import com.docgram.api.dto.response.VisibilityResponse;
import com.docgram.domain.entity.Post;
import com.docgram.security.JwtAuthenticationFilter;
import com.docgram.service.interaction.InteractionService;
import com.docgram.service.post.PostFile;
import com.docgram.service.post.PostIngestionService;
import com.docgram.service.post.PostService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for PDF posts. */
@RestController
@RequestMapping("/posts")
@RequiredArgsConstructor
public class PostController {

  private final PostService postService;
  private final PostIngestionService ingestionService;
  private final InteractionService interactionService;

  /** Uploads a PDF; the post is processed in the background. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<PostCreatedResponse> createPost(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "title", required = false) String title,
      @RequestParam(value = "description", required = false) String description,
      @RequestParam(value = "is_public", defaultValue = "true") boolean isPublic) {
    Post post = ingestionService.createPost(userId, file, title, description, isPublic);
    return ResponseEntity.ok(PostCreatedResponse.inProgress(post.getId()));
  }

  @GetMapping
  public ResponseEntity<List<PostResponse>> listPosts(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @RequestParam(defaultValue = "0") @Min(0) int offset,
      @RequestParam(defaultValue = "20") @Min(1) @Max(50) int limit) {
    return ResponseEntity.ok(toResponses(postService.listPublicPosts(offset, limit), userId));
  }

  @GetMapping("/feed")
  public ResponseEntity<List<PostResponse>> getFeed(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @RequestParam(defaultValue = "0") @Min(0) int offset,
      @RequestParam(defaultValue = "20") @Min(1) @Max(50) int limit) {
    return ResponseEntity.ok(toResponses(postService.getFeed(userId, offset, limit), userId));
  }

  @GetMapping("/search")
  public ResponseEntity<List<PostResponse>> searchPosts(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @RequestParam("q") @Size(min = 1, max = 100) String query,
      @RequestParam(defaultValue = "0") @Min(0) int offset,
      @RequestParam(defaultValue = "20") @Min(1) @Max(50) int limit) {
    return ResponseEntity.ok(toResponses(postService.searchPosts(query, offset, limit), userId));
  }

  @GetMapping("/{postId}")
  public ResponseEntity<PostResponse> getPost(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId) {
    return ResponseEntity.ok(toResponse(postService.getPost(postId, userId), userId));
  }

  /** Streams the original PDF. */
  @GetMapping("/{postId}/file")
  public ResponseEntity<byte[]> getPostFile(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId) {
    PostFile file = postService.getPostFile(postId, userId);
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_PDF)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.inline().filename(file.filename()).build().toString())
        .body(file.content());
  }

  /** Serves the rendered first-page thumbnail. */
  @GetMapping("/{postId}/thumbnail")
  public ResponseEntity<byte[]> getPostThumbnail(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId) {
    return ResponseEntity.ok()
        .contentType(MediaType.IMAGE_PNG)
        .body(postService.getPostThumbnail(postId, userId));
  }

  @PutMapping("/{postId}")
  public ResponseEntity<PostResponse> updatePost(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId,
      @Valid @RequestBody UpdatePostRequest request) {
    Post post =
        postService.updatePost(
            postId, userId, request.getTitle(), request.getDescription(), request.getIsPublic());
    return ResponseEntity.ok(toResponse(post, userId));
  }

  @PatchMapping("/{postId}/visibility")
  public ResponseEntity<VisibilityResponse> toggleVisibility(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId) {
    Post post = postService.toggleVisibility(postId, userId);
    return ResponseEntity.ok(new VisibilityResponse(post.isPublic()));
  }

  @DeleteMapping("/{postId}")
  public ResponseEntity<Void> deletePost(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId) {
    postService.deletePost(postId, userId);
    return ResponseEntity.noContent().build();
  }

  /** Re-runs text extraction and indexing for a post. */
  @PostMapping("/{postId}/reprocess")
  public ResponseEntity<PostResponse> reprocessPost(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId) {
    return ResponseEntity.ok(toResponse(postService.reprocessPost(postId, userId), userId));
  }

  private PostResponse toResponse(Post post, UUID viewerId) {
    return toResponses(List.of(post), viewerId).get(0);
  }

  private List<PostResponse> toResponses(List<Post> posts, UUID viewerId) {
    Set<UUID> liked =
        interactionService.findLikedPostIds(viewerId, posts.stream().map(Post::getId).toList());
    return posts.stream()
        .map(post -> PostResponse.fromEntity(post, liked.contains(post.getId())))
        .toList();
  }
}
