package com.docgram.api.dto.response;

import com.docgram.domain.entity.Post;
import com.docgram.domain.enums.ProcessingStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for post data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostResponse {

  private UUID id;
  private UserSummaryResponse owner;
  private String title;
  private String description;
  private Long fileSize;
  private int pageCount;
  private String thumbnailUrl;

  @JsonProperty("is_public")
  private Boolean isPublic;

  @JsonProperty("is_liked")
  private Boolean isLiked;

  private int likesCount;
  private int commentsCount;
  private int sharesCount;
  private ProcessingStatus processingStatus;
  private Integer chunkCount;
  private String processingError;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
  private LocalDateTime processedAt;

  /**
   * Creates a PostResponse from a Post entity; the owner must be loaded.
   *
   * @param liked whether the viewer has liked the post
   */
  public static PostResponse fromEntity(Post post, boolean liked) {
    return PostResponse.builder()
        .id(post.getId())
        .owner(UserSummaryResponse.fromEntity(post.getOwner()))
        .title(post.getTitle())
        .description(post.getDescription())
        .fileSize(post.getFileSize())
        .pageCount(post.getPageCount())
        .thumbnailUrl(
            post.getThumbnailKey() == null ? null : "/posts/" + post.getId() + "/thumbnail")
        .isPublic(post.isPublic())
        .isLiked(liked)
        .likesCount(post.getLikesCount())
        .commentsCount(post.getCommentsCount())
        .sharesCount(post.getSharesCount())
        .processingStatus(post.getProcessingStatus())
        .chunkCount(post.getChunkCount())
        .processingError(post.getProcessingError())
        .createdAt(post.getCreatedAt())
        .updatedAt(post.getUpdatedAt())
        .processedAt(post.getProcessedAt())
        .build();
  }
}
