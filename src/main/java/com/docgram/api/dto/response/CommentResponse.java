package com.docgram.api.dto.response;

import com.docgram.domain.entity.Comment;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a comment. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentResponse {

  private UUID id;
  private UUID postId;
  private UserSummaryResponse author;
  private String content;
  private LocalDateTime createdAt;

  public static CommentResponse fromEntity(Comment comment) {
    return CommentResponse.builder()
        .id(comment.getId())
        .postId(comment.getPost().getId())
        .author(UserSummaryResponse.fromEntity(comment.getAuthor()))
        .content(comment.getContent())
        .createdAt(comment.getCreatedAt())
        .build();
  }
}
