package com.docgram.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for commenting on a post. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentRequest {

  @NotBlank(message = "Content is required")
  @Size(min = 1, max = 1000, message = "Content must be between 1 and 1000 characters")
  private String content;
}
