package com.docgram.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A question about a post's PDF. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AskRequest {

  @NotBlank(message = "Query is required")
  @Size(min = 1, max = 1000, message = "Query must be between 1 and 1000 characters")
  private String query;
}
