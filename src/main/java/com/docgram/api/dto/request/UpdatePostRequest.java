package com.docgram.api.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial post update; null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePostRequest {

  @Size(min = 1, max = 255, message = "Title must be between 1 and 255 characters")
  private String title;

  @Size(max = 2000, message = "Description must be at most 2000 characters")
  private String description;

  @JsonProperty("is_public")
  private Boolean isPublic;
}
