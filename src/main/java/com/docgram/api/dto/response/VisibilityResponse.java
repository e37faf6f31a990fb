package com.docgram.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Visibility of a post after a toggle. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VisibilityResponse {

  @JsonProperty("is_public")
  private Boolean isPublic;
}
