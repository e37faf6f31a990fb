package com.docgram.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Bookmark state after a toggle. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookmarkResponse {

  @JsonProperty("is_bookmarked")
  private boolean bookmarked;
}
