package com.docgram.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Like state after a toggle. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LikeResponse {

  @JsonProperty("is_liked")
  private boolean liked;

  private int likesCount;
}
