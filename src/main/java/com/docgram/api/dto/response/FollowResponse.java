package com.docgram.api.dto.response;

import com.docgram.service.user.FollowResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Follow state after a toggle. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FollowResponse {

  private boolean following;
  private int followersCount;
  private int followingCount;

  public static FollowResponse from(FollowResult result) {
    return new FollowResponse(
        result.following(), result.followersCount(), result.followingCount());
  }
}
