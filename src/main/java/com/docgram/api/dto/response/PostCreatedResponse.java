package com.docgram.api.dto.response;

import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Immediate reply to an upload; processing continues in the background. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PostCreatedResponse {

  private String message;
  private UUID postId;

  public static PostCreatedResponse inProgress(UUID postId) {
    return new PostCreatedResponse("Post creation is in progress...", postId);
  }
}
