package com.docgram.exception;

import java.util.UUID;

/** Exception thrown when background processing of a post fails. */
public class PostProcessingException extends RuntimeException {

  private final UUID postId;

  public PostProcessingException(UUID postId, String message) {
    super(message);
    this.postId = postId;
  }

  public PostProcessingException(UUID postId, String message, Throwable cause) {
    super(message, cause);
    this.postId = postId;
  }

  public UUID getPostId() {
    return postId;
  }
}
