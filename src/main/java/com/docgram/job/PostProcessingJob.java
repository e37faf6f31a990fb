package com.docgram.job;

import java.util.UUID;

/** Extract, chunk, embed and index the PDF of a post. */
public record PostProcessingJob(UUID postId) implements BackgroundJob {

  @Override
  public String describe() {
    return "post-processing[" + postId + "]";
  }
}
