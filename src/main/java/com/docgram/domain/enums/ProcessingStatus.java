package com.docgram.domain.enums;

/** Background processing status of a post's PDF. */
public enum ProcessingStatus {
  /** Uploaded, waiting for the background processor. */
  PENDING,

  /** Text extraction and embedding in progress. */
  PROCESSING,

  /** Chunks indexed and available for chat retrieval. */
  READY,

  /** Processing failed; chat retrieves no context for this post. */
  FAILED
}
