package com.docgram.exception;

/** Exception thrown when the vector index rejects or fails an operation. */
public class SearchIndexException extends RuntimeException {

  public SearchIndexException(String message) {
    super(message);
  }

  public SearchIndexException(String message, Throwable cause) {
    super(message, cause);
  }
}
