package com.docgram.exception;

/** Thrown when the caller does not own the resource it tries to change. */
public class ForbiddenException extends RuntimeException {

  public ForbiddenException(String message) {
    super(message);
  }
}
