package com.docgram.exception;

/** Thrown when a request carries input the service cannot accept. */
public class InvalidInputException extends RuntimeException {

  public InvalidInputException(String message) {
    super(message);
  }
}
