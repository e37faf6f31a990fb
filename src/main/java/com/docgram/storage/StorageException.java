package com.docgram.storage;

/** Exception thrown when the object store cannot complete an operation. */
public class StorageException extends RuntimeException {

  private final String key;

  public StorageException(String key, String message, Throwable cause) {
    super(message, cause);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
