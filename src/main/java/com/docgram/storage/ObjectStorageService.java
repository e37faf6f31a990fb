package com.docgram.storage;

/**
 * Durable blob storage for uploaded PDFs and rendered thumbnails.
 *
 * <p>Keys are relative slash-separated paths such as {@code pdfs/<postId>.pdf}.
 */
public interface ObjectStorageService {

  /**
   * Stores the bytes under the key, replacing any previous object.
   *
   * @param key the object key
   * @param data the object content
   * @param contentType MIME type of the content
   */
  void put(String key, byte[] data, String contentType);

  /**
   * Reads an object.
   *
   * @param key the object key
   * @return the object content
   * @throws StorageException if the object is missing or cannot be read
   */
  byte[] get(String key);

  boolean exists(String key);

  /** Deletes an object; deleting a missing key is not an error. */
  void delete(String key);
}
