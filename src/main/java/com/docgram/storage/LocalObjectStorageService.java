package com.docgram.storage;

import com.docgram.config.DocgramProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Filesystem-backed object store rooted at {@code docgram.storage.base-path}. */
@Service
@Slf4j
public class LocalObjectStorageService implements ObjectStorageService {

  private final Path root;
  private final MeterRegistry meterRegistry;

  public LocalObjectStorageService(DocgramProperties properties, MeterRegistry meterRegistry) {
    this.root = Path.of(properties.getStorage().getBasePath()).toAbsolutePath().normalize();
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void put(String key, byte[] data, String contentType) {
    Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      Path temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      Files.write(temp, data);
      Files.move(
          temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      meterRegistry.counter("storage.put").increment();
      log.debug("Stored object {} ({} bytes, {})", key, data.length, contentType);
    } catch (IOException e) {
      log.error("Failed to store object {}: {}", key, e.getMessage(), e);
      throw new StorageException(key, "Failed to store object " + key, e);
    }
  }

  @Override
  public byte[] get(String key) {
    Path source = resolve(key);
    try {
      return Files.readAllBytes(source);
    } catch (IOException e) {
      throw new StorageException(key, "Failed to read object " + key, e);
    }
  }

  @Override
  public boolean exists(String key) {
    return Files.isRegularFile(resolve(key));
  }

  @Override
  public void delete(String key) {
    try {
      if (Files.deleteIfExists(resolve(key))) {
        meterRegistry.counter("storage.delete").increment();
        log.debug("Deleted object {}", key);
      }
    } catch (IOException e) {
      throw new StorageException(key, "Failed to delete object " + key, e);
    }
  }

  private Path resolve(String key) {
    Path resolved = root.resolve(key).normalize();
    if (!resolved.startsWith(root)) {
      throw new IllegalArgumentException("Object key escapes storage root: " + key);
    }
    return resolved;
  }
}
