package com.docgram.service.post;

import com.docgram.config.DocgramProperties;
import com.docgram.domain.entity.Post;
import com.docgram.domain.entity.User;
import com.docgram.domain.repository.PostRepository;
import com.docgram.domain.repository.UserRepository;
import com.docgram.exception.InvalidInputException;
import com.docgram.exception.ResourceNotFoundException;
import com.docgram.job.BackgroundJobDispatcher;
import com.docgram.job.PostProcessingJob;
import com.docgram.service.rag.PdfDocumentReader;
import com.docgram.storage.ObjectStorageService;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the PostIngestionService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostIngestionServiceImpl implements PostIngestionService {

  static final String PDF_CONTENT_TYPE = "application/pdf";

  private final PostRepository postRepository;
  private final UserRepository userRepository;
  private final ObjectStorageService storageService;
  private final PdfDocumentReader pdfReader;
  private final BackgroundJobDispatcher jobDispatcher;
  private final DocgramProperties properties;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "post.upload", description = "Time to accept a PDF upload")
  public Post createPost(
      UUID ownerId, MultipartFile file, String title, String description, boolean isPublic) {
    log.info("Uploading {} for user {}", file.getOriginalFilename(), ownerId);

    validateFile(file);
    User owner =
        userRepository
            .findById(ownerId)
            .orElseThrow(() -> new ResourceNotFoundException("User", ownerId));

    byte[] pdfBytes;
    try {
      pdfBytes = file.getBytes();
    } catch (IOException e) {
      log.error("Failed to read uploaded file: {}", e.getMessage());
      throw new InvalidInputException("Could not read uploaded file");
    }

    UUID postId = UUID.randomUUID();
    List<String> storedKeys = new ArrayList<>();
    String fileKey = "pdfs/" + postId + ".pdf";
    storageService.put(fileKey, pdfBytes, PDF_CONTENT_TYPE);
    storedKeys.add(fileKey);
    // keys stored from here on are removed again if the post is never committed
    deleteOnRollback(postId, storedKeys);

    String thumbnailKey = storeThumbnail(postId, pdfBytes).orElse(null);
    if (thumbnailKey != null) {
      storedKeys.add(thumbnailKey);
    }

    Post post =
        Post.builder()
            .id(postId)
            .owner(owner)
            .title(resolveTitle(title, file.getOriginalFilename()))
            .description(description)
            .fileKey(fileKey)
            .thumbnailKey(thumbnailKey)
            .fileSize(file.getSize())
            .pageCount(pdfReader.countPages(pdfBytes))
            .isPublic(isPublic)
            .build();
    Post saved = postRepository.save(post);

    owner.incrementPosts();
    userRepository.save(owner);

    jobDispatcher.dispatch(new PostProcessingJob(postId));
    meterRegistry.counter("post.uploaded").increment();

    log.info("Post {} created with {} pages, processing scheduled", postId, saved.getPageCount());
    return saved;
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new InvalidInputException("File is empty");
    }
    if (!PDF_CONTENT_TYPE.equals(file.getContentType())) {
      throw new InvalidInputException("Only PDF files are allowed");
    }
    if (file.getSize() > properties.getUpload().getMaxFileSize()) {
      long maxMb = properties.getUpload().getMaxFileSize() / (1024 * 1024);
      throw new InvalidInputException("Maximum file size is " + maxMb + "MB");
    }
  }

  private Optional<String> storeThumbnail(UUID postId, byte[] pdfBytes) {
    if (!properties.getUpload().isThumbnailsEnabled()) {
      return Optional.empty();
    }
    Optional<byte[]> png =
        pdfReader.renderThumbnail(pdfBytes, properties.getUpload().getThumbnailDpi());
    if (png.isEmpty()) {
      return Optional.empty();
    }
    String key = "thumbnails/" + postId + ".png";
    try {
      storageService.put(key, png.get(), "image/png");
      return Optional.of(key);
    } catch (RuntimeException e) {
      log.warn("Could not store thumbnail for post {}: {}", postId, e.getMessage());
      return Optional.empty();
    }
  }

  private void deleteOnRollback(UUID postId, List<String> keys) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCompletion(int status) {
            if (status == STATUS_COMMITTED) {
              return;
            }
            log.warn("Post {} not committed, removing {} stored object(s)", postId, keys.size());
            for (String key : keys) {
              try {
                storageService.delete(key);
              } catch (RuntimeException e) {
                log.error("Failed to remove orphaned object {}: {}", key, e.getMessage());
              }
            }
          }
        });
  }

  private static String resolveTitle(String title, String filename) {
    return title == null || title.isBlank() ? defaultTitle(filename) : title.trim();
  }

  /** "quarterly_report-2024.pdf" becomes "Quarterly Report 2024". */
  @VisibleForTesting
  static String defaultTitle(String filename) {
    if (filename == null || filename.isBlank()) {
      return "Untitled";
    }
    String base = filename.trim();
    int dot = base.lastIndexOf('.');
    if (dot > 0) {
      base = base.substring(0, dot);
    }
    String[] words = base.replace('_', ' ').replace('-', ' ').trim().split("\\s+");
    StringBuilder title = new StringBuilder();
    for (String word : words) {
      if (word.isEmpty()) {
        continue;
      }
      if (title.length() > 0) {
        title.append(' ');
      }
      title
          .append(word.substring(0, 1).toUpperCase(Locale.ROOT))
          .append(word.substring(1).toLowerCase(Locale.ROOT));
    }
    return title.length() == 0 ? "Untitled" : title.toString();
  }
}
