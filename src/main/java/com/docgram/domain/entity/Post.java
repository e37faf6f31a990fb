package com.docgram.domain.entity;

import com.docgram.domain.enums.ProcessingStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A PDF shared by a user.
 *
 * <p>The id is assigned by the ingestion handler before the row exists, because the storage key of
 * the uploaded file is derived from it.
 */
@Entity
@Table(name = "posts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Post {

  @Id private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "owner_id", nullable = false, updatable = false)
  private User owner;

  @Column(nullable = false)
  private String title;

  @Column(columnDefinition = "TEXT")
  private String description;

  /** Object storage key of the PDF. */
  @Column(nullable = false)
  private String fileKey;

  /** Object storage key of the first-page thumbnail, if one was rendered. */
  private String thumbnailKey;

  private Long fileSize;

  @Builder.Default private int pageCount = 0;

  @Builder.Default
  @Column(nullable = false)
  private boolean isPublic = true;

  @Builder.Default private int likesCount = 0;

  @Builder.Default private int commentsCount = 0;

  @Builder.Default private int sharesCount = 0;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private ProcessingStatus processingStatus = ProcessingStatus.PENDING;

  /** Number of chunks indexed for retrieval. */
  private Integer chunkCount;

  @Column(columnDefinition = "TEXT")
  private String processingError;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  private LocalDateTime processedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  public boolean isOwnedBy(UUID userId) {
    return owner != null && owner.getId().equals(userId);
  }

  /** Public posts are visible to everyone, private ones only to their owner. */
  public boolean isVisibleTo(UUID userId) {
    return isPublic || isOwnedBy(userId);
  }

  public void startProcessing() {
    this.processingStatus = ProcessingStatus.PROCESSING;
    this.processingError = null;
  }

  /** Puts the post back in the queue; the previous chunk count stays until processing ends. */
  public void resetForReprocessing() {
    this.processingStatus = ProcessingStatus.PENDING;
    this.processingError = null;
  }

  public void markReady(int chunkCount) {
    this.processingStatus = ProcessingStatus.READY;
    this.chunkCount = chunkCount;
    this.processingError = null;
    this.processedAt = LocalDateTime.now();
  }

  public void markFailed(String errorMessage) {
    this.processingStatus = ProcessingStatus.FAILED;
    this.processingError = errorMessage;
    this.processedAt = LocalDateTime.now();
  }

  public void incrementLikes() {
    likesCount++;
  }

  public void decrementLikes() {
    likesCount = Math.max(0, likesCount - 1);
  }

  public void incrementComments() {
    commentsCount++;
  }
}
