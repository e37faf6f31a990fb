package com.docgram.domain.entity;

import com.docgram.domain.enums.MessageRole;
import com.docgram.domain.enums.MessageStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
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

/** Represents a single message in a conversation. */
@Entity
@Table(name = "chat_messages")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessage {

  public static final String THINKING_PLACEHOLDER = "Thinking...";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "conversation_id", nullable = false)
  private Conversation conversation;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MessageRole role;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private MessageStatus status;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String content;

  /** For assistant messages, the id of the question being answered. */
  private UUID replyToId;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }

  /** Creates the pending assistant slot shown while an answer is generated. */
  public static ChatMessage placeholderFor(Conversation conversation, UUID questionId) {
    return ChatMessage.builder()
        .conversation(conversation)
        .role(MessageRole.ASSISTANT)
        .status(MessageStatus.PENDING)
        .content(THINKING_PLACEHOLDER)
        .replyToId(questionId)
        .build();
  }

  public void markAnswered(String answer) {
    requirePending();
    this.content = answer;
    this.status = MessageStatus.ANSWERED;
  }

  public void markFailed(String errorMessage) {
    requirePending();
    this.content = errorMessage;
    this.status = MessageStatus.FAILED;
  }

  private void requirePending() {
    if (status != MessageStatus.PENDING) {
      throw new IllegalStateException("Message " + id + " is already " + status);
    }
  }
}
