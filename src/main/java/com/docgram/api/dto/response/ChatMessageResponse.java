package com.docgram.api.dto.response;

import com.docgram.domain.entity.ChatMessage;
import com.docgram.domain.enums.MessageRole;
import com.docgram.domain.enums.MessageStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a conversation message. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {

  private UUID id;
  private UUID conversationId;
  private MessageRole role;
  private MessageStatus status;
  private String content;
  private UUID replyToId;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a ChatMessageResponse from a ChatMessage entity. */
  public static ChatMessageResponse fromEntity(ChatMessage message) {
    return ChatMessageResponse.builder()
        .id(message.getId())
        .conversationId(message.getConversation().getId())
        .role(message.getRole())
        .status(message.getStatus())
        .content(message.getContent())
        .replyToId(message.getReplyToId())
        .createdAt(message.getCreatedAt())
        .updatedAt(message.getUpdatedAt())
        .build();
  }
}
