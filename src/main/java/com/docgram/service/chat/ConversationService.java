package com.docgram.service.chat;

import com.docgram.domain.entity.ChatMessage;
import java.util.List;
import java.util.UUID;

/** Service interface for per-post conversations between a user and the answer agent. */
public interface ConversationService {

  /**
   * Stores a question and schedules its answer.
   *
   * <p>The caller's conversation for the post is created on first use. The assistant's answer
   * appears later as a separate message, first as a {@code PENDING} placeholder.
   *
   * @param postId the post asked about
   * @param userId the asking user
   * @param query the question
   * @return the stored user message
   * @throws com.docgram.exception.ResourceNotFoundException if the post is not visible to the user
   */
  ChatMessage ask(UUID postId, UUID userId, String query);

  /** The caller's messages about a post, oldest first; empty before the first question. */
  List<ChatMessage> getMessages(UUID postId, UUID userId);

  /**
   * Deletes one message from the caller's conversation.
   *
   * @throws com.docgram.exception.ResourceNotFoundException if the message does not exist
   * @throws com.docgram.exception.ForbiddenException if the message belongs to someone else
   */
  void deleteMessage(UUID messageId, UUID userId);
}
