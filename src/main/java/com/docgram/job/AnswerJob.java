package com.docgram.job;

import java.util.UUID;

/**
 * Generate the assistant answer for a question already stored in a conversation.
 *
 * @param conversationId the conversation the question belongs to
 * @param questionMessageId id of the stored user message
 * @param question the question text
 */
public record AnswerJob(UUID conversationId, UUID questionMessageId, String question)
    implements BackgroundJob {

  @Override
  public String describe() {
    return "answer[" + questionMessageId + "]";
  }
}
