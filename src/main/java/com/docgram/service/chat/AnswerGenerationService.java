package com.docgram.service.chat;

import com.docgram.agent.PostAnswerAgent;
import com.docgram.config.DocgramProperties;
import com.docgram.domain.entity.ChatMessage;
import com.docgram.domain.entity.Conversation;
import com.docgram.domain.entity.Post;
import com.docgram.domain.enums.MessageRole;
import com.docgram.domain.repository.ChatMessageRepository;
import com.docgram.domain.repository.ConversationRepository;
import com.docgram.domain.repository.OffsetLimitRequest;
import com.docgram.elasticsearch.PostChunk;
import com.docgram.elasticsearch.PostChunkIndexService;
import com.docgram.job.AnswerJob;
import com.docgram.job.BackgroundJobHandler;
import com.docgram.service.rag.EmbeddingService;
import com.docgram.service.rag.RagContextBuilder;
import com.docgram.service.support.TransactionRunner;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Answers a stored question with retrieval-augmented generation over the post's chunks.
 *
 * <p>The assistant placeholder is looked up by the question id before one is created, so retried
 * attempts write into the same message. Every job ends with the placeholder {@code ANSWERED} or
 * {@code FAILED}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerGenerationService implements BackgroundJobHandler<AnswerJob> {

  static final String NO_CONTEXT_ANSWER =
      "I couldn't find any processed content for this document yet. "
          + "Please try again once processing has finished.";
  static final String FAILURE_ANSWER =
      "Sorry, I'm having trouble processing your question right now.";

  private final ConversationRepository conversationRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final EmbeddingService embeddingService;
  private final PostChunkIndexService chunkIndexService;
  private final RagContextBuilder contextBuilder;
  private final PostAnswerAgent answerAgent;
  private final TransactionRunner transactionRunner;
  private final DocgramProperties properties;
  private final MeterRegistry meterRegistry;

  /** What a job needs to know about its post, read once while the session is open. */
  record AnswerTarget(
      UUID placeholderId,
      boolean alreadyFinished,
      UUID postId,
      String title,
      String description) {}

  @Override
  public Class<AnswerJob> jobType() {
    return AnswerJob.class;
  }

  @Override
  @Timed(value = "chat.answer", description = "Time to generate an answer")
  public void handle(AnswerJob job) {
    AnswerTarget target = preparePlaceholder(job);
    if (target.alreadyFinished()) {
      log.info("Question {} already answered, skipping", job.questionMessageId());
      return;
    }

    String augmentedQuery = augment(job.question(), target);
    List<Float> queryEmbedding = embeddingService.embedText(augmentedQuery);
    if (queryEmbedding.isEmpty()) {
      throw new IllegalStateException("Question embedding unavailable");
    }

    DocgramProperties.Retrieval retrieval = properties.getRetrieval();
    List<PostChunk> chunks =
        chunkIndexService.searchPost(target.postId(), queryEmbedding, retrieval.getTopK());
    if (chunks.isEmpty()) {
      log.warn("No chunks found for post {}, answering without context", target.postId());
      meterRegistry.counter("chat.answer.no_context").increment();
      complete(target.placeholderId(), NO_CONTEXT_ANSWER);
      return;
    }

    String context =
        contextBuilder.buildContext(chunks, target.title(), retrieval.getMaxContextChars());
    String history =
        contextBuilder.buildHistory(recentHistory(job, target, retrieval.getHistorySize()));

    String answer = answerAgent.answer(target.title(), history, context, job.question());
    if (answer == null || answer.isBlank()) {
      throw new IllegalStateException("Answer agent returned an empty response");
    }
    complete(target.placeholderId(), answer.trim());
    meterRegistry.counter("chat.answer.success").increment();
    log.info(
        "Answered question {} using {} chunk(s) of post {}",
        job.questionMessageId(),
        chunks.size(),
        target.postId());
  }

  @Override
  public void onFailure(AnswerJob job, Exception cause) {
    meterRegistry.counter("chat.answer.failure").increment();
    log.error("Answer for question {} failed: {}", job.questionMessageId(), cause.getMessage());
    transactionRunner.inNewTransaction(
        "answer to " + job.questionMessageId(),
        () -> {
          conversationRepository
              .findById(job.conversationId())
              .ifPresentOrElse(
                  conversation -> {
                    ChatMessage placeholder = findOrCreatePlaceholder(conversation, job);
                    if (!placeholder.getStatus().isTerminal()) {
                      placeholder.markFailed(FAILURE_ANSWER);
                      chatMessageRepository.saveAndFlush(placeholder);
                    }
                  },
                  () -> log.warn("Conversation {} no longer exists", job.conversationId()));
          return null;
        });
  }

  private AnswerTarget preparePlaceholder(AnswerJob job) {
    return transactionRunner.inNewTransaction(
        "answer to " + job.questionMessageId(),
        () -> {
          Conversation conversation =
              conversationRepository
                  .findById(job.conversationId())
                  .orElseThrow(
                      () ->
                          new IllegalStateException(
                              "Conversation " + job.conversationId() + " not found"));
          ChatMessage placeholder = findOrCreatePlaceholder(conversation, job);
          Post post = conversation.getPost();
          return new AnswerTarget(
              placeholder.getId(),
              placeholder.getStatus().isTerminal(),
              post.getId(),
              post.getTitle(),
              post.getDescription());
        });
  }

  private ChatMessage findOrCreatePlaceholder(Conversation conversation, AnswerJob job) {
    return chatMessageRepository
        .findFirstByReplyToIdAndRole(job.questionMessageId(), MessageRole.ASSISTANT)
        .orElseGet(
            () ->
                chatMessageRepository.saveAndFlush(
                    ChatMessage.placeholderFor(conversation, job.questionMessageId())));
  }

  private void complete(UUID placeholderId, String answer) {
    transactionRunner.inNewTransaction(
        "message " + placeholderId,
        () -> {
          ChatMessage placeholder =
              chatMessageRepository
                  .findById(placeholderId)
                  .orElseThrow(
                      () -> new IllegalStateException("Placeholder " + placeholderId + " gone"));
          placeholder.markAnswered(answer);
          return chatMessageRepository.saveAndFlush(placeholder);
        });
  }

  /** Earlier turns, oldest first, excluding the question being answered and its placeholder. */
  private List<ChatMessage> recentHistory(AnswerJob job, AnswerTarget target, int historySize) {
    if (historySize <= 0) {
      return List.of();
    }
    List<ChatMessage> newestFirst =
        chatMessageRepository.findRecentMessages(
            job.conversationId(), OffsetLimitRequest.of(0, historySize + 2));
    List<ChatMessage> history = new ArrayList<>();
    for (ChatMessage message : newestFirst) {
      if (message.getId().equals(job.questionMessageId())
          || message.getId().equals(target.placeholderId())) {
        continue;
      }
      if (history.size() == historySize) {
        break;
      }
      history.add(message);
    }
    Collections.reverse(history);
    return history;
  }

  private static String augment(String question, AnswerTarget target) {
    StringBuilder query = new StringBuilder(question);
    query.append(" in the PDF document titled: ").append(target.title());
    if (target.description() != null && !target.description().isBlank()) {
      query.append("\n Description: ").append(target.description());
    }
    return query.toString();
  }
}
