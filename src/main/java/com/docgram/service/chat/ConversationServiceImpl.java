package com.docgram.service.chat;

import com.docgram.domain.entity.ChatMessage;
import com.docgram.domain.entity.Conversation;
import com.docgram.domain.entity.Post;
import com.docgram.domain.enums.MessageRole;
import com.docgram.domain.enums.MessageStatus;
import com.docgram.domain.repository.ChatMessageRepository;
import com.docgram.domain.repository.ConversationRepository;
import com.docgram.domain.repository.PostRepository;
import com.docgram.domain.repository.UserRepository;
import com.docgram.exception.ForbiddenException;
import com.docgram.exception.InvalidInputException;
import com.docgram.exception.ResourceNotFoundException;
import com.docgram.job.AnswerJob;
import com.docgram.job.BackgroundJobDispatcher;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of the ConversationService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationServiceImpl implements ConversationService {

  static final int MAX_QUERY_LENGTH = 1000;

  private final ConversationRepository conversationRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final PostRepository postRepository;
  private final UserRepository userRepository;
  private final BackgroundJobDispatcher jobDispatcher;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  @Timed(value = "chat.ask", description = "Time to accept a question")
  public ChatMessage ask(UUID postId, UUID userId, String query) {
    String question = query == null ? "" : query.trim();
    if (question.isEmpty() || question.length() > MAX_QUERY_LENGTH) {
      throw new InvalidInputException("Query must be between 1 and 1000 characters");
    }
    Post post = getVisiblePost(postId, userId);

    Conversation conversation =
        conversationRepository
            .findByPostIdAndUserId(postId, userId)
            .orElseGet(() -> startConversation(post, userId));

    ChatMessage message =
        chatMessageRepository.save(
            ChatMessage.builder()
                .conversation(conversation)
                .role(MessageRole.USER)
                .status(MessageStatus.SENT)
                .content(question)
                .build());

    jobDispatcher.dispatch(new AnswerJob(conversation.getId(), message.getId(), question));
    meterRegistry.counter("chat.questions").increment();
    log.info("Question {} on post {} queued for answering", message.getId(), postId);
    return message;
  }

  @Override
  @Transactional(readOnly = true)
  public List<ChatMessage> getMessages(UUID postId, UUID userId) {
    getVisiblePost(postId, userId);
    return conversationRepository
        .findByPostIdAndUserId(postId, userId)
        .map(c -> chatMessageRepository.findByConversationIdOrderByCreatedAtAsc(c.getId()))
        .orElse(List.of());
  }

  @Override
  @Transactional
  public void deleteMessage(UUID messageId, UUID userId) {
    ChatMessage message =
        chatMessageRepository
            .findById(messageId)
            .orElseThrow(() -> new ResourceNotFoundException("Message", messageId));
    if (!message.getConversation().getUser().getId().equals(userId)) {
      throw new ForbiddenException("Not authorized to delete this message");
    }
    chatMessageRepository.delete(message);
    log.debug("Deleted message {}", messageId);
  }

  private Conversation startConversation(Post post, UUID userId) {
    Conversation conversation =
        Conversation.builder()
            .post(post)
            .user(
                userRepository
                    .findById(userId)
                    .orElseThrow(() -> new ResourceNotFoundException("User", userId)))
            .title(post.getTitle())
            .build();
    log.info("Starting conversation on post {} for user {}", post.getId(), userId);
    return conversationRepository.save(conversation);
  }

  private Post getVisiblePost(UUID postId, UUID userId) {
    return postRepository
        .findById(postId)
        .filter(post -> post.isVisibleTo(userId))
        .orElseThrow(() -> new ResourceNotFoundException("Post", postId));
  }
}
