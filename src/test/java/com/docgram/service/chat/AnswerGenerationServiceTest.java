package com.docgram.service.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.docgram.agent.PostAnswerAgent;
import com.docgram.config.DocgramProperties;
import com.docgram.domain.entity.ChatMessage;
import com.docgram.domain.entity.Conversation;
import com.docgram.domain.entity.Post;
import com.docgram.domain.enums.MessageRole;
import com.docgram.domain.enums.MessageStatus;
import com.docgram.domain.repository.ChatMessageRepository;
import com.docgram.domain.repository.ConversationRepository;
import com.docgram.elasticsearch.PostChunk;
import com.docgram.elasticsearch.PostChunkIndexService;
import com.docgram.job.AnswerJob;
import com.docgram.service.rag.EmbeddingService;
import com.docgram.service.rag.RagContextBuilder;
import com.docgram.service.support.TransactionRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AnswerGenerationService Tests")
class AnswerGenerationServiceTest {

  private static final List<Float> EMBEDDING = List.of(0.1f, 0.2f, 0.3f);

  @Mock private ConversationRepository conversationRepository;
  @Mock private ChatMessageRepository chatMessageRepository;
  @Mock private EmbeddingService embeddingService;
  @Mock private PostChunkIndexService chunkIndexService;
  @Mock private PostAnswerAgent answerAgent;
  @Mock private TransactionRunner transactionRunner;

  private SimpleMeterRegistry meterRegistry;
  private AnswerGenerationService answerService;

  private final UUID postId = UUID.randomUUID();
  private final UUID conversationId = UUID.randomUUID();
  private final UUID questionId = UUID.randomUUID();
  private final AtomicReference<ChatMessage> placeholder = new AtomicReference<>();
  private AnswerJob job;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    answerService =
        new AnswerGenerationService(
            conversationRepository,
            chatMessageRepository,
            embeddingService,
            chunkIndexService,
            new RagContextBuilder(),
            answerAgent,
            transactionRunner,
            new DocgramProperties(),
            meterRegistry);

    Post post =
        Post.builder().id(postId).title("Tax Guide").description("2024 edition").build();
    Conversation conversation = Conversation.builder().id(conversationId).post(post).build();
    job = new AnswerJob(conversationId, questionId, "What is the deadline?");

    when(transactionRunner.inNewTransaction(anyString(), any()))
        .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(1)).get());
    when(conversationRepository.findById(conversationId)).thenReturn(Optional.of(conversation));
    when(chatMessageRepository.findFirstByReplyToIdAndRole(questionId, MessageRole.ASSISTANT))
        .thenAnswer(inv -> Optional.ofNullable(placeholder.get()));
    when(chatMessageRepository.saveAndFlush(any(ChatMessage.class)))
        .thenAnswer(
            inv -> {
              ChatMessage message = inv.getArgument(0);
              if (message.getId() == null) {
                message.setId(UUID.randomUUID());
              }
              placeholder.set(message);
              return message;
            });
    when(chatMessageRepository.findById(any(UUID.class)))
        .thenAnswer(inv -> Optional.ofNullable(placeholder.get()));
    when(chatMessageRepository.findRecentMessages(eq(conversationId), any(Pageable.class)))
        .thenReturn(List.of());
    when(embeddingService.embedText(anyString())).thenReturn(EMBEDDING);
    when(chunkIndexService.searchPost(postId, EMBEDDING, 3))
        .thenReturn(List.of(chunk("The filing deadline is April 15.")));
    when(answerAgent.answer(anyString(), anyString(), anyString(), anyString()))
        .thenReturn("  April 15.  ");
  }

  @Test
  void shouldAnswerFromRetrievedChunks() {
    // When
    answerService.handle(job);

    // Then
    ChatMessage answer = placeholder.get();
    assertThat(answer.getRole()).isEqualTo(MessageRole.ASSISTANT);
    assertThat(answer.getReplyToId()).isEqualTo(questionId);
    assertThat(answer.getStatus()).isEqualTo(MessageStatus.ANSWERED);
    assertThat(answer.getContent()).isEqualTo("April 15.");
    assertThat(meterRegistry.counter("chat.answer.success").count()).isEqualTo(1.0);
  }

  @Test
  void shouldPassContextAndOriginalQuestionToAgent() {
    // When
    answerService.handle(job);

    // Then
    ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
    verify(answerAgent)
        .answer(eq("Tax Guide"), eq("(none)"), context.capture(), eq("What is the deadline?"));
    assertThat(context.getValue())
        .isEqualTo("Source: Tax Guide\nThe filing deadline is April 15.\n---\n");
  }

  @Test
  void shouldCiteCurrentPostTitle_whenPostRenamedAfterIndexing() {
    // Given
    PostChunk stale =
        PostChunk.builder().postId(postId).title("Draft").content("Due in April.").build();
    when(chunkIndexService.searchPost(postId, EMBEDDING, 3)).thenReturn(List.of(stale));

    // When
    answerService.handle(job);

    // Then
    ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
    verify(answerAgent).answer(anyString(), anyString(), context.capture(), anyString());
    assertThat(context.getValue()).isEqualTo("Source: Tax Guide\nDue in April.\n---\n");
  }

  @Test
  void shouldAugmentEmbeddingQueryWithTitleAndDescription() {
    // When
    answerService.handle(job);

    // Then
    verify(embeddingService)
        .embedText(
            "What is the deadline? in the PDF document titled: Tax Guide\n"
                + " Description: 2024 edition");
  }

  @Test
  void shouldAnswerWithFallback_whenNoChunksFound() {
    // Given
    when(chunkIndexService.searchPost(postId, EMBEDDING, 3)).thenReturn(List.of());

    // When
    answerService.handle(job);

    // Then
    assertThat(placeholder.get().getStatus()).isEqualTo(MessageStatus.ANSWERED);
    assertThat(placeholder.get().getContent())
        .isEqualTo(AnswerGenerationService.NO_CONTEXT_ANSWER);
    verify(answerAgent, never()).answer(anyString(), anyString(), anyString(), anyString());
    assertThat(meterRegistry.counter("chat.answer.no_context").count()).isEqualTo(1.0);
  }

  @Test
  void shouldIncludeEarlierTurnsOldestFirst_excludingCurrentQuestion() {
    // Given
    ChatMessage currentQuestion = message(questionId, MessageRole.USER, "What is the deadline?");
    ChatMessage earlierAnswer =
        message(UUID.randomUUID(), MessageRole.ASSISTANT, "It covers federal taxes.");
    ChatMessage earlierQuestion =
        message(UUID.randomUUID(), MessageRole.USER, "What does it cover?");
    when(chatMessageRepository.findRecentMessages(eq(conversationId), any(Pageable.class)))
        .thenReturn(List.of(currentQuestion, earlierAnswer, earlierQuestion));

    // When
    answerService.handle(job);

    // Then
    verify(answerAgent)
        .answer(
            anyString(),
            eq("User: What does it cover?\nAssistant: It covers federal taxes.\n"),
            anyString(),
            anyString());
  }

  @Test
  void shouldThrow_whenQuestionCannotBeEmbedded() {
    // Given
    when(embeddingService.embedText(anyString())).thenReturn(List.of());

    // When / Then
    assertThatThrownBy(() -> answerService.handle(job)).isInstanceOf(IllegalStateException.class);
    assertThat(placeholder.get().getStatus()).isEqualTo(MessageStatus.PENDING);
  }

  @Test
  void shouldThrow_whenAgentReturnsBlankAnswer() {
    when(answerAgent.answer(anyString(), anyString(), anyString(), anyString())).thenReturn(" ");

    assertThatThrownBy(() -> answerService.handle(job)).isInstanceOf(IllegalStateException.class);
  }

  @Nested
  @DisplayName("repeated attempts")
  class RepeatedAttempts {

    @Test
    void shouldReuseExistingPlaceholder_whenRetried() {
      // Given: an earlier attempt created the placeholder and then failed
      when(embeddingService.embedText(anyString()))
          .thenReturn(List.of())
          .thenReturn(EMBEDDING);
      assertThatThrownBy(() -> answerService.handle(job))
          .isInstanceOf(IllegalStateException.class);
      UUID firstPlaceholderId = placeholder.get().getId();

      // When
      answerService.handle(job);

      // Then
      assertThat(placeholder.get().getId()).isEqualTo(firstPlaceholderId);
      assertThat(placeholder.get().getStatus()).isEqualTo(MessageStatus.ANSWERED);
    }

    @Test
    void shouldSkip_whenQuestionAlreadyAnswered() {
      // Given
      answerService.handle(job);

      // When
      answerService.handle(job);

      // Then
      verify(answerAgent, times(1)).answer(anyString(), anyString(), anyString(), anyString());
      verify(chunkIndexService, times(1)).searchPost(any(), any(), anyInt());
    }
  }

  @Nested
  @DisplayName("terminal failure")
  class TerminalFailure {

    @Test
    void shouldMarkPlaceholderFailed() {
      // When
      answerService.onFailure(job, new IllegalStateException("provider down"));

      // Then
      assertThat(placeholder.get().getStatus()).isEqualTo(MessageStatus.FAILED);
      assertThat(placeholder.get().getContent()).isEqualTo(AnswerGenerationService.FAILURE_ANSWER);
      assertThat(meterRegistry.counter("chat.answer.failure").count()).isEqualTo(1.0);
    }

    @Test
    void shouldLeaveAnsweredPlaceholderUntouched() {
      // Given
      answerService.handle(job);

      // When
      answerService.onFailure(job, new IllegalStateException("late failure"));

      // Then
      assertThat(placeholder.get().getStatus()).isEqualTo(MessageStatus.ANSWERED);
    }

    @Test
    void shouldNotThrow_whenConversationDeleted() {
      when(conversationRepository.findById(conversationId)).thenReturn(Optional.empty());

      answerService.onFailure(job, new IllegalStateException("x"));

      verify(chatMessageRepository, never()).saveAndFlush(any());
    }
  }

  private PostChunk chunk(String content) {
    return PostChunk.builder().postId(postId).title("Tax Guide").content(content).build();
  }

  private static ChatMessage message(UUID id, MessageRole role, String content) {
    MessageStatus status = role == MessageRole.USER ? MessageStatus.SENT : MessageStatus.ANSWERED;
    return ChatMessage.builder().id(id).role(role).status(status).content(content).build();
  }
}
