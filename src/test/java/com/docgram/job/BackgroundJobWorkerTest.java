package com.docgram.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.docgram.config.DocgramProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("BackgroundJobWorker Tests")
class BackgroundJobWorkerTest {

  @Mock private BackgroundJobHandler<PostProcessingJob> processingHandler;
  @Mock private BackgroundJobHandler<AnswerJob> answerHandler;

  private DocgramProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private BackgroundJobWorker worker;

  private final PostProcessingJob job = new PostProcessingJob(UUID.randomUUID());

  @BeforeEach
  void setUp() {
    when(processingHandler.jobType()).thenReturn(PostProcessingJob.class);
    when(answerHandler.jobType()).thenReturn(AnswerJob.class);
    properties = new DocgramProperties();
    properties.getJobs().setMaxAttempts(3);
    properties.getJobs().setBackoffMs(0);
    meterRegistry = new SimpleMeterRegistry();
    worker =
        new BackgroundJobWorker(
            List.of(processingHandler, answerHandler), properties, meterRegistry);
  }

  @Test
  void shouldRouteJobToHandlerForItsType() {
    // When
    worker.run(job);

    // Then
    verify(processingHandler).handle(job);
    verify(answerHandler, never()).handle(any());
    assertThat(meterRegistry.counter("jobs.completed", "type", "PostProcessingJob").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldRetry_whenAttemptFailsThenSucceeds() {
    // Given
    doThrow(new IllegalStateException("transient")).doNothing().when(processingHandler).handle(job);

    // When
    worker.run(job);

    // Then
    verify(processingHandler, times(2)).handle(job);
    verify(processingHandler, never()).onFailure(any(), any());
    assertThat(meterRegistry.counter("jobs.retry", "type", "PostProcessingJob").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldReportFailureOnce_whenAllAttemptsFail() {
    // Given
    IllegalStateException error = new IllegalStateException("permanent");
    doThrow(error).when(processingHandler).handle(job);

    // When
    worker.run(job);

    // Then
    verify(processingHandler, times(3)).handle(job);
    verify(processingHandler).onFailure(job, error);
    assertThat(meterRegistry.counter("jobs.failed", "type", "PostProcessingJob").count())
        .isEqualTo(1.0);
  }

  @Test
  void shouldNotPropagate_whenFailureCallbackThrows() {
    // Given
    doThrow(new IllegalStateException("boom")).when(processingHandler).handle(job);
    doThrow(new IllegalStateException("callback"))
        .when(processingHandler)
        .onFailure(eq(job), any());

    // When
    worker.run(job);

    // Then
    verify(processingHandler).onFailure(eq(job), any());
  }

  @Test
  void shouldAttemptOnce_whenMaxAttemptsIsOne() {
    // Given
    properties.getJobs().setMaxAttempts(1);
    doThrow(new IllegalStateException("boom")).when(processingHandler).handle(job);

    // When
    worker.run(job);

    // Then
    verify(processingHandler, times(1)).handle(job);
    verify(processingHandler).onFailure(eq(job), any());
  }

  @Test
  void shouldRejectJob_whenNoHandlerRegistered() {
    // Given
    BackgroundJobWorker onlyAnswers =
        new BackgroundJobWorker(List.of(answerHandler), properties, meterRegistry);

    // When / Then
    assertThatThrownBy(() -> onlyAnswers.run(job))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("PostProcessingJob");
  }

  @Test
  void shouldFailAtStartup_whenTwoHandlersClaimSameType() {
    assertThatThrownBy(
            () ->
                new BackgroundJobWorker(
                    List.of(processingHandler, processingHandler), properties, meterRegistry))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void shouldRunSubmittedJobOnCallingThread_whenNotProxied() {
    // Given
    doNothing().when(processingHandler).handle(job);

    // When
    worker.submit(job);

    // Then
    verify(processingHandler).handle(job);
  }
}
