package com.docgram.job;

import com.docgram.config.DocgramProperties;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Runs background jobs on the {@code backgroundJobExecutor} pool and owns their retries.
 *
 * <p>A job is attempted up to {@code docgram.jobs.max-attempts} times with linear backoff. After
 * the last failed attempt the handler's {@link BackgroundJobHandler#onFailure} is invoked.
 */
@Component
@Slf4j
public class BackgroundJobWorker {

  private final Map<Class<?>, BackgroundJobHandler<?>> handlers = new HashMap<>();
  private final DocgramProperties properties;
  private final MeterRegistry meterRegistry;

  public BackgroundJobWorker(
      List<BackgroundJobHandler<?>> handlers,
      DocgramProperties properties,
      MeterRegistry meterRegistry) {
    for (BackgroundJobHandler<?> handler : handlers) {
      BackgroundJobHandler<?> previous = this.handlers.put(handler.jobType(), handler);
      if (previous != null) {
        throw new IllegalStateException("Duplicate handler for " + handler.jobType());
      }
    }
    this.properties = properties;
    this.meterRegistry = meterRegistry;
  }

  /** Runs the job on the background executor. */
  @Async("backgroundJobExecutor")
  public void submit(BackgroundJob job) {
    run(job);
  }

  /** Runs the job on the calling thread, retrying failed attempts. */
  public void run(BackgroundJob job) {
    BackgroundJobHandler<BackgroundJob> handler = handlerFor(job);
    int maxAttempts = Math.max(1, properties.getJobs().getMaxAttempts());
    String jobType = job.getClass().getSimpleName();

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        handler.handle(job);
        meterRegistry.counter("jobs.completed", "type", jobType).increment();
        log.debug("Job {} completed on attempt {}", job.describe(), attempt);
        return;
      } catch (Exception e) {
        if (attempt == maxAttempts) {
          log.error(
              "Job {} failed after {} attempt(s): {}",
              job.describe(),
              maxAttempts,
              e.getMessage(),
              e);
          meterRegistry.counter("jobs.failed", "type", jobType).increment();
          reportFailure(handler, job, e);
          return;
        }
        log.warn(
            "Job {} attempt {}/{} failed: {}",
            job.describe(),
            attempt,
            maxAttempts,
            e.getMessage());
        meterRegistry.counter("jobs.retry", "type", jobType).increment();
        if (!backoff(attempt)) {
          reportFailure(handler, job, e);
          return;
        }
      }
    }
  }

  private void reportFailure(
      BackgroundJobHandler<BackgroundJob> handler, BackgroundJob job, Exception cause) {
    try {
      handler.onFailure(job, cause);
    } catch (RuntimeException e) {
      log.error("Failure callback of job {} threw: {}", job.describe(), e.getMessage(), e);
    }
  }

  /** Sleeps before the next attempt; returns false if interrupted. */
  private boolean backoff(int attempt) {
    long delay = properties.getJobs().getBackoffMs() * attempt;
    if (delay <= 0) {
      return true;
    }
    try {
      Thread.sleep(delay);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while backing off, giving up on retries");
      return false;
    }
  }

  @SuppressWarnings("unchecked")
  private BackgroundJobHandler<BackgroundJob> handlerFor(BackgroundJob job) {
    BackgroundJobHandler<?> handler = handlers.get(job.getClass());
    if (handler == null) {
      throw new IllegalArgumentException("No handler registered for " + job.getClass());
    }
    return (BackgroundJobHandler<BackgroundJob>) handler;
  }
}
