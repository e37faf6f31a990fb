package com.docgram.job;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Hands jobs to the worker.
 *
 * <p>Inside a transaction the job is submitted only after commit, so the worker never sees rows
 * that are not yet visible; a rolled-back transaction dispatches nothing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BackgroundJobDispatcher {

  private final BackgroundJobWorker worker;
  private final MeterRegistry meterRegistry;

  public void dispatch(BackgroundJob job) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, submitting job {}", job.describe());
              submit(job);
            }
          });
    } else {
      submit(job);
    }
  }

  private void submit(BackgroundJob job) {
    try {
      worker.submit(job);
      meterRegistry.counter("jobs.dispatched", "type", job.getClass().getSimpleName()).increment();
    } catch (TaskRejectedException e) {
      // the request itself already succeeded
      log.error("Background queue full, dropped job {}: {}", job.describe(), e.getMessage());
      meterRegistry.counter("jobs.rejected", "type", job.getClass().getSimpleName()).increment();
    }
  }
}
