package com.docgram.service.support;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs short state updates from background jobs in their own transaction.
 *
 * <p>SQLite allows a single writer, so an update that loses the lock is retried in a fresh
 * transaction with linear backoff.
 */
@Component
@Slf4j
public class TransactionRunner {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final TransactionTemplate transactionTemplate;

  public TransactionRunner(PlatformTransactionManager transactionManager) {
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.transactionTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Executes the work in a new transaction and returns its result.
   *
   * @param description what is being updated, for logging
   * @param work the update
   */
  public <T> T inNewTransaction(String description, Supplier<T> work) {
    for (int attempt = 1; ; attempt++) {
      try {
        return transactionTemplate.execute(status -> work.get());
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update {} after {} retries", description, MAX_RETRIES);
          throw e;
        }
        log.warn("SQLite lock contention on {}, retry {}/{}", description, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted during retry", ie);
        }
      }
    }
  }
}
