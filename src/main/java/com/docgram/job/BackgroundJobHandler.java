package com.docgram.job;

/**
 * Executes one type of background job.
 *
 * <p>{@link #handle} may be invoked more than once for the same job when an attempt fails, so it
 * must be safe to repeat. {@link #onFailure} runs once, after the last attempt.
 *
 * @param <J> the job type handled
 */
public interface BackgroundJobHandler<J extends BackgroundJob> {

  Class<J> jobType();

  void handle(J job);

  /**
   * Records the terminal failure of a job.
   *
   * @param job the job that failed
   * @param cause the error of the last attempt
   */
  void onFailure(J job, Exception cause);
}
