package com.docgram.job;

/** A unit of background work. Implementations are immutable payloads. */
public interface BackgroundJob {

  /** Short identifier for logs and metrics. */
  String describe();
}
