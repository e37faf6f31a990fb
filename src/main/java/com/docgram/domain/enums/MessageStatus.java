package com.docgram.domain.enums;

/**
 * Lifecycle of a chat message.
 *
 * <p>User messages are always {@link #SENT}. Assistant messages start {@link #PENDING} and end in
 * either {@link #ANSWERED} or {@link #FAILED}; there is no way back to pending.
 */
public enum MessageStatus {
  SENT,
  PENDING,
  ANSWERED,
  FAILED;

  public boolean isTerminal() {
    return this == ANSWERED || this == FAILED;
  }
}
