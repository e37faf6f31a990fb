package com.docgram.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Defines the role of a chat message sender. */
public enum MessageRole {
  /** Question asked by the user. */
  USER,

  /** Answer produced by the AI assistant. */
  ASSISTANT;

  /** Lowercase name used on the wire ({@code user} or {@code assistant}). */
  @JsonValue
  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
