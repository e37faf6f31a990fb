package com.docgram.service.rag;

import com.docgram.domain.entity.ChatMessage;
import com.docgram.domain.enums.MessageRole;
import com.docgram.domain.enums.MessageStatus;
import com.docgram.elasticsearch.PostChunk;
import java.util.List;
import org.springframework.stereotype.Component;

/** Formats retrieved chunks and prior turns into the text blocks handed to the answer agent. */
@Component
public class RagContextBuilder {

  /**
   * Concatenates chunks in rank order as {@code Source:} blocks, stopping before the block that
   * would push the total past {@code maxChars}.
   *
   * @param postTitle the post's current title, used instead of the title stored on each chunk; when
   *     null the chunk's own title is used
   */
  public String buildContext(List<PostChunk> chunks, String postTitle, int maxChars) {
    StringBuilder assembled = new StringBuilder();
    for (PostChunk chunk : chunks) {
      String source = postTitle != null ? postTitle : chunk.getTitle();
      if (source == null) {
        source = "unknown";
      }
      String block = "Source: " + source + "\n" + chunk.getContent() + "\n---\n";
      if (assembled.length() + block.length() > maxChars) {
        break;
      }
      assembled.append(block);
    }
    return assembled.toString();
  }

  /** Renders earlier messages oldest first; pending and failed answers are left out. */
  public String buildHistory(List<ChatMessage> messagesOldestFirst) {
    StringBuilder history = new StringBuilder();
    for (ChatMessage message : messagesOldestFirst) {
      if (message.getStatus() == MessageStatus.PENDING
          || message.getStatus() == MessageStatus.FAILED) {
        continue;
      }
      String speaker = message.getRole() == MessageRole.USER ? "User" : "Assistant";
      history.append(speaker).append(": ").append(message.getContent()).append('\n');
    }
    return history.length() == 0 ? "(none)" : history.toString();
  }
}
