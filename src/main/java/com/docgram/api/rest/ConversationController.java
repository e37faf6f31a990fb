package com.docgram.api.rest;

import com.docgram.api.dto.request.AskRequest;
import com.docgram.api.dto.response.ChatMessageResponse;
import com.docgram.domain.entity.ChatMessage;
import com.docgram.security.JwtAuthenticationFilter;
import com.docgram.service.chat.ConversationService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for chatting with a post's PDF.
 *
 * <p>Asking returns the stored question at once. The answer shows up in the message list as an
 * assistant message that starts out {@code PENDING} and is later {@code ANSWERED} or {@code
 * FAILED}; clients poll the list.
 */
@RestController
@RequestMapping("/posts")
@RequiredArgsConstructor
public class ConversationController {

  private final ConversationService conversationService;

  @PostMapping("/{postId}/messages")
  public ResponseEntity<ChatMessageResponse> ask(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId,
      @Valid @RequestBody AskRequest request) {
    ChatMessage question = conversationService.ask(postId, userId, request.getQuery());
    return ResponseEntity.ok(ChatMessageResponse.fromEntity(question));
  }

  @GetMapping("/{postId}/messages")
  public ResponseEntity<List<ChatMessageResponse>> getMessages(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID postId) {
    return ResponseEntity.ok(
        conversationService.getMessages(postId, userId).stream()
            .map(ChatMessageResponse::fromEntity)
            .toList());
  }

  @DeleteMapping("/messages/{messageId}")
  public ResponseEntity<Void> deleteMessage(
      @RequestAttribute(JwtAuthenticationFilter.USER_ID_ATTRIBUTE) UUID userId,
      @PathVariable UUID messageId) {
    conversationService.deleteMessage(messageId, userId);
    return ResponseEntity.noContent().build();
  }
}
