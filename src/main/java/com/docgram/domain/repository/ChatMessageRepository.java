package com.docgram.domain.repository;

import com.docgram.domain.entity.ChatMessage;
import com.docgram.domain.enums.MessageRole;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ChatMessage entities. */
@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  /** Finds all messages for a conversation ordered by creation time ascending. */
  List<ChatMessage> findByConversationIdOrderByCreatedAtAsc(UUID conversationId);

  /** Finds the answer slot created for a question, if any. */
  Optional<ChatMessage> findFirstByReplyToIdAndRole(UUID replyToId, MessageRole role);

  /** Finds the most recent messages of a conversation, newest first. */
  @Query(
      "SELECT m FROM ChatMessage m WHERE m.conversation.id = :conversationId "
          + "ORDER BY m.createdAt DESC")
  List<ChatMessage> findRecentMessages(
      @Param("conversationId") UUID conversationId, Pageable pageable);

  /** Deletes every message of every conversation about a post. */
  @Modifying
  @Query(
      "DELETE FROM ChatMessage m WHERE m.conversation.id IN "
          + "(SELECT c.id FROM Conversation c WHERE c.post.id = :postId)")
  int deleteByPostId(@Param("postId") UUID postId);
}
