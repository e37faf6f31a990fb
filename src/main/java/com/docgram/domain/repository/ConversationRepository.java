package com.docgram.domain.repository;

import com.docgram.domain.entity.Conversation;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Conversation entities. */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

  Optional<Conversation> findByPostIdAndUserId(UUID postId, UUID userId);

  @Modifying
  @Query("DELETE FROM Conversation c WHERE c.post.id = :postId")
  int deleteByPostId(@Param("postId") UUID postId);
}
