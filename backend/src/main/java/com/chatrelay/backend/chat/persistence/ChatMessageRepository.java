package com.chatrelay.backend.chat.persistence;

import com.chatrelay.backend.chat.domain.ChatMessage;
import com.chatrelay.backend.chat.domain.Conversation;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessage, UUID> {

  List<ChatMessage> findByConversationAndCompactedFalseOrderBySequenceNumberAscCreatedAtAsc(
      Conversation conversation);

  Optional<ChatMessage> findTopByConversationOrderBySequenceNumberDesc(Conversation conversation);

  long countByConversationAndSummaryFalse(Conversation conversation);

  @Modifying
  @Query("update ChatMessage m set m.compacted = true where m.id in :ids")
  int markCompacted(@Param("ids") Collection<UUID> ids);
}
