package com.chatrelay.backend.chat.persistence;

import com.chatrelay.backend.chat.domain.Conversation;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

  Optional<Conversation> findByIdAndTenantId(UUID id, UUID tenantId);
}
