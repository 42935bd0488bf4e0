package com.chatrelay.backend.chat.persistence;

import com.chatrelay.backend.chat.domain.MessageAttachment;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MessageAttachmentRepository extends JpaRepository<MessageAttachment, UUID> {

  List<MessageAttachment> findByMessageIdInOrderByCreatedAtAsc(Collection<UUID> messageIds);

  List<MessageAttachment> findByIdInAndTenantIdAndMessageIdIsNull(
      Collection<UUID> ids, UUID tenantId);
}
