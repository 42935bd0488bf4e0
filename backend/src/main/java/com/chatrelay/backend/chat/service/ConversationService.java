package com.chatrelay.backend.chat.service;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.chat.domain.ChatMessage;
import com.chatrelay.backend.chat.domain.ChatRole;
import com.chatrelay.backend.chat.domain.Conversation;
import com.chatrelay.backend.chat.domain.MessageAttachment;
import com.chatrelay.backend.chat.persistence.ChatMessageRepository;
import com.chatrelay.backend.chat.persistence.ConversationRepository;
import com.chatrelay.backend.chat.persistence.MessageAttachmentRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

/** Reads and writes the message history the relay and the compactor work on. */
@Service
public class ConversationService {

  private static final int TITLE_MAX_LENGTH = 255;

  private final ConversationRepository conversationRepository;
  private final ChatMessageRepository chatMessageRepository;
  private final MessageAttachmentRepository attachmentRepository;

  public ConversationService(
      ConversationRepository conversationRepository,
      ChatMessageRepository chatMessageRepository,
      MessageAttachmentRepository attachmentRepository) {
    this.conversationRepository = conversationRepository;
    this.chatMessageRepository = chatMessageRepository;
    this.attachmentRepository = attachmentRepository;
  }

  @Transactional(readOnly = true)
  public Conversation requireConversation(UUID tenantId, UUID conversationId) {
    return conversationRepository
        .findByIdAndTenantId(conversationId, tenantId)
        .orElseThrow(
            () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found"));
  }

  @Transactional
  public ChatMessage appendUserMessage(
      Conversation conversation, String content, List<UUID> attachmentIds) {
    Conversation managed = load(conversation.getId());
    ChatMessage message =
        chatMessageRepository.save(
            new ChatMessage(managed, ChatRole.USER, content, nextSequence(managed)));
    if (!CollectionUtils.isEmpty(attachmentIds)) {
      List<MessageAttachment> attachments =
          attachmentRepository.findByIdInAndTenantIdAndMessageIdIsNull(
              attachmentIds, managed.getTenantId());
      attachments.forEach(attachment -> attachment.setMessageId(message.getId()));
    }
    return message;
  }

  @Transactional(readOnly = true)
  public List<ChatMessage> loadLiveHistory(UUID conversationId) {
    return chatMessageRepository
        .findByConversationAndCompactedFalseOrderBySequenceNumberAscCreatedAtAsc(
            load(conversationId));
  }

  @Transactional(readOnly = true)
  public Map<UUID, List<MessageAttachment>> attachmentsByMessage(Collection<UUID> messageIds) {
    if (CollectionUtils.isEmpty(messageIds)) {
      return Map.of();
    }
    return attachmentRepository.findByMessageIdInOrderByCreatedAtAsc(messageIds).stream()
        .collect(
            Collectors.groupingBy(
                MessageAttachment::getMessageId, LinkedHashMap::new, Collectors.toList()));
  }

  /**
   * Stores the assistant reply of a finished (or aborted) session and writes the session's token
   * usage: prompt-side counters on the user message, output tokens on the reply.
   */
  @Transactional
  public ChatMessage completeTurn(
      UUID conversationId, UUID userMessageId, String content, String thinking, TokenUsage usage) {
    Conversation conversation = load(conversationId);
    TokenUsage safeUsage = usage != null ? usage : TokenUsage.EMPTY;
    if (userMessageId != null) {
      chatMessageRepository
          .findById(userMessageId)
          .ifPresent(
              userMessage -> {
                userMessage.setInputTokens(safeUsage.inputTokens());
                userMessage.setCacheCreationTokens(safeUsage.cacheCreationTokens());
                userMessage.setCacheReadTokens(safeUsage.cacheReadTokens());
              });
    }
    ChatMessage reply =
        new ChatMessage(
            conversation,
            ChatRole.ASSISTANT,
            content != null ? content : "",
            nextSequence(conversation));
    reply.setThinking(StringUtils.hasText(thinking) ? thinking : null);
    reply.setOutputTokens(safeUsage.outputTokens());
    return chatMessageRepository.save(reply);
  }

  /**
   * Folds {@code compactedIds} into a single summary record placed where the last compacted
   * message was.
   */
  @Transactional
  public ChatMessage applyCompaction(
      UUID conversationId,
      Collection<UUID> compactedIds,
      String summary,
      Integer sequenceNumber,
      Instant createdAt) {
    Conversation conversation = load(conversationId);
    chatMessageRepository.markCompacted(compactedIds);
    return chatMessageRepository.save(
        ChatMessage.summaryOf(conversation, summary, sequenceNumber, createdAt));
  }

  @Transactional(readOnly = true)
  public long countMessages(UUID conversationId) {
    return chatMessageRepository.countByConversationAndSummaryFalse(load(conversationId));
  }

  @Transactional
  public void updateTitle(UUID conversationId, String title) {
    if (!StringUtils.hasText(title)) {
      return;
    }
    String normalized = title.strip();
    if (normalized.length() > TITLE_MAX_LENGTH) {
      normalized = normalized.substring(0, TITLE_MAX_LENGTH);
    }
    load(conversationId).setTitle(normalized);
  }

  private Conversation load(UUID conversationId) {
    return conversationRepository
        .findById(conversationId)
        .orElseThrow(
            () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found"));
  }

  private int nextSequence(Conversation conversation) {
    return chatMessageRepository
        .findTopByConversationOrderBySequenceNumberDesc(conversation)
        .map(message -> message.getSequenceNumber() + 1)
        .orElse(0);
  }
}
