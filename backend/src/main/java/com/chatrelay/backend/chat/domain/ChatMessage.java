package com.chatrelay.backend.chat.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "chat_message")
public class ChatMessage {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "conversation_id", nullable = false)
  private Conversation conversation;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 32)
  private ChatRole role;

  @Column(name = "content", nullable = false, columnDefinition = "TEXT")
  private String content;

  @Column(name = "thinking", columnDefinition = "TEXT")
  private String thinking;

  @Column(name = "sequence_number", nullable = false)
  private Integer sequenceNumber;

  @Column(name = "input_tokens", nullable = false)
  private long inputTokens;

  @Column(name = "output_tokens", nullable = false)
  private long outputTokens;

  @Column(name = "cache_creation_tokens", nullable = false)
  private long cacheCreationTokens;

  @Column(name = "cache_read_tokens", nullable = false)
  private long cacheReadTokens;

  /** Set once the message has been folded into a summary; excluded from future context. */
  @Column(name = "compacted", nullable = false)
  private boolean compacted;

  @Column(name = "is_summary", nullable = false)
  private boolean summary;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ChatMessage() {}

  public ChatMessage(
      Conversation conversation, ChatRole role, String content, Integer sequenceNumber) {
    this.conversation = conversation;
    this.role = role;
    this.content = content;
    this.sequenceNumber = sequenceNumber;
  }

  public static ChatMessage summaryOf(
      Conversation conversation, String content, Integer sequenceNumber, Instant createdAt) {
    ChatMessage message =
        new ChatMessage(conversation, ChatRole.ASSISTANT, content, sequenceNumber);
    message.summary = true;
    message.createdAt = createdAt;
    return message;
  }

  @PrePersist
  void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public UUID getId() {
    return id;
  }

  public Conversation getConversation() {
    return conversation;
  }

  public ChatRole getRole() {
    return role;
  }

  public String getContent() {
    return content;
  }

  public void setContent(String content) {
    this.content = content;
  }

  public String getThinking() {
    return thinking;
  }

  public void setThinking(String thinking) {
    this.thinking = thinking;
  }

  public Integer getSequenceNumber() {
    return sequenceNumber;
  }

  public long getInputTokens() {
    return inputTokens;
  }

  public void setInputTokens(long inputTokens) {
    this.inputTokens = inputTokens;
  }

  public long getOutputTokens() {
    return outputTokens;
  }

  public void setOutputTokens(long outputTokens) {
    this.outputTokens = outputTokens;
  }

  public long getCacheCreationTokens() {
    return cacheCreationTokens;
  }

  public void setCacheCreationTokens(long cacheCreationTokens) {
    this.cacheCreationTokens = cacheCreationTokens;
  }

  public long getCacheReadTokens() {
    return cacheReadTokens;
  }

  public void setCacheReadTokens(long cacheReadTokens) {
    this.cacheReadTokens = cacheReadTokens;
  }

  public long recordedTokens() {
    return inputTokens + outputTokens;
  }

  public boolean isCompacted() {
    return compacted;
  }

  public void setCompacted(boolean compacted) {
    this.compacted = compacted;
  }

  public boolean isSummary() {
    return summary;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
