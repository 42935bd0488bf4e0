package com.chatrelay.backend.chat.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.UuidGenerator;

/**
 * File attached to a user message. Rows are created by the upload layer with a {@code null}
 * message id and linked when the message is sent.
 */
@Entity
@Table(name = "message_attachment")
public class MessageAttachment {

  @Id @GeneratedValue @UuidGenerator private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private UUID tenantId;

  @Column(name = "message_id")
  private UUID messageId;

  @Enumerated(EnumType.STRING)
  @Column(name = "kind", nullable = false, length = 16)
  private AttachmentKind kind;

  @Column(name = "file_name", nullable = false, length = 255)
  private String fileName;

  @Column(name = "mime_type", nullable = false, length = 128)
  private String mimeType;

  @Column(name = "storage_path", nullable = false, length = 1024)
  private String storagePath;

  @Column(name = "size_bytes", nullable = false)
  private long sizeBytes;

  @Column(name = "extracted_text", columnDefinition = "TEXT")
  private String extractedText;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected MessageAttachment() {}

  public MessageAttachment(
      UUID tenantId,
      AttachmentKind kind,
      String fileName,
      String mimeType,
      String storagePath,
      long sizeBytes) {
    this.tenantId = tenantId;
    this.kind = kind;
    this.fileName = fileName;
    this.mimeType = mimeType;
    this.storagePath = storagePath;
    this.sizeBytes = sizeBytes;
  }

  @PrePersist
  void onCreate() {
    createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getMessageId() {
    return messageId;
  }

  public void setMessageId(UUID messageId) {
    this.messageId = messageId;
  }

  public AttachmentKind getKind() {
    return kind;
  }

  public String getFileName() {
    return fileName;
  }

  public String getMimeType() {
    return mimeType;
  }

  public String getStoragePath() {
    return storagePath;
  }

  public long getSizeBytes() {
    return sizeBytes;
  }

  public String getExtractedText() {
    return extractedText;
  }

  public void setExtractedText(String extractedText) {
    this.extractedText = extractedText;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
