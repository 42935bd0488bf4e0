package com.chatrelay.backend.quota.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** Quota-relevant slice of a tenant. The lifetime grant backs trial and free tiers. */
@Entity
@Table(name = "tenant_account")
public class TenantAccount {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Column(name = "token_quota", nullable = false)
  private long tokenQuota;

  @Column(name = "token_used", nullable = false)
  private long tokenUsed;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TenantAccount() {}

  public TenantAccount(UUID id, long tokenQuota) {
    this.id = id;
    this.tokenQuota = tokenQuota;
  }

  @PrePersist
  void onCreate() {
    createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public long getTokenQuota() {
    return tokenQuota;
  }

  public void setTokenQuota(long tokenQuota) {
    this.tokenQuota = tokenQuota;
  }

  public long getTokenUsed() {
    return tokenUsed;
  }

  public void addTokenUsed(long units) {
    this.tokenUsed += units;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
