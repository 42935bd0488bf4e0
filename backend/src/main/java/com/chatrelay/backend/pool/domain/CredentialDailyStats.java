package com.chatrelay.backend.pool.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDate;

/** Per-day traffic aggregate of a single credential. Rows are written by native upserts. */
@Entity
@Table(
    name = "credential_daily_stats",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_credential_daily_stats_day",
            columnNames = {"credential_id", "stat_date"}))
public class CredentialDailyStats {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "credential_id", nullable = false)
  private Long credentialId;

  @Column(name = "stat_date", nullable = false)
  private LocalDate statDate;

  @Column(name = "tokens_in", nullable = false)
  private long tokensIn;

  @Column(name = "tokens_out", nullable = false)
  private long tokensOut;

  @Column(name = "cache_creation_tokens", nullable = false)
  private long cacheCreationTokens;

  @Column(name = "cache_read_tokens", nullable = false)
  private long cacheReadTokens;

  @Column(name = "request_count", nullable = false)
  private long requestCount;

  @Column(name = "error_count", nullable = false)
  private long errorCount;

  @Column(name = "cost_units", nullable = false)
  private long costUnits;

  protected CredentialDailyStats() {}

  public Long getId() {
    return id;
  }

  public Long getCredentialId() {
    return credentialId;
  }

  public LocalDate getStatDate() {
    return statDate;
  }

  public long getTokensIn() {
    return tokensIn;
  }

  public long getTokensOut() {
    return tokensOut;
  }

  public long getCacheCreationTokens() {
    return cacheCreationTokens;
  }

  public long getCacheReadTokens() {
    return cacheReadTokens;
  }

  public long getRequestCount() {
    return requestCount;
  }

  public long getErrorCount() {
    return errorCount;
  }

  public long getCostUnits() {
    return costUnits;
  }
}
