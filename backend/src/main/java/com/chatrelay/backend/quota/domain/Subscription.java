package com.chatrelay.backend.quota.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A tenant's billing-cycle grant. All counters are in cost units. {@code weekStart} is anchored
 * to {@code startsAt} and only ever advances by whole cycles.
 */
@Entity
@Table(name = "subscription")
public class Subscription {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "tenant_id", nullable = false)
  private UUID tenantId;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "plan_id", nullable = false)
  private SubscriptionPlan plan;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 16)
  private SubscriptionStatus status = SubscriptionStatus.ACTIVE;

  @Column(name = "starts_at", nullable = false)
  private Instant startsAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "token_quota", nullable = false)
  private long tokenQuota;

  @Column(name = "tokens_used", nullable = false)
  private long tokensUsed;

  @Column(name = "window_start")
  private Instant windowStart;

  @Column(name = "window_used", nullable = false)
  private long windowUsed;

  @Column(name = "week_start")
  private Instant weekStart;

  @Column(name = "week_used", nullable = false)
  private long weekUsed;

  @Column(name = "bonus_used", nullable = false)
  private long bonusUsed;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Subscription() {}

  public Subscription(
      UUID tenantId, SubscriptionPlan plan, Instant startsAt, Instant expiresAt, long tokenQuota) {
    this.tenantId = tenantId;
    this.plan = plan;
    this.startsAt = startsAt;
    this.expiresAt = expiresAt;
    this.tokenQuota = tokenQuota;
  }

  @PrePersist
  void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }

  public boolean isActiveAt(Instant now) {
    return status == SubscriptionStatus.ACTIVE
        && !startsAt.isAfter(now)
        && expiresAt.isAfter(now);
  }

  public long windowBudget() {
    return plan != null ? plan.getWindowBudget() : 0L;
  }

  public long weeklyBudget() {
    return plan != null ? plan.getWeeklyBudget() : 0L;
  }

  public void addUsage(long units) {
    tokensUsed += units;
    windowUsed += units;
    long weeklyBudget = weeklyBudget();
    if (weeklyBudget <= 0 || weekUsed < weeklyBudget) {
      weekUsed += units;
    } else {
      bonusUsed += units;
    }
  }

  public void resetWindow(Instant start) {
    windowStart = start;
    windowUsed = 0;
  }

  public void resetCycle(Instant start) {
    weekStart = start;
    weekUsed = 0;
    bonusUsed = 0;
  }

  public Long getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public SubscriptionPlan getPlan() {
    return plan;
  }

  public SubscriptionStatus getStatus() {
    return status;
  }

  public void setStatus(SubscriptionStatus status) {
    this.status = status;
  }

  public Instant getStartsAt() {
    return startsAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public void setExpiresAt(Instant expiresAt) {
    this.expiresAt = expiresAt;
  }

  public long getTokenQuota() {
    return tokenQuota;
  }

  public void setTokenQuota(long tokenQuota) {
    this.tokenQuota = tokenQuota;
  }

  public long getTokensUsed() {
    return tokensUsed;
  }

  public void setTokensUsed(long tokensUsed) {
    this.tokensUsed = tokensUsed;
  }

  public Instant getWindowStart() {
    return windowStart;
  }

  public long getWindowUsed() {
    return windowUsed;
  }

  public void setWindowUsed(long windowUsed) {
    this.windowUsed = windowUsed;
  }

  public Instant getWeekStart() {
    return weekStart;
  }

  public void setWeekStart(Instant weekStart) {
    this.weekStart = weekStart;
  }

  public long getWeekUsed() {
    return weekUsed;
  }

  public void setWeekUsed(long weekUsed) {
    this.weekUsed = weekUsed;
  }

  public long getBonusUsed() {
    return bonusUsed;
  }

  public void setBonusUsed(long bonusUsed) {
    this.bonusUsed = bonusUsed;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
