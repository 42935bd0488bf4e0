package com.chatrelay.backend.pool.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "upstream_credential")
public class UpstreamCredential {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Column(name = "base_url", nullable = false, length = 512)
  private String baseUrl;

  @Column(name = "api_key", nullable = false, length = 512)
  private String apiKey;

  @Column(name = "enabled", nullable = false)
  private boolean enabled = true;

  @Column(name = "priority", nullable = false)
  private int priority;

  @Column(name = "weight", nullable = false)
  private int weight = 1;

  @Column(name = "max_concurrency", nullable = false)
  private int maxConcurrency = 5;

  @Column(name = "group_multiplier", nullable = false, precision = 12, scale = 4)
  private BigDecimal groupMultiplier = BigDecimal.ONE;

  @Enumerated(EnumType.STRING)
  @Column(name = "health", nullable = false, length = 16)
  private CredentialHealth health = CredentialHealth.HEALTHY;

  @Column(name = "consecutive_errors", nullable = false)
  private int consecutiveErrors;

  @Column(name = "last_error", columnDefinition = "TEXT")
  private String lastError;

  @Column(name = "last_error_at")
  private Instant lastErrorAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected UpstreamCredential() {}

  public UpstreamCredential(String name, String baseUrl, String apiKey) {
    this.name = name;
    this.baseUrl = baseUrl;
    this.apiKey = apiKey;
  }

  @PrePersist
  void onCreate() {
    Instant now = Instant.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getBaseUrl() {
    return baseUrl;
  }

  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getPriority() {
    return priority;
  }

  public void setPriority(int priority) {
    this.priority = priority;
  }

  public int getWeight() {
    return weight;
  }

  public void setWeight(int weight) {
    this.weight = weight;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public void setMaxConcurrency(int maxConcurrency) {
    this.maxConcurrency = maxConcurrency;
  }

  public BigDecimal getGroupMultiplier() {
    return groupMultiplier;
  }

  public void setGroupMultiplier(BigDecimal groupMultiplier) {
    this.groupMultiplier = groupMultiplier;
  }

  public CredentialHealth getHealth() {
    return health;
  }

  public void setHealth(CredentialHealth health) {
    this.health = health;
  }

  public int getConsecutiveErrors() {
    return consecutiveErrors;
  }

  public void setConsecutiveErrors(int consecutiveErrors) {
    this.consecutiveErrors = consecutiveErrors;
  }

  public String getLastError() {
    return lastError;
  }

  public void setLastError(String lastError) {
    this.lastError = lastError;
  }

  public Instant getLastErrorAt() {
    return lastErrorAt;
  }

  public void setLastErrorAt(Instant lastErrorAt) {
    this.lastErrorAt = lastErrorAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
