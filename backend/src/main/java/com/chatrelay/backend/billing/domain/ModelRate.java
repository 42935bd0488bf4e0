package com.chatrelay.backend.billing.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "model_rate")
public class ModelRate {

  @Id
  @Column(name = "model_id", nullable = false, length = 128)
  private String modelId;

  @Column(name = "display_name", length = 128)
  private String displayName;

  @Column(name = "model_multiplier", nullable = false, precision = 12, scale = 4)
  private BigDecimal modelMultiplier;

  @Column(name = "output_multiplier", nullable = false, precision = 12, scale = 4)
  private BigDecimal outputMultiplier;

  @Column(name = "cache_read_multiplier", nullable = false, precision = 12, scale = 4)
  private BigDecimal cacheReadMultiplier;

  @Column(name = "cache_creation_multiplier", nullable = false, precision = 12, scale = 4)
  private BigDecimal cacheCreationMultiplier;

  @Column(name = "enabled", nullable = false)
  private boolean enabled = true;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ModelRate() {}

  public ModelRate(
      String modelId,
      BigDecimal modelMultiplier,
      BigDecimal outputMultiplier,
      BigDecimal cacheReadMultiplier,
      BigDecimal cacheCreationMultiplier) {
    this.modelId = modelId;
    this.modelMultiplier = modelMultiplier;
    this.outputMultiplier = outputMultiplier;
    this.cacheReadMultiplier = cacheReadMultiplier;
    this.cacheCreationMultiplier = cacheCreationMultiplier;
  }

  @PrePersist
  @PreUpdate
  void touch() {
    updatedAt = Instant.now();
  }

  public String getModelId() {
    return modelId;
  }

  public String getDisplayName() {
    return displayName;
  }

  public void setDisplayName(String displayName) {
    this.displayName = displayName;
  }

  public BigDecimal getModelMultiplier() {
    return modelMultiplier;
  }

  public BigDecimal getOutputMultiplier() {
    return outputMultiplier;
  }

  public BigDecimal getCacheReadMultiplier() {
    return cacheReadMultiplier;
  }

  public BigDecimal getCacheCreationMultiplier() {
    return cacheCreationMultiplier;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
