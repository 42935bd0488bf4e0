package com.chatrelay.backend.quota.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.quota")
public class QuotaProperties {

  @NotNull private Duration windowLength = Duration.ofHours(5);

  /** 7.5 days. */
  @NotNull private Duration cycleLength = Duration.ofHours(180);

  /** Share of its own cycle budget at which a tenant counts as a heavy user. */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double heavyUserRatio = 0.9;

  /** Upper bound of a bonus allotment relative to the tenant's own cycle budget. */
  @DecimalMin("0.0")
  private double bonusCapRatio = 0.5;

  /** Lower bound on elapsed cycle days used when projecting consumption. */
  @DecimalMin("0.01")
  private double minElapsedDays = 0.5;

  public Duration getWindowLength() {
    return windowLength;
  }

  public void setWindowLength(Duration windowLength) {
    this.windowLength = windowLength;
  }

  public Duration getCycleLength() {
    return cycleLength;
  }

  public void setCycleLength(Duration cycleLength) {
    this.cycleLength = cycleLength;
  }

  public double getHeavyUserRatio() {
    return heavyUserRatio;
  }

  public void setHeavyUserRatio(double heavyUserRatio) {
    this.heavyUserRatio = heavyUserRatio;
  }

  public double getBonusCapRatio() {
    return bonusCapRatio;
  }

  public void setBonusCapRatio(double bonusCapRatio) {
    this.bonusCapRatio = bonusCapRatio;
  }

  public double getMinElapsedDays() {
    return minElapsedDays;
  }

  public void setMinElapsedDays(double minElapsedDays) {
    this.minElapsedDays = minElapsedDays;
  }
}
