package com.chatrelay.backend.pool.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.pool")
public class PoolProperties {

  /** Consecutive errors after which a credential is reported as degraded. */
  @Min(1)
  private int degradedThreshold = 3;

  /** Consecutive errors after which a credential leaves the candidate set. */
  @Min(1)
  private int downThreshold = 5;

  @Min(16)
  private int lastErrorMaxLength = 1000;

  private boolean loadOnStartup = true;

  /** Idle time after which a conversation's credential binding is forgotten. */
  @NotNull private Duration affinityTtl = Duration.ofHours(1);

  @Min(1)
  private long affinityMaximumSize = 50_000;

  public int getDegradedThreshold() {
    return degradedThreshold;
  }

  public void setDegradedThreshold(int degradedThreshold) {
    this.degradedThreshold = degradedThreshold;
  }

  public int getDownThreshold() {
    return downThreshold;
  }

  public void setDownThreshold(int downThreshold) {
    this.downThreshold = downThreshold;
  }

  public int getLastErrorMaxLength() {
    return lastErrorMaxLength;
  }

  public void setLastErrorMaxLength(int lastErrorMaxLength) {
    this.lastErrorMaxLength = lastErrorMaxLength;
  }

  public boolean isLoadOnStartup() {
    return loadOnStartup;
  }

  public void setLoadOnStartup(boolean loadOnStartup) {
    this.loadOnStartup = loadOnStartup;
  }

  public Duration getAffinityTtl() {
    return affinityTtl;
  }

  public void setAffinityTtl(Duration affinityTtl) {
    this.affinityTtl = affinityTtl;
  }

  public long getAffinityMaximumSize() {
    return affinityMaximumSize;
  }

  public void setAffinityMaximumSize(long affinityMaximumSize) {
    this.affinityMaximumSize = affinityMaximumSize;
  }
}
