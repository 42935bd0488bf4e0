package com.chatrelay.backend.billing.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.billing")
public class BillingProperties {

  /** Dollar price of one million prompt tokens before the model multiplier. */
  @NotNull
  @DecimalMin("0.0")
  private BigDecimal basePricePerMillion = new BigDecimal("2.0");

  @NotNull private Duration rateCacheTtl = Duration.ofSeconds(60);

  private long rateCacheMaximumSize = 512;

  public BigDecimal getBasePricePerMillion() {
    return basePricePerMillion;
  }

  public void setBasePricePerMillion(BigDecimal basePricePerMillion) {
    this.basePricePerMillion = basePricePerMillion;
  }

  public Duration getRateCacheTtl() {
    return rateCacheTtl;
  }

  public void setRateCacheTtl(Duration rateCacheTtl) {
    this.rateCacheTtl = rateCacheTtl;
  }

  public long getRateCacheMaximumSize() {
    return rateCacheMaximumSize;
  }

  public void setRateCacheMaximumSize(long rateCacheMaximumSize) {
    this.rateCacheMaximumSize = rateCacheMaximumSize;
  }
}
