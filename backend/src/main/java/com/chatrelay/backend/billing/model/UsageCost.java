package com.chatrelay.backend.billing.model;

import java.math.BigDecimal;

public record UsageCost(
    BigDecimal inputCost,
    BigDecimal outputCost,
    BigDecimal cacheCreationCost,
    BigDecimal cacheReadCost,
    BigDecimal groupMultiplier,
    BigDecimal totalCost) {

  public static UsageCost zero() {
    return new UsageCost(
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ONE,
        BigDecimal.ZERO);
  }

  public boolean hasCost() {
    return totalCost != null && totalCost.signum() > 0;
  }
}
