package com.chatrelay.backend.quota.service;

import com.chatrelay.backend.quota.config.QuotaProperties;
import com.chatrelay.backend.quota.model.CycleUsage;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Redistributes the projected unused cycle budget of a plan to its heaviest current users.
 *
 * <p>Projection: {@code totalUsed * cycleDays / max(minElapsedDays, elapsedDays)}. Each heavy
 * user receives {@code surplus / heavyCount}, capped at {@code bonusCapRatio * ownBudget}.
 */
@Component
public class BonusBudgetCalculator {

  private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

  private final QuotaProperties properties;

  public BonusBudgetCalculator(QuotaProperties properties) {
    this.properties = properties;
  }

  /**
   * @param ownBudget cycle budget of the subscription asking for a bonus
   * @param cycleStart start of the current cycle, {@code null} counts as one elapsed day
   * @param planUsage every active subscription on the same plan, the caller included
   * @return bonus allotment in cost units, never negative
   */
  public long calculate(
      long ownBudget, Instant cycleStart, Instant now, List<CycleUsage> planUsage) {
    if (ownBudget <= 0 || planUsage == null || planUsage.size() <= 1) {
      return 0L;
    }
    double totalBudget = 0;
    double totalUsed = 0;
    int heavyUsers = 0;
    for (CycleUsage usage : planUsage) {
      totalBudget += usage.budget();
      totalUsed += usage.used();
      if (usage.budget() > 0
          && (double) usage.used() / usage.budget() >= properties.getHeavyUserRatio()) {
        heavyUsers++;
      }
    }

    double daysSoFar =
        cycleStart == null
            ? 1.0
            : Math.max(
                properties.getMinElapsedDays(),
                Duration.between(cycleStart, now).toMillis() / MILLIS_PER_DAY);
    double cycleDays = properties.getCycleLength().toMillis() / MILLIS_PER_DAY;
    double projected = totalUsed * cycleDays / daysSoFar;
    double surplus = totalBudget - projected;
    if (surplus <= 0 || heavyUsers == 0) {
      return 0L;
    }
    double share = surplus / heavyUsers;
    double cap = ownBudget * properties.getBonusCapRatio();
    return (long) Math.floor(Math.min(share, cap));
  }
}
