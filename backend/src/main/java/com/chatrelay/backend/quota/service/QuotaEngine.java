package com.chatrelay.backend.quota.service;

import com.chatrelay.backend.billing.service.BillingCalculator;
import com.chatrelay.backend.quota.config.QuotaProperties;
import com.chatrelay.backend.quota.domain.Subscription;
import com.chatrelay.backend.quota.domain.SubscriptionStatus;
import com.chatrelay.backend.quota.domain.TenantAccount;
import com.chatrelay.backend.quota.model.CycleUsage;
import com.chatrelay.backend.quota.model.QuotaDecision;
import com.chatrelay.backend.quota.model.QuotaDenialReason;
import com.chatrelay.backend.quota.model.QuotaSnapshot;
import com.chatrelay.backend.quota.model.QuotaSnapshot.Bucket;
import com.chatrelay.backend.quota.persistence.SubscriptionRepository;
import com.chatrelay.backend.quota.persistence.TenantAccountRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Layered admission budgets: lifetime, rolling window, billing cycle and the plan-wide bonus pool.
 * Checks run lifetime, then window, then cycle and stop at the first failure. Usage recording
 * fills the cycle bucket first and spills into the bonus bucket once the cycle budget is spent.
 */
@Service
public class QuotaEngine {

  private static final Logger log = LoggerFactory.getLogger(QuotaEngine.class);

  private final SubscriptionRepository subscriptionRepository;
  private final TenantAccountRepository tenantAccountRepository;
  private final BonusBudgetCalculator bonusBudgetCalculator;
  private final QuotaProperties properties;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public QuotaEngine(
      SubscriptionRepository subscriptionRepository,
      TenantAccountRepository tenantAccountRepository,
      BonusBudgetCalculator bonusBudgetCalculator,
      QuotaProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.subscriptionRepository =
        Objects.requireNonNull(subscriptionRepository, "subscriptionRepository");
    this.tenantAccountRepository =
        Objects.requireNonNull(tenantAccountRepository, "tenantAccountRepository");
    this.bonusBudgetCalculator =
        Objects.requireNonNull(bonusBudgetCalculator, "bonusBudgetCalculator");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Transactional
  public QuotaDecision checkQuota(UUID tenantId) {
    Instant now = clock.instant();
    Optional<Subscription> active = lockActiveSubscription(tenantId, now);
    if (active.isEmpty()) {
      return checkLifetimeGrant(tenantId);
    }

    Subscription subscription = active.get();
    applyRollover(subscription, now);

    if (subscription.getTokensUsed() >= subscription.getTokenQuota()) {
      return deny(
          QuotaDenialReason.QUOTA_EXCEEDED,
          "Your subscription quota has been used up. Renew or upgrade to continue.",
          null,
          snapshot(subscription, now));
    }

    long windowBudget = subscription.windowBudget();
    if (windowBudget > 0 && subscription.getWindowUsed() >= windowBudget) {
      Instant resetAt = windowResetAt(subscription);
      return deny(
          QuotaDenialReason.WINDOW_EXCEEDED,
          "You have reached the usage limit for the current "
              + properties.getWindowLength().toHours()
              + "-hour window. It resets at "
              + resetAt
              + ".",
          resetAt,
          snapshot(subscription, now));
    }

    long weeklyBudget = subscription.weeklyBudget();
    if (weeklyBudget > 0 && subscription.getWeekUsed() >= weeklyBudget) {
      long bonus = bonusBudget(subscription, now);
      if (bonus <= 0 || subscription.getBonusUsed() >= bonus) {
        Instant resetAt = cycleResetAt(subscription);
        return deny(
            QuotaDenialReason.WEEKLY_EXCEEDED,
            "You have reached the usage limit for the current billing cycle. It resets at "
                + resetAt
                + ".",
            resetAt,
            snapshot(subscription, now));
      }
      log.debug(
          "Tenant {} admitted on bonus budget: used {} of {}",
          tenantId,
          subscription.getBonusUsed(),
          bonus);
    }

    return QuotaDecision.allow(snapshot(subscription, now));
  }

  /**
   * Charges a finished request.
   *
   * @return the charged amount in cost units, {@code 0} when nothing was charged
   */
  @Transactional
  public long recordUsage(UUID tenantId, BigDecimal dollarCost) {
    long units = BillingCalculator.dollarToUnits(dollarCost);
    if (units <= 0) {
      return 0L;
    }
    Instant now = clock.instant();
    Optional<Subscription> active = lockActiveSubscription(tenantId, now);
    tenantAccountRepository
        .findByIdForUpdate(tenantId)
        .ifPresent(tenant -> tenant.addTokenUsed(units));
    active.ifPresent(
        subscription -> {
          applyRollover(subscription, now);
          subscription.addUsage(units);
        });
    log.debug("Recorded {} cost units for tenant {}", units, tenantId);
    return units;
  }

  @Transactional
  public QuotaSnapshot getQuotaSnapshot(UUID tenantId) {
    Instant now = clock.instant();
    Optional<Subscription> active = lockActiveSubscription(tenantId, now);
    if (active.isPresent()) {
      applyRollover(active.get(), now);
      return snapshot(active.get(), now);
    }
    return tenantAccountRepository.findById(tenantId).map(this::lifetimeSnapshot).orElse(null);
  }

  private QuotaDecision checkLifetimeGrant(UUID tenantId) {
    Optional<TenantAccount> tenant = tenantAccountRepository.findById(tenantId);
    if (tenant.isEmpty()
        || tenant.get().getTokenQuota() <= 0
        || tenant.get().getTokenUsed() >= tenant.get().getTokenQuota()) {
      return deny(
          QuotaDenialReason.NO_SUBSCRIPTION,
          "No active subscription. Purchase a plan or redeem a code to continue.",
          null,
          tenant.map(this::lifetimeSnapshot).orElse(null));
    }
    return QuotaDecision.allow(lifetimeSnapshot(tenant.get()));
  }

  private Optional<Subscription> lockActiveSubscription(UUID tenantId, Instant now) {
    int expired = subscriptionRepository.expireEnded(tenantId, now);
    if (expired > 0) {
      log.info("Expired {} subscriptions of tenant {}", expired, tenantId);
    }
    return subscriptionRepository
        .findActiveIds(tenantId, SubscriptionStatus.ACTIVE, now)
        .stream()
        .findFirst()
        .flatMap(subscriptionRepository::findByIdForUpdate)
        .filter(subscription -> subscription.isActiveAt(now));
  }

  private void applyRollover(Subscription subscription, Instant now) {
    BudgetRollover.Result window =
        BudgetRollover.rollWindow(now, subscription.getWindowStart(), properties.getWindowLength());
    if (window.reset()) {
      subscription.resetWindow(window.start());
    }
    BudgetRollover.Result cycle =
        BudgetRollover.rollCycle(
            now,
            subscription.getWeekStart(),
            subscription.getStartsAt(),
            properties.getCycleLength());
    if (cycle.reset()) {
      subscription.resetCycle(cycle.start());
    }
  }

  private long bonusBudget(Subscription subscription, Instant now) {
    Long planId = subscription.getPlan().getId();
    long budget = subscription.weeklyBudget();
    List<CycleUsage> planUsage =
        subscriptionRepository.findActiveByPlan(planId, now).stream()
            .map(peer -> new CycleUsage(budget, peer.getWeekUsed()))
            .toList();
    return bonusBudgetCalculator.calculate(budget, subscription.getWeekStart(), now, planUsage);
  }

  private QuotaDecision deny(
      QuotaDenialReason reason, String message, Instant resetAt, QuotaSnapshot snapshot) {
    meterRegistry.counter("quota.denials", "reason", reason.name()).increment();
    return QuotaDecision.deny(reason, message, resetAt, snapshot);
  }

  private QuotaSnapshot snapshot(Subscription subscription, Instant now) {
    long weeklyBudget = subscription.weeklyBudget();
    boolean bonusActive = weeklyBudget > 0 && subscription.getWeekUsed() >= weeklyBudget;
    long bonusLimit = bonusActive ? bonusBudget(subscription, now) : 0L;
    Instant cycleReset = cycleResetAt(subscription);
    return new QuotaSnapshot(
        subscription.getPlan().getName(),
        subscription.getExpiresAt(),
        bucket(subscription.getTokensUsed(), subscription.getTokenQuota(), null),
        bucket(
            subscription.getWindowUsed(),
            subscription.windowBudget(),
            windowResetAt(subscription)),
        bucket(subscription.getWeekUsed(), weeklyBudget, cycleReset),
        bucket(subscription.getBonusUsed(), bonusLimit, cycleReset));
  }

  private QuotaSnapshot lifetimeSnapshot(TenantAccount tenant) {
    return new QuotaSnapshot(
        null, null, bucket(tenant.getTokenUsed(), tenant.getTokenQuota(), null), null, null, null);
  }

  private Instant windowResetAt(Subscription subscription) {
    return subscription.getWindowStart() != null
        ? subscription.getWindowStart().plus(properties.getWindowLength())
        : null;
  }

  private Instant cycleResetAt(Subscription subscription) {
    return subscription.getWeekStart() != null
        ? subscription.getWeekStart().plus(properties.getCycleLength())
        : null;
  }

  private Bucket bucket(long usedUnits, long limitUnits, Instant resetAt) {
    return new Bucket(
        BillingCalculator.unitsToDollars(usedUnits),
        BillingCalculator.unitsToDollars(Math.max(0, limitUnits)),
        resetAt);
  }
}
