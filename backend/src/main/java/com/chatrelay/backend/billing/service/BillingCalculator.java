package com.chatrelay.backend.billing.service;

import com.chatrelay.backend.billing.config.BillingProperties;
import com.chatrelay.backend.billing.domain.ModelRate;
import com.chatrelay.backend.billing.model.RateCard;
import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.billing.model.UsageCost;
import com.chatrelay.backend.billing.persistence.ModelRateRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Converts upstream token usage into a dollar cost.
 *
 * <p>Prompt tokens are priced at {@code basePricePerMillion * modelMultiplier}; every other token
 * class is priced at the prompt price times its own multiplier. The sum is scaled by the
 * multiplier of the credential group that served the request.
 */
@Service
public class BillingCalculator {

  private static final Logger log = LoggerFactory.getLogger(BillingCalculator.class);

  static final int COST_SCALE = 8;
  private static final BigDecimal ONE_MILLION = BigDecimal.valueOf(1_000_000L);
  private static final BigDecimal UNITS_PER_DOLLAR = BigDecimal.valueOf(10_000L);
  private static final String THINKING_SUFFIX = "-thinking";

  private final ModelRateRepository modelRateRepository;
  private final BillingProperties properties;
  private final Cache<String, RateCard> rateCards;

  public BillingCalculator(ModelRateRepository modelRateRepository, BillingProperties properties) {
    this.modelRateRepository = Objects.requireNonNull(modelRateRepository, "modelRateRepository");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.rateCards =
        Caffeine.newBuilder()
            .maximumSize(properties.getRateCacheMaximumSize())
            .expireAfterWrite(properties.getRateCacheTtl().toMillis(), TimeUnit.MILLISECONDS)
            .build();
  }

  public UsageCost calculate(String modelId, TokenUsage usage, BigDecimal groupMultiplier) {
    if (usage == null || !usage.hasUsage()) {
      return UsageCost.zero();
    }
    RateCard card = rateCard(modelId);
    BigDecimal multiplier = groupMultiplier != null ? groupMultiplier : BigDecimal.ONE;
    BigDecimal promptPrice =
        properties.getBasePricePerMillion().multiply(card.modelMultiplier());

    BigDecimal inputCost = price(usage.inputTokens(), promptPrice);
    BigDecimal outputCost =
        price(usage.outputTokens(), promptPrice.multiply(card.outputMultiplier()));
    BigDecimal cacheCreationCost =
        price(usage.cacheCreationTokens(), promptPrice.multiply(card.cacheCreationMultiplier()));
    BigDecimal cacheReadCost =
        price(usage.cacheReadTokens(), promptPrice.multiply(card.cacheReadMultiplier()));

    BigDecimal total =
        inputCost
            .add(outputCost)
            .add(cacheCreationCost)
            .add(cacheReadCost)
            .multiply(multiplier)
            .setScale(COST_SCALE, RoundingMode.HALF_UP);

    if (log.isDebugEnabled()) {
      log.debug(
          "Priced model '{}' usage {} with group multiplier {}: total={}",
          modelId,
          usage,
          multiplier,
          total);
    }
    return new UsageCost(
        inputCost, outputCost, cacheCreationCost, cacheReadCost, multiplier, total);
  }

  /** Converts dollars into integer cost units where one unit is $0.0001. */
  public static long dollarToUnits(BigDecimal dollars) {
    if (dollars == null) {
      return 0L;
    }
    return dollars.multiply(UNITS_PER_DOLLAR).setScale(0, RoundingMode.HALF_UP).longValueExact();
  }

  public static BigDecimal unitsToDollars(long units) {
    return BigDecimal.valueOf(units).divide(UNITS_PER_DOLLAR, 4, RoundingMode.UNNECESSARY);
  }

  public RateCard rateCard(String modelId) {
    String key = StringUtils.hasText(modelId) ? modelId.trim() : "";
    return rateCards.get(key, this::loadRateCard);
  }

  public void invalidateCache() {
    rateCards.invalidateAll();
  }

  private RateCard loadRateCard(String modelId) {
    Optional<ModelRate> rate = modelRateRepository.findByModelIdAndEnabledTrue(modelId);
    if (rate.isEmpty() && modelId.endsWith(THINKING_SUFFIX)) {
      String baseModel = modelId.substring(0, modelId.length() - THINKING_SUFFIX.length());
      rate = modelRateRepository.findByModelIdAndEnabledTrue(baseModel);
    }
    return rate.map(
            row ->
                new RateCard(
                    modelId,
                    row.getModelMultiplier(),
                    row.getOutputMultiplier(),
                    row.getCacheReadMultiplier(),
                    row.getCacheCreationMultiplier()))
        .orElseGet(() -> RateCard.defaults(modelId));
  }

  private BigDecimal price(long tokens, BigDecimal pricePerMillion) {
    if (tokens <= 0) {
      return BigDecimal.ZERO.setScale(COST_SCALE);
    }
    return BigDecimal.valueOf(tokens)
        .multiply(pricePerMillion)
        .divide(ONE_MILLION, COST_SCALE, RoundingMode.HALF_UP);
  }
}
