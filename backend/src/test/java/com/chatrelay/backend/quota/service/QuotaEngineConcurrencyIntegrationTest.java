package com.chatrelay.backend.quota.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.chatrelay.backend.quota.config.QuotaConfiguration;
import com.chatrelay.backend.quota.domain.Subscription;
import com.chatrelay.backend.quota.domain.SubscriptionPlan;
import com.chatrelay.backend.quota.domain.TenantAccount;
import com.chatrelay.backend.quota.persistence.SubscriptionPlanRepository;
import com.chatrelay.backend.quota.persistence.SubscriptionRepository;
import com.chatrelay.backend.quota.persistence.TenantAccountRepository;
import com.chatrelay.backend.support.PostgresTestContainer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.junit.jupiter.Testcontainers;

@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=none")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Testcontainers(disabledWithoutDocker = true)
@Import({
  QuotaEngine.class,
  BonusBudgetCalculator.class,
  QuotaConfiguration.class,
  QuotaEngineConcurrencyIntegrationTest.TestConfig.class
})
class QuotaEngineConcurrencyIntegrationTest extends PostgresTestContainer {

  private static final int THREADS = 8;
  private static final int CALLS_PER_THREAD = 5;

  @Autowired private QuotaEngine quotaEngine;
  @Autowired private SubscriptionPlanRepository planRepository;
  @Autowired private SubscriptionRepository subscriptionRepository;
  @Autowired private TenantAccountRepository tenantAccountRepository;

  @Test
  void concurrentUsageRecordsAreAllCounted() throws Exception {
    UUID tenantId = UUID.randomUUID();
    Instant now = Instant.now();
    SubscriptionPlan plan =
        planRepository.save(new SubscriptionPlan("pro-" + tenantId, "Pro", 1_000_000, 0, 0));
    tenantAccountRepository.save(new TenantAccount(tenantId, 0));
    Subscription subscription =
        subscriptionRepository.save(
            new Subscription(
                tenantId,
                plan,
                now.minus(Duration.ofDays(1)),
                now.plus(Duration.ofDays(29)),
                1_000_000));

    ExecutorService executor = Executors.newFixedThreadPool(THREADS);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < THREADS; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int call = 0; call < CALLS_PER_THREAD; call++) {
                    quotaEngine.recordUsage(tenantId, new BigDecimal("0.0010"));
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(60, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    long expected = THREADS * CALLS_PER_THREAD * 10L;
    Subscription stored = subscriptionRepository.findById(subscription.getId()).orElseThrow();
    assertThat(stored.getTokensUsed()).isEqualTo(expected);
    assertThat(stored.getWindowUsed()).isEqualTo(expected);
    assertThat(tenantAccountRepository.findById(tenantId).orElseThrow().getTokenUsed())
        .isEqualTo(expected);
  }

  @TestConfiguration
  static class TestConfig {

    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }

    @Bean
    Clock clock() {
      return Clock.systemUTC();
    }
  }
}
