package com.chatrelay.backend.relay.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatrelay.backend.relay.config.RelayProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatRateLimiterTest {

  private static final UUID TENANT = UUID.fromString("8d0f4c3e-1f7a-4d52-9a55-0f3a4cf1b001");
  private static final UUID OTHER = UUID.fromString("1c3e8a52-64b0-4f1d-8d2e-9b7c5a0e4f22");

  private final AtomicLong nanos = new AtomicLong();
  private RelayProperties properties;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    properties = new RelayProperties();
    meterRegistry = new SimpleMeterRegistry();
  }

  @Test
  void twentyFirstRequestInTheWindowIsRejected() {
    ChatRateLimiter limiter = limiter();
    for (int i = 0; i < 20; i++) {
      limiter.acquire(TENANT);
    }

    assertThatThrownBy(() -> limiter.acquire(TENANT))
        .isInstanceOf(RateLimitExceededException.class);
    assertThat(meterRegistry.counter("relay.sessions", "outcome", "rate_limited").count())
        .isEqualTo(1.0);
  }

  @Test
  void tenantsAreCountedSeparately() {
    properties.getRateLimit().setMaxRequests(1);
    ChatRateLimiter limiter = limiter();
    limiter.acquire(TENANT);

    assertThatCode(() -> limiter.acquire(OTHER)).doesNotThrowAnyException();
    assertThatThrownBy(() -> limiter.acquire(TENANT))
        .isInstanceOf(RateLimitExceededException.class);
  }

  @Test
  void newWindowStartsAfterTheOldOneExpires() {
    properties.getRateLimit().setMaxRequests(2);
    ChatRateLimiter limiter = limiter();
    limiter.acquire(TENANT);
    nanos.addAndGet(Duration.ofSeconds(30).toNanos());
    limiter.acquire(TENANT);
    assertThatThrownBy(() -> limiter.acquire(TENANT))
        .isInstanceOf(RateLimitExceededException.class);

    nanos.addAndGet(Duration.ofSeconds(31).toNanos());

    assertThatCode(() -> limiter.acquire(TENANT)).doesNotThrowAnyException();
  }

  @Test
  void disabledLimiterAdmitsEverything() {
    properties.getRateLimit().setEnabled(false);
    properties.getRateLimit().setMaxRequests(1);
    ChatRateLimiter limiter = limiter();

    assertThatCode(
            () -> {
              for (int i = 0; i < 5; i++) {
                limiter.acquire(TENANT);
              }
            })
        .doesNotThrowAnyException();
  }

  private ChatRateLimiter limiter() {
    return new ChatRateLimiter(properties, meterRegistry, nanos::get);
  }
}
