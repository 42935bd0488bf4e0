package com.chatrelay.backend.relay.service;

import com.chatrelay.backend.relay.config.RelayProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fixed-window request counter per tenant. A window opens with the tenant's first request and
 * every request inside it counts, rejected ones included.
 */
@Component
@Slf4j
public class ChatRateLimiter {

  private final RelayProperties.RateLimit properties;
  private final Cache<UUID, AtomicInteger> windows;
  private final Counter rejected;

  @Autowired
  public ChatRateLimiter(RelayProperties relayProperties, MeterRegistry meterRegistry) {
    this(relayProperties, meterRegistry, Ticker.systemTicker());
  }

  ChatRateLimiter(RelayProperties relayProperties, MeterRegistry meterRegistry, Ticker ticker) {
    this.properties = relayProperties.getRateLimit();
    this.windows =
        Caffeine.newBuilder()
            .maximumSize(properties.getMaximumTenants())
            .expireAfterWrite(properties.getWindow().toMillis(), TimeUnit.MILLISECONDS)
            .ticker(ticker)
            .build();
    this.rejected = meterRegistry.counter("relay.sessions", "outcome", "rate_limited");
  }

  /**
   * Counts one chat request against the tenant's window.
   *
   * @throws RateLimitExceededException when the window is already full
   */
  public void acquire(UUID tenantId) {
    if (!properties.isEnabled()) {
      return;
    }
    int count = windows.get(tenantId, id -> new AtomicInteger()).incrementAndGet();
    if (count > properties.getMaxRequests()) {
      rejected.increment();
      log.debug("Tenant {} hit the chat rate limit ({} requests)", tenantId, count);
      throw new RateLimitExceededException();
    }
  }
}
