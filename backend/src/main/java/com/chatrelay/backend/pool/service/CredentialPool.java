package com.chatrelay.backend.pool.service;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.pool.config.PoolProperties;
import com.chatrelay.backend.pool.domain.CredentialHealth;
import com.chatrelay.backend.pool.domain.UpstreamCredential;
import com.chatrelay.backend.pool.model.CredentialLease;
import com.chatrelay.backend.pool.model.CredentialStatus;
import com.chatrelay.backend.pool.persistence.UpstreamCredentialRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * In-memory load balancer over the upstream credentials.
 *
 * <p>Admission is bounded per credential by its max concurrency. Selection prefers the
 * credential a conversation is already pinned to, otherwise draws weighted-random over every
 * usable credential, taken in priority order. Health degrades with consecutive errors and is
 * restored only by a success.
 *
 * <p>All reads and writes of per-credential counters happen under {@code monitor}; storage writes
 * happen outside it.
 */
@Service
public class CredentialPool {

  private static final Logger log = LoggerFactory.getLogger(CredentialPool.class);

  private final UpstreamCredentialRepository credentialRepository;
  private final CredentialStatsRecorder statsRecorder;
  private final PoolProperties properties;
  private final Clock clock;
  private final DoubleSupplier randomSource;
  private final Counter acquireHitCounter;
  private final Counter acquireMissCounter;
  private final Counter affinityHitCounter;

  private final Object monitor = new Object();
  private final Cache<String, Long> affinity;
  private Map<Long, CredentialState> credentials = new LinkedHashMap<>();

  @Autowired
  public CredentialPool(
      UpstreamCredentialRepository credentialRepository,
      CredentialStatsRecorder statsRecorder,
      PoolProperties properties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this(
        credentialRepository,
        statsRecorder,
        properties,
        meterRegistry,
        clock,
        () -> ThreadLocalRandom.current().nextDouble(),
        Ticker.systemTicker());
  }

  CredentialPool(
      UpstreamCredentialRepository credentialRepository,
      CredentialStatsRecorder statsRecorder,
      PoolProperties properties,
      MeterRegistry meterRegistry,
      Clock clock,
      Random random,
      Ticker ticker) {
    this(
        credentialRepository,
        statsRecorder,
        properties,
        meterRegistry,
        clock,
        random::nextDouble,
        ticker);
  }

  private CredentialPool(
      UpstreamCredentialRepository credentialRepository,
      CredentialStatsRecorder statsRecorder,
      PoolProperties properties,
      MeterRegistry meterRegistry,
      Clock clock,
      DoubleSupplier randomSource,
      Ticker ticker) {
    this.credentialRepository =
        Objects.requireNonNull(credentialRepository, "credentialRepository");
    this.statsRecorder = Objects.requireNonNull(statsRecorder, "statsRecorder");
    this.properties = Objects.requireNonNull(properties, "properties");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.randomSource = randomSource;
    this.affinity =
        Caffeine.newBuilder()
            .maximumSize(properties.getAffinityMaximumSize())
            .expireAfterAccess(properties.getAffinityTtl().toMillis(), TimeUnit.MILLISECONDS)
            .ticker(ticker)
            .build();
    this.acquireHitCounter = meterRegistry.counter("credential.pool.acquire", "result", "hit");
    this.acquireMissCounter = meterRegistry.counter("credential.pool.acquire", "result", "miss");
    this.affinityHitCounter = meterRegistry.counter("credential.pool.affinity.hits");
  }

  @EventListener(ApplicationReadyEvent.class)
  public void loadOnStartup() {
    if (properties.isLoadOnStartup()) {
      reload();
    }
  }

  /**
   * Reserves a concurrency slot on a usable credential.
   *
   * @param affinityKey conversation identity used for cache-locality pinning, may be {@code null}
   * @return the lease, or empty when every credential is down, disabled or saturated
   */
  public Optional<CredentialLease> acquire(String affinityKey) {
    boolean pinned = StringUtils.hasText(affinityKey);
    synchronized (monitor) {
      CredentialState chosen = null;
      if (pinned) {
        Long boundId = affinity.getIfPresent(affinityKey);
        if (boundId != null) {
          CredentialState bound = credentials.get(boundId);
          if (bound != null && bound.isAvailable()) {
            chosen = bound;
            affinityHitCounter.increment();
          } else {
            affinity.asMap().remove(affinityKey, boundId);
          }
        }
      }
      if (chosen == null) {
        List<CredentialState> candidates = availableCandidates();
        if (candidates.isEmpty()) {
          acquireMissCounter.increment();
          log.debug("Credential pool exhausted for affinity key {}", affinityKey);
          return Optional.empty();
        }
        chosen = pickWeighted(candidates);
      }
      chosen.acquireSlot();
      if (pinned) {
        affinity.put(affinityKey, chosen.id());
      }
      acquireHitCounter.increment();
      return Optional.of(chosen.toLease());
    }
  }

  public void release(long credentialId) {
    synchronized (monitor) {
      CredentialState state = credentials.get(credentialId);
      if (state != null) {
        state.releaseSlot();
      }
    }
  }

  public void recordOutcome(long credentialId, boolean success, TokenUsage usage, String error) {
    if (success) {
      recordSuccess(credentialId, usage);
    } else {
      recordError(credentialId, error);
    }
  }

  public void recordSuccess(long credentialId, TokenUsage usage) {
    boolean recovered;
    synchronized (monitor) {
      CredentialState state = credentials.get(credentialId);
      if (state == null) {
        return;
      }
      recovered = state.markSuccess(usage);
    }
    if (recovered) {
      log.info("Credential {} recovered to HEALTHY", credentialId);
    }
    try {
      statsRecorder.recordSuccess(credentialId, today(), usage, recovered, clock.instant());
    } catch (RuntimeException ex) {
      log.warn("Failed to persist success statistics for credential {}", credentialId, ex);
    }
  }

  public void recordError(long credentialId, String error) {
    String message = truncate(error);
    CredentialHealth before;
    CredentialHealth after;
    int consecutiveErrors;
    synchronized (monitor) {
      CredentialState state = credentials.get(credentialId);
      if (state == null) {
        return;
      }
      before = state.health();
      after =
          state.markError(
              message, properties.getDegradedThreshold(), properties.getDownThreshold());
      consecutiveErrors = state.consecutiveErrors();
    }
    if (after != before) {
      log.warn(
          "Credential {} moved from {} to {} after {} consecutive errors: {}",
          credentialId,
          before,
          after,
          consecutiveErrors,
          message);
    }
    if (after == CredentialHealth.DOWN) {
      affinity.asMap().values().removeIf(id -> id == credentialId);
    }
    try {
      Instant now = clock.instant();
      statsRecorder.recordError(credentialId, today(), after, consecutiveErrors, message, now);
    } catch (RuntimeException ex) {
      log.warn("Failed to persist error statistics for credential {}", credentialId, ex);
    }
  }

  /** Adds site-side cost units to the credential's daily aggregate. */
  public void recordCost(long credentialId, long costUnits) {
    if (costUnits <= 0) {
      return;
    }
    try {
      statsRecorder.recordCost(credentialId, today(), costUnits);
    } catch (RuntimeException ex) {
      log.warn("Failed to persist cost units for credential {}", credentialId, ex);
    }
  }

  /**
   * Rebuilds the working set from storage. Concurrency counts of credentials that survive the
   * rebuild are carried over so in-flight leases still release cleanly.
   */
  public void reload() {
    List<UpstreamCredential> rows = credentialRepository.findAllByOrderByPriorityDescIdAsc();
    synchronized (monitor) {
      Map<Long, CredentialState> rebuilt = new LinkedHashMap<>();
      for (UpstreamCredential row : rows) {
        CredentialState state = new CredentialState(row);
        CredentialState previous = credentials.get(state.id());
        if (previous != null) {
          state.inheritRuntimeCounters(previous);
        }
        rebuilt.put(state.id(), state);
      }
      credentials = rebuilt;
      affinity.asMap().values().removeIf(id -> !rebuilt.containsKey(id));
    }
    log.info("Credential pool loaded {} credentials", rows.size());
  }

  public List<CredentialStatus> getStatus() {
    synchronized (monitor) {
      List<CredentialStatus> statuses = new ArrayList<>(credentials.size());
      for (CredentialState state : credentials.values()) {
        statuses.add(state.toStatus());
      }
      return statuses;
    }
  }

  public void clearAffinity(String affinityKey) {
    if (StringUtils.hasText(affinityKey)) {
      affinity.invalidate(affinityKey);
    }
  }

  public void resetDailyCounters() {
    synchronized (monitor) {
      credentials.values().forEach(CredentialState::resetDailyCounters);
    }
    log.info("Credential daily counters reset");
  }

  Optional<Long> boundCredential(String affinityKey) {
    return Optional.ofNullable(affinity.getIfPresent(affinityKey));
  }

  // working set is kept in priority-desc, id-asc order
  private List<CredentialState> availableCandidates() {
    List<CredentialState> candidates = new ArrayList<>();
    for (CredentialState state : credentials.values()) {
      if (state.isAvailable()) {
        candidates.add(state);
      }
    }
    return candidates;
  }

  private CredentialState pickWeighted(List<CredentialState> candidates) {
    long totalWeight = 0;
    for (CredentialState candidate : candidates) {
      totalWeight += candidate.weight();
    }
    double remaining = randomSource.getAsDouble() * totalWeight;
    for (CredentialState candidate : candidates) {
      remaining -= candidate.weight();
      if (remaining < 0) {
        return candidate;
      }
    }
    return candidates.get(candidates.size() - 1);
  }

  private LocalDate today() {
    return LocalDate.now(clock);
  }

  private String truncate(String error) {
    if (!StringUtils.hasText(error)) {
      return "unknown error";
    }
    int max = properties.getLastErrorMaxLength();
    return error.length() <= max ? error : error.substring(0, max);
  }
}
