package com.chatrelay.backend.pool.service;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.pool.domain.CredentialHealth;
import com.chatrelay.backend.pool.domain.UpstreamCredential;
import com.chatrelay.backend.pool.model.CredentialLease;
import com.chatrelay.backend.pool.model.CredentialStatus;
import java.math.BigDecimal;

/**
 * Live view of one credential inside the pool. Mutable fields are guarded by the pool monitor.
 */
final class CredentialState {

  private final long id;
  private final String name;
  private final String baseUrl;
  private final String apiKey;
  private final boolean enabled;
  private final int priority;
  private final int weight;
  private final int maxConcurrency;
  private final BigDecimal groupMultiplier;

  private int concurrency;
  private int consecutiveErrors;
  private CredentialHealth health;
  private String lastError;
  private long dailyTokensIn;
  private long dailyTokensOut;
  private long dailyRequests;

  CredentialState(UpstreamCredential credential) {
    this.id = credential.getId();
    this.name = credential.getName();
    this.baseUrl = credential.getBaseUrl();
    this.apiKey = credential.getApiKey();
    this.enabled = credential.isEnabled();
    this.priority = credential.getPriority();
    this.weight = credential.getWeight() > 0 ? credential.getWeight() : 1;
    this.maxConcurrency = Math.max(0, credential.getMaxConcurrency());
    this.groupMultiplier =
        credential.getGroupMultiplier() != null ? credential.getGroupMultiplier() : BigDecimal.ONE;
    this.consecutiveErrors = credential.getConsecutiveErrors();
    this.health =
        credential.getHealth() != null ? credential.getHealth() : CredentialHealth.HEALTHY;
    this.lastError = credential.getLastError();
  }

  /** Carries counters that must survive a working-set rebuild. */
  void inheritRuntimeCounters(CredentialState previous) {
    this.concurrency = previous.concurrency;
    this.dailyTokensIn = previous.dailyTokensIn;
    this.dailyTokensOut = previous.dailyTokensOut;
    this.dailyRequests = previous.dailyRequests;
  }

  boolean isAvailable() {
    return enabled && health != CredentialHealth.DOWN && concurrency < maxConcurrency;
  }

  void acquireSlot() {
    concurrency++;
  }

  void releaseSlot() {
    if (concurrency > 0) {
      concurrency--;
    }
  }

  /** Returns true when the credential was not healthy before this success. */
  boolean markSuccess(TokenUsage usage) {
    boolean recovered = health != CredentialHealth.HEALTHY || consecutiveErrors > 0;
    consecutiveErrors = 0;
    health = CredentialHealth.HEALTHY;
    if (usage != null) {
      dailyTokensIn += usage.inputTokens();
      dailyTokensOut += usage.outputTokens();
    }
    dailyRequests++;
    return recovered;
  }

  CredentialHealth markError(String message, int degradedThreshold, int downThreshold) {
    consecutiveErrors++;
    if (consecutiveErrors >= downThreshold) {
      health = CredentialHealth.DOWN;
    } else if (consecutiveErrors >= degradedThreshold) {
      health = CredentialHealth.DEGRADED;
    }
    lastError = message;
    return health;
  }

  void resetDailyCounters() {
    dailyTokensIn = 0;
    dailyTokensOut = 0;
    dailyRequests = 0;
  }

  long id() {
    return id;
  }

  String name() {
    return name;
  }

  int priority() {
    return priority;
  }

  int weight() {
    return weight;
  }

  int concurrency() {
    return concurrency;
  }

  int consecutiveErrors() {
    return consecutiveErrors;
  }

  CredentialHealth health() {
    return health;
  }

  CredentialLease toLease() {
    return new CredentialLease(id, name, baseUrl, apiKey, groupMultiplier);
  }

  CredentialStatus toStatus() {
    return new CredentialStatus(
        id,
        name,
        baseUrl,
        enabled,
        health,
        maxConcurrency,
        concurrency,
        consecutiveErrors,
        weight,
        priority,
        lastError,
        dailyTokensIn,
        dailyTokensOut,
        dailyRequests);
  }
}
