package com.chatrelay.backend.pool.service;

import com.chatrelay.backend.billing.model.TokenUsage;
import com.chatrelay.backend.pool.domain.CredentialHealth;
import com.chatrelay.backend.pool.persistence.CredentialDailyStatsRepository;
import com.chatrelay.backend.pool.persistence.UpstreamCredentialRepository;
import java.time.Instant;
import java.time.LocalDate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/** Writes credential health and per-day aggregates. */
@Component
public class CredentialStatsRecorder {

  private final UpstreamCredentialRepository credentialRepository;
  private final CredentialDailyStatsRepository dailyStatsRepository;

  public CredentialStatsRecorder(
      UpstreamCredentialRepository credentialRepository,
      CredentialDailyStatsRepository dailyStatsRepository) {
    this.credentialRepository = credentialRepository;
    this.dailyStatsRepository = dailyStatsRepository;
  }

  @Transactional
  public void recordSuccess(
      long credentialId, LocalDate day, TokenUsage usage, boolean healthChanged, Instant now) {
    TokenUsage safeUsage = usage != null ? usage : TokenUsage.EMPTY;
    dailyStatsRepository.upsertSuccess(
        credentialId,
        day,
        safeUsage.inputTokens(),
        safeUsage.outputTokens(),
        safeUsage.cacheCreationTokens(),
        safeUsage.cacheReadTokens());
    if (healthChanged) {
      credentialRepository.markHealthy(credentialId, CredentialHealth.HEALTHY, now);
    }
  }

  @Transactional
  public void recordError(
      long credentialId,
      LocalDate day,
      CredentialHealth health,
      int consecutiveErrors,
      String message,
      Instant now) {
    credentialRepository.updateHealth(credentialId, health, consecutiveErrors, message, now, now);
    dailyStatsRepository.upsertError(credentialId, day);
  }

  @Transactional
  public void recordCost(long credentialId, LocalDate day, long costUnits) {
    dailyStatsRepository.upsertCost(credentialId, day, costUnits);
  }
}
