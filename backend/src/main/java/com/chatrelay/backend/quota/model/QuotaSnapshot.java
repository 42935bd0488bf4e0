package com.chatrelay.backend.quota.model;

import java.math.BigDecimal;
import java.time.Instant;

/** Dollar-denominated view of a tenant's budgets. Buckets are {@code null} when not applicable. */
public record QuotaSnapshot(
    String planName,
    Instant expiresAt,
    Bucket lifetime,
    Bucket window,
    Bucket cycle,
    Bucket bonus) {

  public record Bucket(BigDecimal used, BigDecimal limit, Instant resetAt) {}
}
