package com.chatrelay.backend.quota.model;

import java.time.Instant;

public record QuotaDecision(
    boolean allowed,
    QuotaDenialReason reason,
    String message,
    Instant resetAt,
    QuotaSnapshot snapshot) {

  public static QuotaDecision allow(QuotaSnapshot snapshot) {
    return new QuotaDecision(true, null, null, null, snapshot);
  }

  public static QuotaDecision deny(
      QuotaDenialReason reason, String message, Instant resetAt, QuotaSnapshot snapshot) {
    return new QuotaDecision(false, reason, message, resetAt, snapshot);
  }
}
