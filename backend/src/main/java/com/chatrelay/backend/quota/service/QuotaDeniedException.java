package com.chatrelay.backend.quota.service;

import com.chatrelay.backend.quota.model.QuotaDecision;
import com.chatrelay.backend.quota.model.QuotaDenialReason;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class QuotaDeniedException extends ResponseStatusException {

  private final transient QuotaDecision decision;

  public QuotaDeniedException(QuotaDecision decision) {
    super(HttpStatus.FORBIDDEN, decision.message());
    this.decision = decision;
    getBody().setTitle("Quota exceeded");
    getBody().setProperty("reason", decision.reason().name());
    if (decision.resetAt() != null) {
      getBody().setProperty("resetAt", decision.resetAt().toString());
    }
    if (decision.snapshot() != null) {
      getBody().setProperty("quota", decision.snapshot());
    }
  }

  public QuotaDenialReason getDenialReason() {
    return decision.reason();
  }

  public QuotaDecision getDecision() {
    return decision;
  }
}
