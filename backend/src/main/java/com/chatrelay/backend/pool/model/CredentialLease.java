package com.chatrelay.backend.pool.model;

import java.math.BigDecimal;

/**
 * Routing information handed out by a successful acquire. The holder must release the lease
 * exactly once.
 */
public record CredentialLease(
    long credentialId, String name, String baseUrl, String apiKey, BigDecimal groupMultiplier) {

  public CredentialLease {
    groupMultiplier = groupMultiplier != null ? groupMultiplier : BigDecimal.ONE;
  }

  @Override
  public String toString() {
    return "CredentialLease[credentialId="
        + credentialId
        + ", name="
        + name
        + ", baseUrl="
        + baseUrl
        + "]";
  }
}
