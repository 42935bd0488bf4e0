package com.chatrelay.backend.pool.model;

import com.chatrelay.backend.pool.domain.CredentialHealth;

public record CredentialStatus(
    long id,
    String name,
    String baseUrl,
    boolean enabled,
    CredentialHealth health,
    int maxConcurrency,
    int currentConcurrency,
    int consecutiveErrors,
    int weight,
    int priority,
    String lastError,
    long dailyTokensIn,
    long dailyTokensOut,
    long dailyRequests) {}
