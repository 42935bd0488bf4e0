package com.chatrelay.backend.pool.domain;

public enum CredentialHealth {
  HEALTHY,
  DEGRADED,
  DOWN
}
