package com.chatrelay.backend.quota.domain;

public enum SubscriptionStatus {
  ACTIVE,
  EXPIRED,
  CANCELLED
}
