package com.chatrelay.backend.quota.model;

public enum QuotaDenialReason {
  NO_SUBSCRIPTION,
  QUOTA_EXCEEDED,
  WINDOW_EXCEEDED,
  WEEKLY_EXCEEDED
}
