package com.chatrelay.backend.quota.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/** Budgets are expressed in cost units ($0.0001). A non-positive budget disables that check. */
@Entity
@Table(name = "subscription_plan")
public class SubscriptionPlan {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "code", nullable = false, unique = true, length = 64)
  private String code;

  @Column(name = "name", nullable = false, length = 128)
  private String name;

  @Column(name = "token_quota", nullable = false)
  private long tokenQuota;

  @Column(name = "window_budget", nullable = false)
  private long windowBudget;

  @Column(name = "weekly_budget", nullable = false)
  private long weeklyBudget;

  @Column(name = "duration_days", nullable = false)
  private int durationDays = 30;

  @Column(name = "enabled", nullable = false)
  private boolean enabled = true;

  protected SubscriptionPlan() {}

  public SubscriptionPlan(
      String code, String name, long tokenQuota, long windowBudget, long weeklyBudget) {
    this.code = code;
    this.name = name;
    this.tokenQuota = tokenQuota;
    this.windowBudget = windowBudget;
    this.weeklyBudget = weeklyBudget;
  }

  public Long getId() {
    return id;
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }

  public long getTokenQuota() {
    return tokenQuota;
  }

  public long getWindowBudget() {
    return windowBudget;
  }

  public void setWindowBudget(long windowBudget) {
    this.windowBudget = windowBudget;
  }

  public long getWeeklyBudget() {
    return weeklyBudget;
  }

  public void setWeeklyBudget(long weeklyBudget) {
    this.weeklyBudget = weeklyBudget;
  }

  public int getDurationDays() {
    return durationDays;
  }

  public void setDurationDays(int durationDays) {
    this.durationDays = durationDays;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }
}
