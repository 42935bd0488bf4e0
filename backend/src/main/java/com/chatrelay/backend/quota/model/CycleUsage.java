package com.chatrelay.backend.quota.model;

/** Cycle budget and consumption of one subscription, in cost units. */
public record CycleUsage(long budget, long used) {}
