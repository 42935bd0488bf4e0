package com.chatrelay.backend.pool.service;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DailyCounterResetJob {

  private final CredentialPool credentialPool;

  public DailyCounterResetJob(CredentialPool credentialPool) {
    this.credentialPool = credentialPool;
  }

  // local midnight of the server zone
  @Scheduled(cron = "${app.pool.daily-reset-cron:0 0 0 * * *}")
  public void resetAtMidnight() {
    credentialPool.resetDailyCounters();
  }
}
