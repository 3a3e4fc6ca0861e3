package com.acme.brewbucks.config;

import java.time.Duration;

/** Settings for the mailbox workers. Pure POJO - no framework dependencies. */
public class WorkerConfig {

  private boolean enabled = true;
  private Duration sweepInterval = Duration.ofSeconds(1);
  private int maxSaveAttempts = 5;
  private int maxDocumentsPerTick = 100;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Duration getSweepInterval() {
    return sweepInterval;
  }

  public void setSweepInterval(Duration sweepInterval) {
    this.sweepInterval = sweepInterval;
  }

  public int getMaxSaveAttempts() {
    return maxSaveAttempts;
  }

  public void setMaxSaveAttempts(int maxSaveAttempts) {
    this.maxSaveAttempts = maxSaveAttempts;
  }

  public int getMaxDocumentsPerTick() {
    return maxDocumentsPerTick;
  }

  public void setMaxDocumentsPerTick(int maxDocumentsPerTick) {
    this.maxDocumentsPerTick = maxDocumentsPerTick;
  }
}
