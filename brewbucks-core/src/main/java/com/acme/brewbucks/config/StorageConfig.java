package com.acme.brewbucks.config;

/** Selects where documents are kept. Pure POJO - no framework dependencies. */
public class StorageConfig {

  public enum Backend {
    MEMORY,
    JDBC
  }

  private Backend backend = Backend.MEMORY;
  private int maxModifyAttempts = 5;

  public Backend getBackend() {
    return backend;
  }

  public void setBackend(Backend backend) {
    this.backend = backend;
  }

  public int getMaxModifyAttempts() {
    return maxModifyAttempts;
  }

  public void setMaxModifyAttempts(int maxModifyAttempts) {
    this.maxModifyAttempts = maxModifyAttempts;
  }
}
