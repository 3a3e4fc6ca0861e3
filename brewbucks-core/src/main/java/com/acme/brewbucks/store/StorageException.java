package com.acme.brewbucks.store;

/** Failure reported by a storage backend. */
public class StorageException extends RuntimeException {
  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Whether repeating the same operation later may succeed. */
  public boolean isRetryable() {
    return false;
  }
}
