package com.acme.brewbucks.store;

public class TransientStorageException extends StorageException {
  public TransientStorageException(String message) {
    super(message);
  }

  public TransientStorageException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
