package com.acme.brewbucks.store;

public class PermanentStorageException extends StorageException {
  public PermanentStorageException(String message) {
    super(message);
  }

  public PermanentStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
