package com.acme.brewbucks.store;

import com.acme.brewbucks.documents.Version;
import java.util.Optional;

/**
 * Key-ordered storage of versioned JSON documents with a single atomic primitive: compare the
 * stored version and swap in a new row.
 *
 * <p>Implementations throw {@link StorageException} for backend failures; a lost race is never an
 * exception, it is reported through the return value of {@link #compareAndSwap}.
 */
public interface StorageBackend {

  /** Prepares the backend for use. Safe to call more than once. */
  void setup();

  Optional<StoredDocument> get(String key);

  /**
   * Atomically replaces the row at {@code key} if its version equals {@code expected}. When
   * {@code expected} is {@link Version#INITIAL} the row must not exist yet.
   *
   * @return true if the replacement was written
   */
  boolean compareAndSwap(String key, Version expected, StoredDocument replacement);

  /** The lowest-keyed pending row whose key starts with {@code keyPrefix}, if any. */
  default Optional<StoredDocument> findPending(String keyPrefix) {
    return findPending(keyPrefix, null);
  }

  /**
   * The lowest-keyed pending row whose key starts with {@code keyPrefix} and sorts strictly after
   * {@code afterKey}. A null {@code afterKey} starts at the beginning of the prefix.
   */
  Optional<StoredDocument> findPending(String keyPrefix, String afterKey);
}
