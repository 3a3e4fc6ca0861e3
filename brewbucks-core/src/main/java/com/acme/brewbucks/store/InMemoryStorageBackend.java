package com.acme.brewbucks.store;

import com.acme.brewbucks.documents.Version;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Process-local backend over a sorted concurrent map. Contents do not survive a restart. */
public class InMemoryStorageBackend implements StorageBackend {
  private static final Logger LOG = LoggerFactory.getLogger(InMemoryStorageBackend.class);

  private final ConcurrentNavigableMap<String, StoredDocument> documents =
      new ConcurrentSkipListMap<>();

  @Override
  public void setup() {
    LOG.info("Using in-memory document storage");
  }

  @Override
  public Optional<StoredDocument> get(String key) {
    return Optional.ofNullable(documents.get(key));
  }

  @Override
  public boolean compareAndSwap(String key, Version expected, StoredDocument replacement) {
    if (!key.equals(replacement.key())) {
      throw new IllegalArgumentException(
          "Replacement key " + replacement.key() + " does not match " + key);
    }
    if (expected.isInitial()) {
      return documents.putIfAbsent(key, replacement) == null;
    }
    StoredDocument current = documents.get(key);
    if (current == null || !current.version().equals(expected)) {
      return false;
    }
    return documents.replace(key, current, replacement);
  }

  @Override
  public Optional<StoredDocument> findPending(String keyPrefix, String afterKey) {
    NavigableMap<String, StoredDocument> tail =
        afterKey == null || afterKey.compareTo(keyPrefix) < 0
            ? documents.tailMap(keyPrefix, true)
            : documents.tailMap(afterKey, false);
    for (Map.Entry<String, StoredDocument> entry : tail.entrySet()) {
      if (!entry.getKey().startsWith(keyPrefix)) {
        break;
      }
      if (entry.getValue().pending()) {
        return Optional.of(entry.getValue());
      }
    }
    return Optional.empty();
  }

  public int size() {
    return documents.size();
  }
}
