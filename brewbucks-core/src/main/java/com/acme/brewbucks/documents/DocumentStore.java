package com.acme.brewbucks.documents;

import com.acme.brewbucks.core.DocumentCodecException;
import com.acme.brewbucks.core.Jsons;
import com.acme.brewbucks.ids.Entities;
import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.store.StorageBackend;
import com.acme.brewbucks.store.StoredDocument;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed load/save of aggregates over a {@link StorageBackend}, with optimistic concurrency on the
 * document version.
 *
 * <p>A save succeeds only if the stored version still equals the version the document was loaded
 * at (or the document does not exist yet and was never saved). On success the in-memory document
 * takes the newly written version, so it can be saved again without reloading.
 */
public class DocumentStore {
  private static final Logger LOG = LoggerFactory.getLogger(DocumentStore.class);

  public static final int DEFAULT_MODIFY_ATTEMPTS = 5;

  private final StorageBackend backend;
  private final int defaultModifyAttempts;

  public DocumentStore(StorageBackend backend) {
    this(backend, DEFAULT_MODIFY_ATTEMPTS);
  }

  public DocumentStore(StorageBackend backend, int defaultModifyAttempts) {
    if (defaultModifyAttempts < 1) {
      throw new IllegalArgumentException(
          "defaultModifyAttempts must be positive: " + defaultModifyAttempts);
    }
    this.backend = Objects.requireNonNull(backend, "backend");
    this.defaultModifyAttempts = defaultModifyAttempts;
  }

  public void setup() {
    backend.setup();
  }

  public <T extends Versioned<T>> Optional<T> load(Class<T> type, Id<T> id) {
    return backend.get(id.toString()).map(stored -> decode(type, stored));
  }

  /**
   * Persists the document and advances its version.
   *
   * @return the version now stored
   * @throws ConcurrencyException if the stored version is not the one the document carries
   */
  public <T extends Versioned<T>> Version save(T doc) {
    DocMeta<T> meta = doc.getMeta();
    String key = meta.getId().toString();
    Version expected = meta.getVersion();

    Version durable = currentVersion(key);
    if (!durable.equals(expected)) {
      throw new ConcurrencyException(key, expected, durable);
    }

    Version next = expected.next();
    StoredDocument replacement = new StoredDocument(key, next, hasPending(doc), encode(doc, next));
    if (!backend.compareAndSwap(key, expected, replacement)) {
      throw new ConcurrencyException(key, expected, currentVersion(key));
    }
    meta.advanceTo(next);
    LOG.debug("Saved {} at {}", key, next);
    return next;
  }

  /** Some document of the given kind that still has undelivered messages, if any exists. */
  public <T extends Versioned<T> & HasMailbox<?>> Optional<T> loadNextUnsent(Class<T> type) {
    return loadNextUnsent(type, null);
  }

  /**
   * The first document of the given kind with undelivered messages whose id sorts after {@code
   * after}; a null {@code after} starts from the beginning. Ids order by key, so repeated calls
   * with the last returned id visit every pending document once.
   *
   * @throws UnreadableDocumentException if the next pending body does not decode
   */
  public <T extends Versioned<T> & HasMailbox<?>> Optional<T> loadNextUnsent(
      Class<T> type, Id<T> after) {
    String afterKey = after == null ? null : after.toString();
    return backend
        .findPending(Entities.keyPrefixOf(type), afterKey)
        .map(stored -> decode(type, stored));
  }

  public <T extends Versioned<T>> T modify(
      Class<T> type, Id<T> id, Function<Optional<T>, T> change) {
    return modify(type, id, change, defaultModifyAttempts);
  }

  /**
   * Load-change-save with retry. On a version conflict the change is applied again to a fresh
   * load, so it must express intent against whatever state it is given.
   *
   * @throws ConcurrencyException if every attempt lost a race
   */
  public <T extends Versioned<T>> T modify(
      Class<T> type, Id<T> id, Function<Optional<T>, T> change, int maxAttempts) {
    ConcurrencyException lastConflict = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      T doc = change.apply(load(type, id));
      if (!id.equals(doc.getMeta().getId())) {
        throw new IllegalStateException(
            "Change for " + id + " returned document " + doc.getMeta().getId());
      }
      try {
        save(doc);
        return doc;
      } catch (ConcurrencyException e) {
        lastConflict = e;
        LOG.warn("Conflict saving {} (attempt {}/{}), retrying", id, attempt, maxAttempts);
      }
    }
    if (lastConflict == null) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    throw lastConflict;
  }

  private Version currentVersion(String key) {
    return backend.get(key).map(StoredDocument::version).orElse(Version.INITIAL);
  }

  private static boolean hasPending(Versioned<?> doc) {
    return doc instanceof HasMailbox<?> owner && !owner.getMailbox().isEmpty();
  }

  private static String encode(Versioned<?> doc, Version version) {
    ObjectNode node = Jsons.toTree(doc);
    node.put(DocMeta.VERSION_FIELD, version.value());
    return Jsons.toJson(node);
  }

  private static <T extends Versioned<T>> T decode(Class<T> type, StoredDocument stored) {
    T doc;
    try {
      doc = Jsons.fromJson(stored.body(), type);
    } catch (DocumentCodecException e) {
      throw new UnreadableDocumentException(stored.key(), e);
    }
    doc.getMeta().advanceTo(stored.version());
    return doc;
  }
}
