package com.acme.brewbucks.outbox;

import com.acme.brewbucks.config.WorkerConfig;
import com.acme.brewbucks.documents.ConcurrencyException;
import com.acme.brewbucks.documents.DocumentStore;
import com.acme.brewbucks.documents.HasMailbox;
import com.acme.brewbucks.documents.NotFoundException;
import com.acme.brewbucks.documents.UnreadableDocumentException;
import com.acme.brewbucks.documents.Versioned;
import com.acme.brewbucks.ids.Id;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the mailboxes of one document kind, delivering each message at least once.
 *
 * <p>A message leaves the mailbox only after it was delivered and the document was saved without
 * it. A failed delivery leaves the document untouched; a crash between delivery and save causes
 * the message to be delivered again, so recipients must be idempotent.
 *
 * @param <T> the document kind
 * @param <M> the message type carried in its mailbox
 */
public abstract class MailboxWorker<T extends Versioned<T> & HasMailbox<M>, M> {
  private static final Logger LOG = LoggerFactory.getLogger(MailboxWorker.class);

  private final DocumentStore store;
  private final Class<T> type;
  private final int maxSaveAttempts;

  protected MailboxWorker(DocumentStore store, Class<T> type, WorkerConfig config) {
    this.store = Objects.requireNonNull(store, "store");
    this.type = Objects.requireNonNull(type, "type");
    this.maxSaveAttempts = config.getMaxSaveAttempts();
  }

  /** Hands one message to its recipient. Any exception marks the delivery as failed. */
  protected abstract void deliver(M message);

  /**
   * Picks one document with pending messages and delivers them all.
   *
   * @return false if no document had anything to deliver
   * @throws DeliveryException if a recipient failed
   */
  public boolean processNext() {
    Optional<T> pending = store.loadNextUnsent(type);
    if (pending.isEmpty()) {
      return false;
    }
    deliverAll(pending.get());
    return true;
  }

  /**
   * One pass over the pending documents in key order, visiting at most {@code maxDocuments}. A
   * document that fails (its recipient throws, or its body does not decode) is logged and skipped
   * for the rest of the pass, so it cannot hold up the documents after it; it is retried on the
   * next pass.
   *
   * @return the number of documents whose mailboxes were fully delivered
   */
  public int drain(int maxDocuments) {
    int delivered = 0;
    int failed = 0;
    Id<T> cursor = null;
    while (delivered + failed < maxDocuments) {
      Optional<T> pending;
      try {
        pending = store.loadNextUnsent(type, cursor);
      } catch (UnreadableDocumentException e) {
        LOG.warn("Skipping {}: {}", e.getKey(), e.getMessage());
        cursor = Id.fromText(e.getKey());
        failed++;
        continue;
      }
      if (pending.isEmpty()) {
        break;
      }
      T doc = pending.get();
      cursor = doc.getMeta().getId();
      try {
        deliverAll(doc);
        delivered++;
      } catch (DeliveryException e) {
        LOG.warn("Delivery from {} failed, will retry: {}", e.getDocumentKey(), e.getMessage());
        failed++;
      }
    }
    if (failed > 0) {
      LOG.warn("{} pass: {} delivered, {} failed", type.getSimpleName(), delivered, failed);
    }
    return delivered;
  }

  public Class<T> getDocumentType() {
    return type;
  }

  private void deliverAll(T doc) {
    String key = doc.getMeta().getId().toString();
    LOG.debug("Delivering {} message(s) from {}", doc.getMailbox().size(), key);

    Optional<M> next;
    while ((next = doc.getMailbox().takeOne()).isPresent()) {
      M message = next.get();
      try {
        deliver(message);
      } catch (RuntimeException e) {
        throw new DeliveryException(key, message, e);
      }
      doc = saveDelivered(doc, message);
    }
  }

  private T saveDelivered(T doc, M delivered) {
    try {
      store.save(doc);
      return doc;
    } catch (ConcurrencyException e) {
      Id<T> id = doc.getMeta().getId();
      LOG.warn("{} changed while delivering {}, removing it from the latest version", id, delivered);
      return store.modify(
          type,
          id,
          current -> {
            T fresh = current.orElseThrow(() -> new NotFoundException(id.toString()));
            fresh.getMailbox().remove(delivered);
            return fresh;
          },
          maxSaveAttempts);
    }
  }
}
