package com.acme.brewbucks.documents;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Set of outgoing messages over the owning document's own message collection. Sending a message
 * that is already queued is a no-op; iteration follows insertion order.
 */
public final class Mailbox<M> {
  private final Set<M> outgoing;

  public Mailbox(Set<M> outgoing) {
    this.outgoing = Objects.requireNonNull(outgoing, "outgoing");
  }

  /**
   * A fresh backing collection for a document field. The field must also be read back as a
   * {@link LinkedHashSet} ({@code JsonDeserialize(as = LinkedHashSet.class)}) so a loaded mailbox
   * keeps its sending order.
   */
  public static <M> Set<M> newOutgoing() {
    return new LinkedHashSet<>();
  }

  /**
   * @return false if an equal message was already queued
   */
  public boolean send(M message) {
    return outgoing.add(Objects.requireNonNull(message, "message"));
  }

  /** Removes and returns the next message. */
  public Optional<M> takeOne() {
    Iterator<M> it = outgoing.iterator();
    if (!it.hasNext()) {
      return Optional.empty();
    }
    M message = it.next();
    it.remove();
    return Optional.of(message);
  }

  /**
   * @return false if the message was not queued
   */
  public boolean remove(M message) {
    return outgoing.remove(message);
  }

  public boolean isEmpty() {
    return outgoing.isEmpty();
  }

  public int size() {
    return outgoing.size();
  }

  public Set<M> contents() {
    return Collections.unmodifiableSet(outgoing);
  }

  @Override
  public String toString() {
    return "Mailbox" + outgoing;
  }
}
