package com.acme.brewbucks.documents;

/** A document that carries outgoing messages persisted together with its own state. */
public interface HasMailbox<M> {
  Mailbox<M> getMailbox();
}
