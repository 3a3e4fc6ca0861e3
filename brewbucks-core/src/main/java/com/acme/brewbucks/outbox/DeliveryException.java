package com.acme.brewbucks.outbox;

/**
 * Handing a message to its recipient failed. The message stays in the sender's mailbox and will be
 * offered again on a later pass.
 */
public class DeliveryException extends RuntimeException {
  private final String documentKey;
  private final transient Object undelivered;

  public DeliveryException(String documentKey, Object undelivered, Throwable cause) {
    super("Failed to deliver " + undelivered + " from " + documentKey, cause);
    this.documentKey = documentKey;
    this.undelivered = undelivered;
  }

  public String getDocumentKey() {
    return documentKey;
  }

  public Object getUndelivered() {
    return undelivered;
  }
}
