package com.acme.brewbucks.documents;

import com.acme.brewbucks.core.DocumentCodecException;

/** A stored body could not be decoded into its aggregate type. */
public class UnreadableDocumentException extends DocumentCodecException {
  private final String key;

  public UnreadableDocumentException(String key, Throwable cause) {
    super("Stored document " + key + " cannot be decoded", cause);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
