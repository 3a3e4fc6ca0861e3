package com.acme.brewbucks.store;

import com.acme.brewbucks.documents.Version;
import java.util.Objects;

/**
 * One row of the document store as the backend sees it.
 *
 * @param key the identifier text of the document
 * @param version the version the body was written at
 * @param pending whether the document still holds undelivered outgoing messages
 * @param body the JSON encoding of the document
 */
public record StoredDocument(String key, Version version, boolean pending, String body) {
  public StoredDocument {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(body, "body");
  }
}
