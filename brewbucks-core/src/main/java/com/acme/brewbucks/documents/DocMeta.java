package com.acme.brewbucks.documents;

import com.acme.brewbucks.ids.Id;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/**
 * Identity and version of a stored document, embedded (unwrapped) in every aggregate. The version
 * is only moved forward by the {@link DocumentStore}.
 */
public final class DocMeta<T> {
  public static final String ID_FIELD = "_id";
  public static final String VERSION_FIELD = "_version";

  @JsonProperty(ID_FIELD)
  private Id<T> id;

  @JsonProperty(VERSION_FIELD)
  private Version version;

  public DocMeta(Id<T> id) {
    this.id = Objects.requireNonNull(id, "id");
    this.version = Version.INITIAL;
  }

  @SuppressWarnings("unused")
  private DocMeta() {
    // for Jackson
  }

  public Id<T> getId() {
    return id;
  }

  public Version getVersion() {
    return version;
  }

  void advanceTo(Version version) {
    this.version = version;
  }

  @Override
  public String toString() {
    return id + "@" + version;
  }
}
