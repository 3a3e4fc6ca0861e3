package com.acme.brewbucks.core;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared JSON mapping for stored documents. Fields are mapped directly; getters are never
 * serialized so that derived views (mailboxes, metadata accessors) stay out of the record.
 */
public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
          .setVisibility(PropertyAccessor.GETTER, Visibility.NONE)
          .setVisibility(PropertyAccessor.IS_GETTER, Visibility.NONE)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private Jsons() {
    // Utility class - no instantiation
  }

  public static ObjectMapper mapper() {
    return M;
  }

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new DocumentCodecException("Failed to encode " + o.getClass().getName(), e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new DocumentCodecException("Failed to decode " + clazz.getName(), e);
    }
  }

  public static ObjectNode toTree(Object o) {
    JsonNode node;
    try {
      node = M.valueToTree(o);
    } catch (IllegalArgumentException e) {
      throw new DocumentCodecException("Failed to encode " + o.getClass().getName(), e);
    }
    if (!(node instanceof ObjectNode)) {
      throw new DocumentCodecException(
          o.getClass().getName() + " does not encode to a JSON object", null);
    }
    return (ObjectNode) node;
  }
}
