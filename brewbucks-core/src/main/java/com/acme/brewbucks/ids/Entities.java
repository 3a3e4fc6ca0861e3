package com.acme.brewbucks.ids;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Resolves and caches the {@link EntityPrefix} of entity classes. */
public final class Entities {
  private static final ConcurrentMap<Class<?>, String> PREFIXES = new ConcurrentHashMap<>();

  private Entities() {
    // Utility class - no instantiation
  }

  /**
   * @throws IllegalArgumentException if the class carries no usable {@link EntityPrefix}
   */
  public static String prefixOf(Class<?> entity) {
    return PREFIXES.computeIfAbsent(entity, Entities::readPrefix);
  }

  /** The storage key prefix shared by every identifier of the entity, divider included. */
  public static String keyPrefixOf(Class<?> entity) {
    return prefixOf(entity) + Id.DIVIDER;
  }

  private static String readPrefix(Class<?> entity) {
    EntityPrefix annotation = entity.getAnnotation(EntityPrefix.class);
    if (annotation == null) {
      throw new IllegalArgumentException(
          entity.getName() + " is not annotated with @" + EntityPrefix.class.getSimpleName());
    }
    String prefix = annotation.value();
    if (prefix.isBlank() || prefix.indexOf(Id.DIVIDER) >= 0) {
      throw new IllegalArgumentException(
          "Invalid entity prefix '" + prefix + "' on " + entity.getName());
    }
    return prefix;
  }
}
