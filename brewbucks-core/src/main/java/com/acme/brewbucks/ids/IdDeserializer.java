package com.acme.brewbucks.ids;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanProperty;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.ContextualDeserializer;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;

/**
 * Reads an {@link Id} from its text form. The deserializer specializes itself to the declared
 * entity type, so a field of type {@code Id<Drink>} rejects text carrying another entity's prefix.
 * Untyped declarations ({@code Id<?>}, raw {@code Id}) accept any prefix.
 */
public class IdDeserializer extends StdDeserializer<Id<?>> implements ContextualDeserializer {
  private final Class<?> entity;

  public IdDeserializer() {
    this(null);
  }

  private IdDeserializer(Class<?> entity) {
    super(Id.class);
    this.entity = entity;
  }

  @Override
  public JsonDeserializer<?> createContextual(DeserializationContext ctxt, BeanProperty property) {
    JavaType type = ctxt.getContextualType();
    if (type == null && property != null) {
      type = property.getType();
    }
    if (type == null || !type.hasRawClass(Id.class) || type.containedTypeCount() == 0) {
      return this;
    }
    Class<?> declared = type.containedType(0).getRawClass();
    if (!declared.isAnnotationPresent(EntityPrefix.class)) {
      return this;
    }
    return new IdDeserializer(declared);
  }

  @Override
  public Id<?> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    if (p.currentToken() != JsonToken.VALUE_STRING) {
      return (Id<?>) ctxt.handleUnexpectedToken(Id.class, p);
    }
    String text = p.getText();
    try {
      if (entity == null) {
        return Id.fromText(text);
      }
      return Id.parse(entity, text);
    } catch (IdParseException e) {
      throw JsonMappingException.from(p, e.getMessage(), e);
    }
  }
}
