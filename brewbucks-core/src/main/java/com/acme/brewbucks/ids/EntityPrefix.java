package com.acme.brewbucks.ids;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the text prefix used by identifiers of the annotated entity kind, e.g. {@code
 * "order"} for {@code order.0000000000001q5nnvfqq7krfo}.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface EntityPrefix {
  String value();
}
