package com.acme.brewbucks.ids;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/** Mints fresh identifiers from a clock and a source of random bits. */
public class IdGen {
  private final Clock clock;
  private final LongSupplier randomSource;

  public IdGen() {
    this(Clock.systemUTC(), () -> ThreadLocalRandom.current().nextLong());
  }

  public IdGen(Clock clock, LongSupplier randomSource) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.randomSource = Objects.requireNonNull(randomSource, "randomSource");
  }

  public UntypedId untyped() {
    return new UntypedId(clock.millis(), randomSource.getAsLong());
  }

  public <T> Id<T> generate(Class<T> entity) {
    return Id.of(entity, untyped());
  }
}
