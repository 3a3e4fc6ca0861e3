package com.acme.brewbucks;

import io.micronaut.runtime.Micronaut;

/**
 * Brewbucks worker. Seeds the menu on startup and keeps draining order and preparation mailboxes
 * on a fixed schedule. Several instances may share one JDBC store.
 */
public class BrewbucksApplication {
  public static void main(String[] args) {
    Micronaut.run(BrewbucksApplication.class, args);
  }
}
