package com.acme.brewbucks.worker;

import com.acme.brewbucks.config.StorageConfig;
import com.acme.brewbucks.documents.DocumentStore;
import com.acme.brewbucks.menu.MenuService;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Prepares the store and seeds the menu once the context is up. */
@Singleton
@RequiredArgsConstructor
@Slf4j
public class StartupInitializer implements ApplicationEventListener<StartupEvent> {
  private final DocumentStore store;
  private final MenuService menu;
  private final StorageConfig storageConfig;

  @Override
  public void onApplicationEvent(StartupEvent event) {
    log.info("Starting with {} document storage", storageConfig.getBackend());
    store.setup();
    menu.setup();
  }
}
