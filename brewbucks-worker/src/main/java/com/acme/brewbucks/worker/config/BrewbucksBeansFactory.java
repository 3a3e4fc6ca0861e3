package com.acme.brewbucks.worker.config;

import com.acme.brewbucks.config.StorageConfig;
import com.acme.brewbucks.config.WorkerConfig;
import com.acme.brewbucks.documents.DocumentStore;
import com.acme.brewbucks.ids.IdGen;
import com.acme.brewbucks.store.InMemoryStorageBackend;
import com.acme.brewbucks.store.StorageBackend;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

/**
 * Wires the framework-free core (store, id generator, config POJOs) into the Micronaut context. The
 * JDBC backends register themselves; the in-memory backend is the fallback.
 */
@Factory
public class BrewbucksBeansFactory {

  /** Creates WorkerConfig bean populated from application.yml worker.* properties */
  @Singleton
  @ConfigurationProperties("worker")
  public WorkerConfig workerConfig() {
    return new WorkerConfig();
  }

  /** Creates StorageConfig bean populated from application.yml storage.* properties */
  @Singleton
  @ConfigurationProperties("storage")
  public StorageConfig storageConfig() {
    return new StorageConfig();
  }

  @Singleton
  public IdGen idGen() {
    return new IdGen();
  }

  @Singleton
  @Requires(property = "storage.backend", value = "memory", defaultValue = "memory")
  public StorageBackend inMemoryStorageBackend() {
    return new InMemoryStorageBackend();
  }

  @Singleton
  public DocumentStore documentStore(StorageBackend backend, StorageConfig storageConfig) {
    return new DocumentStore(backend, storageConfig.getMaxModifyAttempts());
  }
}
