package com.acme.brewbucks.worker;

import com.acme.brewbucks.barista.BaristaWorker;
import com.acme.brewbucks.config.WorkerConfig;
import com.acme.brewbucks.orders.OrderWorker;
import com.acme.brewbucks.outbox.MailboxWorker;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every mailbox worker on a fixed delay. Failed deliveries are skipped inside each worker's
 * pass; an error that ends a pass (storage down) is logged and the other workers still run.
 */
@Singleton
@Requires(property = "worker.enabled", value = "true", defaultValue = "true")
public class WorkerScheduler {
  private static final Logger LOG = LoggerFactory.getLogger(WorkerScheduler.class);

  private final List<MailboxWorker<?, ?>> workers;
  private final WorkerConfig config;

  @Inject
  public WorkerScheduler(OrderWorker orderWorker, BaristaWorker baristaWorker, WorkerConfig config) {
    this(List.of(orderWorker, baristaWorker), config);
  }

  WorkerScheduler(List<MailboxWorker<?, ?>> workers, WorkerConfig config) {
    this.workers = workers;
    this.config = config;
  }

  @Scheduled(fixedDelay = "${worker.sweep-interval:1s}")
  public void tick() {
    for (MailboxWorker<?, ?> worker : workers) {
      String name = worker.getDocumentType().getSimpleName();
      try {
        int processed = worker.drain(config.getMaxDocumentsPerTick());
        if (processed > 0) {
          LOG.debug("Drained {} {} mailbox(es)", processed, name);
        }
      } catch (Exception e) {
        LOG.error("Error in {} worker tick: {}", name, e.getMessage(), e);
      }
    }
  }
}
