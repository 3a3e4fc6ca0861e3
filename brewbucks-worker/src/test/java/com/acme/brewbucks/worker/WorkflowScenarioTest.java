package com.acme.brewbucks.worker;

import static org.assertj.core.api.Assertions.*;

import com.acme.brewbucks.barista.BaristaService;
import com.acme.brewbucks.barista.BaristaWorker;
import com.acme.brewbucks.barista.Preparation;
import com.acme.brewbucks.barista.PrepareDrink;
import com.acme.brewbucks.config.WorkerConfig;
import com.acme.brewbucks.documents.DocumentStore;
import com.acme.brewbucks.documents.NotFoundException;
import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.ids.IdGen;
import com.acme.brewbucks.menu.Drink;
import com.acme.brewbucks.orders.FulfillDrink;
import com.acme.brewbucks.orders.Order;
import com.acme.brewbucks.orders.OrderService;
import com.acme.brewbucks.orders.OrderStatus;
import com.acme.brewbucks.orders.OrderWorker;
import com.acme.brewbucks.orders.PlaceOrder;
import com.acme.brewbucks.orders.QueryOrder;
import com.acme.brewbucks.outbox.DeliveryException;
import com.acme.brewbucks.store.InMemoryStorageBackend;
import com.acme.brewbucks.store.StorageBackend;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Order to barista and back, through both mailboxes. */
class WorkflowScenarioTest {

  private final IdGen idGen = new IdGen();
  private final WorkerConfig config = new WorkerConfig();
  private final Id<Drink> umbrella = Id.hashed(Drink.class, "Umbrella");

  private DocumentStore store;
  private OrderService orders;
  private BaristaService barista;

  protected StorageBackend newBackend() {
    return new InMemoryStorageBackend();
  }

  @BeforeEach
  void setUp() {
    store = new DocumentStore(newBackend());
    store.setup();
    orders = new OrderService(store, idGen);
    barista = new BaristaService(store);
  }

  @Test
  @DisplayName("a placed order should end up made with both mailboxes empty")
  void testEndToEnd() {
    // Given
    OrderWorker orderWorker = new OrderWorker(store, config, barista);
    BaristaWorker baristaWorker = new BaristaWorker(store, config, orders);
    Id<Order> orderId = orders.placeOrder(new PlaceOrder(umbrella));
    assertThat(orders.queryOrder(new QueryOrder(orderId)).made()).isFalse();

    // When
    assertThat(orderWorker.drain(10)).isEqualTo(1);
    assertThat(baristaWorker.drain(10)).isEqualTo(1);

    // Then
    assertThat(orders.queryOrder(new QueryOrder(orderId)))
        .isEqualTo(new OrderStatus(orderId, true));
    assertThat(store.load(Order.class, orderId).orElseThrow().getMailbox().isEmpty()).isTrue();
    Preparation ticket =
        store.load(Preparation.class, Preparation.idFor(orderId)).orElseThrow();
    assertThat(ticket.getMailbox().isEmpty()).isTrue();
    assertThat(store.loadNextUnsent(Order.class)).isEmpty();
    assertThat(store.loadNextUnsent(Preparation.class)).isEmpty();
  }

  @Test
  @DisplayName("querying an unknown order should fail with not found")
  void testUnknownOrder() {
    Id<Order> unknown = idGen.generate(Order.class);

    assertThatThrownBy(() -> orders.queryOrder(new QueryOrder(unknown)))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  @DisplayName("fulfilling twice should leave the order made")
  void testFulfillTwice() {
    Id<Order> orderId = orders.placeOrder(new PlaceOrder(umbrella));

    assertThat(orders.fulfillDrink(new FulfillDrink(orderId)).made()).isTrue();
    assertThat(orders.fulfillDrink(new FulfillDrink(orderId)).made()).isTrue();
    assertThat(orders.queryOrder(new QueryOrder(orderId)).made()).isTrue();
  }

  @Test
  @DisplayName("a barista failing once should still get the request on the next pass")
  void testFailOnce() {
    // Given
    AtomicInteger calls = new AtomicInteger();
    OrderWorker flakyOrderWorker =
        new OrderWorker(
            store,
            config,
            (PrepareDrink cmd) -> {
              if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("barista on break");
              }
              return barista.prepareDrink(cmd);
            });
    BaristaWorker baristaWorker = new BaristaWorker(store, config, orders);
    Id<Order> orderId = orders.placeOrder(new PlaceOrder(umbrella));

    // When
    assertThatThrownBy(() -> flakyOrderWorker.processNext())
        .isInstanceOf(DeliveryException.class);
    assertThat(store.load(Order.class, orderId).orElseThrow().getMailbox().size()).isEqualTo(1);
    flakyOrderWorker.drain(10);
    baristaWorker.drain(10);

    // Then
    assertThat(calls).hasValue(2);
    assertThat(orders.queryOrder(new QueryOrder(orderId)).made()).isTrue();
    assertThat(store.load(Order.class, orderId).orElseThrow().getMailbox().isEmpty()).isTrue();
  }

  @Test
  @DisplayName("a ticket for a vanished order should not block other tickets")
  void testOrphanedTicket() {
    // Given
    Id<Order> vanished = idGen.generate(Order.class);
    barista.prepareDrink(new PrepareDrink(umbrella, vanished));
    Id<Order> orderId = orders.placeOrder(new PlaceOrder(umbrella));
    new OrderWorker(store, config, barista).drain(10);
    BaristaWorker baristaWorker = new BaristaWorker(store, config, orders);

    // When
    int delivered = baristaWorker.drain(10);

    // Then
    assertThat(delivered).isEqualTo(1);
    assertThat(orders.queryOrder(new QueryOrder(orderId)).made()).isTrue();
    assertThat(store.loadNextUnsent(Preparation.class))
        .map(ticket -> ticket.getMeta().getId())
        .contains(Preparation.idFor(vanished));
  }

  @Test
  @DisplayName("a redelivered request should be absorbed by the barista")
  void testRedelivery() {
    Id<Order> orderId = orders.placeOrder(new PlaceOrder(umbrella));
    // simulate a crash after delivery but before the order was saved
    barista.prepareDrink(new PrepareDrink(umbrella, orderId));

    new OrderWorker(store, config, barista).drain(10);
    new BaristaWorker(store, config, orders).drain(10);

    assertThat(orders.queryOrder(new QueryOrder(orderId)).made()).isTrue();
    assertThat(
            store
                .load(Preparation.class, Preparation.idFor(orderId))
                .orElseThrow()
                .getMeta()
                .getVersion()
                .value())
        .isEqualTo(2L);
  }
}
