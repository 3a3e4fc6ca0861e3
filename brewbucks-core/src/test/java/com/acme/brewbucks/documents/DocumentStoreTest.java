package com.acme.brewbucks.documents;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.acme.brewbucks.core.Jsons;
import com.acme.brewbucks.ids.Id;
import com.acme.brewbucks.ids.IdGen;
import com.acme.brewbucks.ids.UntypedId;
import com.acme.brewbucks.store.InMemoryStorageBackend;
import com.acme.brewbucks.store.StorageBackend;
import com.acme.brewbucks.store.StoredDocument;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DocumentStoreTest {

  private final IdGen idGen = new IdGen();
  private InMemoryStorageBackend backend;
  private DocumentStore store;

  @BeforeEach
  void setUp() {
    backend = new InMemoryStorageBackend();
    store = new DocumentStore(backend);
    store.setup();
  }

  @Nested
  @DisplayName("Load and save")
  class LoadAndSave {

    @Test
    @DisplayName("Should return empty for a missing document")
    void testLoadMissing() {
      assertThat(store.load(Counter.class, idGen.generate(Counter.class))).isEmpty();
    }

    @Test
    @DisplayName("Should save a new document at version 1")
    void testSaveNew() {
      // Given
      Counter counter = new Counter(idGen.generate(Counter.class)).increment();

      // When
      Version written = store.save(counter);

      // Then
      assertThat(written).isEqualTo(Version.of(1));
      assertThat(counter.getMeta().getVersion()).isEqualTo(Version.of(1));
      Counter loaded = store.load(Counter.class, counter.getMeta().getId()).orElseThrow();
      assertThat(loaded.getCount()).isEqualTo(1);
      assertThat(loaded.getMeta().getVersion()).isEqualTo(Version.of(1));
      assertThat(loaded.getMeta().getId()).isEqualTo(counter.getMeta().getId());
    }

    @Test
    @DisplayName("Should allow saving the same instance repeatedly")
    void testSaveTwice() {
      Counter counter = new Counter(idGen.generate(Counter.class));

      store.save(counter);
      store.save(counter.increment());

      assertThat(counter.getMeta().getVersion()).isEqualTo(Version.of(2));
      assertThat(store.load(Counter.class, counter.getMeta().getId()).orElseThrow().getCount())
          .isEqualTo(1);
    }

    @Test
    @DisplayName("Should persist the mailbox and mark the row pending")
    void testMailboxPersisted() {
      Counter counter = new Counter(idGen.generate(Counter.class));
      counter.getMailbox().send(new CounterMsg.Ping(3));
      counter.getMailbox().send(new CounterMsg.Reset("done"));

      store.save(counter);

      Counter loaded = store.load(Counter.class, counter.getMeta().getId()).orElseThrow();
      assertThat(loaded.getMailbox().contents())
          .containsExactly(new CounterMsg.Ping(3), new CounterMsg.Reset("done"));
      assertThat(backend.get(counter.getMeta().getId().toString()).orElseThrow().pending())
          .isTrue();
    }

    @Test
    @DisplayName("Should keep mailbox order across a reload")
    void testMailboxOrderPersisted() {
      Counter counter = new Counter(idGen.generate(Counter.class));
      List<CounterMsg> sent = new ArrayList<>();
      for (int n = 20; n >= 1; n--) {
        CounterMsg.Ping ping = new CounterMsg.Ping(n);
        counter.getMailbox().send(ping);
        sent.add(ping);
      }

      store.save(counter);

      Counter loaded = store.load(Counter.class, counter.getMeta().getId()).orElseThrow();
      assertThat(loaded.getMailbox().contents()).containsExactlyElementsOf(sent);
      assertThat(loaded.getMailbox().takeOne()).contains(new CounterMsg.Ping(20));
    }

    @Test
    @DisplayName("Should write the well-known envelope fields")
    void testEnvelope() throws Exception {
      Counter counter = new Counter(idGen.generate(Counter.class));
      counter.getMailbox().send(new CounterMsg.Ping(1));

      store.save(counter);

      String body = backend.get(counter.getMeta().getId().toString()).orElseThrow().body();
      JsonNode json = Jsons.mapper().readTree(body);
      assertThat(json.get("_id").asText()).isEqualTo(counter.getMeta().getId().toString());
      assertThat(json.get("_version").asLong()).isEqualTo(1L);
      assertThat(json.get("_outgoing").get(0).get("type").asText()).isEqualTo("ping");
      assertThat(json.has("meta")).isFalse();
      assertThat(json.has("mailbox")).isFalse();
    }
  }

  @Nested
  @DisplayName("Optimistic concurrency")
  class OptimisticConcurrency {

    @Test
    @DisplayName("Should reject a save from a stale copy")
    void testStaleCopy() {
      // Given
      Counter original = new Counter(idGen.generate(Counter.class));
      store.save(original);
      Counter first = store.load(Counter.class, original.getMeta().getId()).orElseThrow();
      Counter second = store.load(Counter.class, original.getMeta().getId()).orElseThrow();
      store.save(first.increment());
      String key = original.getMeta().getId().toString();
      StoredDocument before = backend.get(key).orElseThrow();
      second.getMailbox().send(new CounterMsg.Reset("stale"));

      // When / Then
      assertThatThrownBy(() -> store.save(second.increment()))
          .isInstanceOf(ConcurrencyException.class)
          .satisfies(
              e -> {
                ConcurrencyException ce = (ConcurrencyException) e;
                assertThat(ce.getExpected()).isEqualTo(Version.of(1));
                assertThat(ce.getActual()).isEqualTo(Version.of(2));
              });
      assertThat(second.getMeta().getVersion()).isEqualTo(Version.of(1));
      assertThat(backend.get(key)).contains(before);
    }

    @Test
    @DisplayName("Should reject a second new document with an existing id")
    void testDuplicateNew() {
      Id<Counter> id = idGen.generate(Counter.class);
      store.save(new Counter(id));

      assertThatThrownBy(() -> store.save(new Counter(id)))
          .isInstanceOf(ConcurrencyException.class);
    }

    @Test
    @DisplayName("Should report a lost compare-and-swap as a conflict")
    void testLostSwap() {
      StorageBackend racing = mock(StorageBackend.class);
      when(racing.get(anyString())).thenReturn(Optional.empty());
      when(racing.compareAndSwap(anyString(), eq(Version.INITIAL), any(StoredDocument.class)))
          .thenReturn(false);
      DocumentStore racingStore = new DocumentStore(racing);
      Counter counter = new Counter(idGen.generate(Counter.class));

      assertThatThrownBy(() -> racingStore.save(counter)).isInstanceOf(ConcurrencyException.class);
      assertThat(counter.getMeta().getVersion()).isEqualTo(Version.INITIAL);
    }

    @Test
    @DisplayName("Should not lose updates from concurrent modifiers")
    void testConcurrentModify() throws Exception {
      Id<Counter> id = idGen.generate(Counter.class);
      store.save(new Counter(id));
      int threads = 8;
      int incrementsPerThread = 25;
      DocumentStore patientStore = new DocumentStore(backend, 1_000);
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<?>> futures = new ArrayList<>();

      try {
        for (int t = 0; t < threads; t++) {
          futures.add(
              pool.submit(
                  () -> {
                    start.await();
                    for (int i = 0; i < incrementsPerThread; i++) {
                      patientStore.modify(
                          Counter.class, id, current -> current.orElseThrow().increment());
                    }
                    return null;
                  }));
        }
        start.countDown();
        for (Future<?> future : futures) {
          future.get(30, TimeUnit.SECONDS);
        }
      } finally {
        pool.shutdownNow();
      }

      Counter result = store.load(Counter.class, id).orElseThrow();
      assertThat(result.getCount()).isEqualTo(threads * incrementsPerThread);
      assertThat(result.getMeta().getVersion())
          .isEqualTo(Version.of(1L + threads * incrementsPerThread));
    }
  }

  @Nested
  @DisplayName("Modify")
  class Modify {

    @Test
    @DisplayName("Should create the document when absent")
    void testCreate() {
      Id<Counter> id = idGen.generate(Counter.class);

      Counter created =
          store.modify(Counter.class, id, current -> current.orElseGet(() -> new Counter(id)));

      assertThat(created.getMeta().getVersion()).isEqualTo(Version.of(1));
    }

    @Test
    @DisplayName("Should re-apply the change after a conflict")
    void testRetry() {
      Id<Counter> id = idGen.generate(Counter.class);
      store.save(new Counter(id));
      AtomicInteger calls = new AtomicInteger();

      Counter result =
          store.modify(
              Counter.class,
              id,
              current -> {
                Counter counter = current.orElseThrow();
                if (calls.incrementAndGet() == 1) {
                  // someone else gets in first
                  store.save(store.load(Counter.class, id).orElseThrow().increment());
                }
                return counter.increment();
              });

      assertThat(calls).hasValue(2);
      assertThat(result.getCount()).isEqualTo(2);
      assertThat(store.load(Counter.class, id).orElseThrow().getCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should give up after the attempt limit")
    void testGiveUp() {
      Id<Counter> id = idGen.generate(Counter.class);
      store.save(new Counter(id));

      assertThatThrownBy(
              () ->
                  store.modify(
                      Counter.class,
                      id,
                      current -> {
                        store.save(store.load(Counter.class, id).orElseThrow().increment());
                        return current.orElseThrow().increment();
                      },
                      3))
          .isInstanceOf(ConcurrencyException.class);
      assertThat(store.load(Counter.class, id).orElseThrow().getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should refuse a change that swaps the document identity")
    void testIdentitySwap() {
      Id<Counter> id = idGen.generate(Counter.class);

      assertThatThrownBy(
              () ->
                  store.modify(
                      Counter.class, id, current -> new Counter(idGen.generate(Counter.class))))
          .isInstanceOf(IllegalStateException.class);
    }
  }

  @Nested
  @DisplayName("Pending documents")
  class Pending {

    @Test
    @DisplayName("Should find nothing when no mailbox has messages")
    void testNothingPending() {
      store.save(new Counter(idGen.generate(Counter.class)));

      assertThat(store.loadNextUnsent(Counter.class)).isEmpty();
    }

    @Test
    @DisplayName("Should find a document with undelivered messages")
    void testFindPending() {
      store.save(new Counter(idGen.generate(Counter.class)));
      Counter busy = new Counter(idGen.generate(Counter.class));
      busy.getMailbox().send(new CounterMsg.Ping(1));
      store.save(busy);

      Optional<Counter> found = store.loadNextUnsent(Counter.class);

      assertThat(found).isPresent();
      assertThat(found.get().getMeta().getId()).isEqualTo(busy.getMeta().getId());
    }

    @Test
    @DisplayName("Should resume the scan after a given document")
    void testFindPendingAfter() {
      Counter low = new Counter(Id.of(Counter.class, new UntypedId(1L, 0L)));
      low.getMailbox().send(new CounterMsg.Ping(1));
      store.save(low);
      Counter high = new Counter(Id.of(Counter.class, new UntypedId(2L, 0L)));
      high.getMailbox().send(new CounterMsg.Ping(2));
      store.save(high);

      assertThat(store.loadNextUnsent(Counter.class, null))
          .map(c -> c.getMeta().getId())
          .contains(low.getMeta().getId());
      assertThat(store.loadNextUnsent(Counter.class, low.getMeta().getId()))
          .map(c -> c.getMeta().getId())
          .contains(high.getMeta().getId());
      assertThat(store.loadNextUnsent(Counter.class, high.getMeta().getId())).isEmpty();
    }

    @Test
    @DisplayName("Should name the key of a pending body that does not decode")
    void testUnreadable() {
      String key = Id.of(Counter.class, new UntypedId(1L, 0L)).toString();
      backend.compareAndSwap(
          key, Version.INITIAL, new StoredDocument(key, Version.of(1), true, "{\"count\": \"x\"}"));

      assertThatThrownBy(() -> store.loadNextUnsent(Counter.class))
          .isInstanceOf(UnreadableDocumentException.class)
          .satisfies(e -> assertThat(((UnreadableDocumentException) e).getKey()).isEqualTo(key));
    }

    @Test
    @DisplayName("Should clear the pending flag once the mailbox is empty")
    void testCleared() {
      Counter busy = new Counter(idGen.generate(Counter.class));
      busy.getMailbox().send(new CounterMsg.Ping(1));
      store.save(busy);

      busy.getMailbox().takeOne();
      store.save(busy);

      assertThat(store.loadNextUnsent(Counter.class)).isEmpty();
    }
  }

  @Test
  @DisplayName("Should reject a non-positive attempt limit")
  void testInvalidAttemptLimit() {
    assertThatThrownBy(() -> new DocumentStore(backend, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
