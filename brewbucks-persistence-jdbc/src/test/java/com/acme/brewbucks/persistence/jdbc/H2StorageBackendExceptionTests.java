package com.acme.brewbucks.persistence.jdbc;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.brewbucks.documents.Version;
import com.acme.brewbucks.store.PermanentStorageException;
import com.acme.brewbucks.store.StoredDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Exception handling tests for H2StorageBackend. Every operation runs against a database with no
 * tables and must surface a PermanentStorageException.
 */
class H2StorageBackendExceptionTests extends H2StorageFaultyTestBase {

  private H2StorageBackend backend;

  @BeforeEach
  void setupBackend() {
    backend = new H2StorageBackend(getDataSource());
  }

  @Test
  @DisplayName("get should fail when the table doesn't exist")
  void testGet() {
    assertThatThrownBy(() -> backend.get("order.1"))
        .isInstanceOf(PermanentStorageException.class)
        .hasMessageContaining("get document order.1");
  }

  @Test
  @DisplayName("insert should fail when the table doesn't exist")
  void testInsert() {
    StoredDocument doc = new StoredDocument("order.1", Version.of(1), false, "{}");

    assertThatThrownBy(() -> backend.compareAndSwap("order.1", Version.INITIAL, doc))
        .isInstanceOf(PermanentStorageException.class);
  }

  @Test
  @DisplayName("update should fail when the table doesn't exist")
  void testUpdate() {
    StoredDocument doc = new StoredDocument("order.1", Version.of(2), false, "{}");

    assertThatThrownBy(() -> backend.compareAndSwap("order.1", Version.of(1), doc))
        .isInstanceOf(PermanentStorageException.class);
  }

  @Test
  @DisplayName("findPending should fail when the table doesn't exist")
  void testFindPending() {
    assertThatThrownBy(() -> backend.findPending("order."))
        .isInstanceOf(PermanentStorageException.class)
        .hasCauseInstanceOf(java.sql.SQLException.class);
  }
}
