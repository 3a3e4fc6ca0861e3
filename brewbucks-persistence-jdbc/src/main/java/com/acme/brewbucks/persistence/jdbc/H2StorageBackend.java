package com.acme.brewbucks.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.List;
import javax.sql.DataSource;

/**
 * H2-specific document storage. H2 has no partial indexes, so pending rows are found through a
 * plain composite index.
 */
@Singleton
@Requires(property = "storage.backend", value = "jdbc")
@Requires(property = "db.dialect", value = "H2")
public class H2StorageBackend extends JdbcStorageBackend {

  public H2StorageBackend(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected List<String> getSetupSql() {
    return List.of(
        """
        CREATE TABLE IF NOT EXISTS documents (
          id VARCHAR(128) PRIMARY KEY,
          version BIGINT NOT NULL,
          pending BOOLEAN NOT NULL DEFAULT FALSE,
          body CLOB NOT NULL
        )
        """,
        "CREATE INDEX IF NOT EXISTS documents_pending_idx ON documents (pending, id)");
  }

  @Override
  protected String getSelectSql() {
    return "SELECT id, version, pending, body FROM documents WHERE id = ?";
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO documents (id, version, pending, body)
        VALUES (?, ?, ?, ?)
        """;
  }

  @Override
  protected String getUpdateSql() {
    return """
        UPDATE documents
        SET version = ?, pending = ?, body = ?
        WHERE id = ? AND version = ?
        """;
  }

  @Override
  protected String getFindPendingSql() {
    return """
        SELECT id, version, pending, body FROM documents
        WHERE pending = TRUE AND id LIKE ? ESCAPE '\\' AND id > ?
        ORDER BY id
        FETCH FIRST 1 ROWS ONLY
        """;
  }
}
