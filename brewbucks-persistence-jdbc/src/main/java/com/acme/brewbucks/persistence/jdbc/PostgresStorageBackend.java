package com.acme.brewbucks.persistence.jdbc;

import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.util.List;
import javax.sql.DataSource;

/**
 * PostgreSQL document storage. Bodies are kept as JSONB; ids use the "C" collation so that key
 * order is byte order, matching the time order of identifiers.
 */
@Singleton
@Requires(property = "storage.backend", value = "jdbc")
@Requires(property = "db.dialect", value = "POSTGRES")
public class PostgresStorageBackend extends JdbcStorageBackend {

  public PostgresStorageBackend(DataSource dataSource) {
    super(dataSource);
  }

  @Override
  protected List<String> getSetupSql() {
    return List.of(
        "CREATE SCHEMA IF NOT EXISTS brewbucks",
        """
        CREATE TABLE IF NOT EXISTS brewbucks.documents (
          id VARCHAR(128) COLLATE "C" PRIMARY KEY,
          version BIGINT NOT NULL,
          pending BOOLEAN NOT NULL DEFAULT FALSE,
          body JSONB NOT NULL
        )
        """,
        """
        CREATE INDEX IF NOT EXISTS documents_pending_idx
        ON brewbucks.documents (id) WHERE pending
        """);
  }

  @Override
  protected String getSelectSql() {
    return "SELECT id, version, pending, body::text AS body FROM brewbucks.documents WHERE id = ?";
  }

  @Override
  protected String getInsertSql() {
    return """
        INSERT INTO brewbucks.documents (id, version, pending, body)
        VALUES (?, ?, ?, ?::jsonb)
        ON CONFLICT (id) DO NOTHING
        """;
  }

  @Override
  protected String getUpdateSql() {
    return """
        UPDATE brewbucks.documents
        SET version = ?, pending = ?, body = ?::jsonb
        WHERE id = ? AND version = ?
        """;
  }

  @Override
  protected String getFindPendingSql() {
    return """
        SELECT id, version, pending, body::text AS body FROM brewbucks.documents
        WHERE pending AND id LIKE ? ESCAPE '\\' AND id > ?
        ORDER BY id
        LIMIT 1
        """;
  }
}
