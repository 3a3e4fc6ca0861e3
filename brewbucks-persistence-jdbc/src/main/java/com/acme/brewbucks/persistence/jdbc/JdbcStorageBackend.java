package com.acme.brewbucks.persistence.jdbc;

import com.acme.brewbucks.documents.Version;
import com.acme.brewbucks.store.StorageBackend;
import com.acme.brewbucks.store.StoredDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;

/**
 * Abstract JDBC implementation of StorageBackend using Template Method pattern.
 * Subclasses supply the dialect-specific SQL; every operation is a single statement
 * in auto-commit mode, so the compare-and-swap is atomic without an explicit transaction.
 */
public abstract class JdbcStorageBackend implements StorageBackend {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcStorageBackend.class);

    private static final String DUPLICATE_KEY_STATE = "23505";

    protected final DataSource dataSource;

    protected JdbcStorageBackend(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void setup() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {

            for (String ddl : getSetupSql()) {
                stmt.execute(ddl);
            }
            LOG.info("Document table ready ({})", getClass().getSimpleName());

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "set up document table", LOG);
        }
    }

    @Override
    public Optional<StoredDocument> get(String key) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getSelectSql())) {

            ps.setString(1, key);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "get document " + key, LOG);
        }
    }

    @Override
    public boolean compareAndSwap(String key, Version expected, StoredDocument replacement) {
        if (!key.equals(replacement.key())) {
            throw new IllegalArgumentException(
                    "Replacement key " + replacement.key() + " does not match " + key);
        }
        return expected.isInitial() ? insert(replacement) : update(expected, replacement);
    }

    @Override
    public Optional<StoredDocument> findPending(String keyPrefix, String afterKey) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getFindPendingSql())) {

            ps.setString(1, escapeLike(keyPrefix) + "%");
            ps.setString(2, afterKey == null ? "" : afterKey);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find pending under " + keyPrefix, LOG);
        }
    }

    private boolean insert(StoredDocument doc) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getInsertSql())) {

            ps.setString(1, doc.key());
            ps.setLong(2, doc.version().value());
            ps.setBoolean(3, doc.pending());
            ps.setString(4, doc.body());

            int rows = ps.executeUpdate();
            LOG.debug("Insert {} at {}: {} row(s)", doc.key(), doc.version(), rows);
            return rows == 1;

        } catch (SQLException e) {
            if (DUPLICATE_KEY_STATE.equals(e.getSQLState())) {
                LOG.debug("Insert {} lost to an existing row", doc.key());
                return false;
            }
            throw ExceptionTranslator.translateException(e, "insert document " + doc.key(), LOG);
        }
    }

    private boolean update(Version expected, StoredDocument doc) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(getUpdateSql())) {

            ps.setLong(1, doc.version().value());
            ps.setBoolean(2, doc.pending());
            ps.setString(3, doc.body());
            ps.setString(4, doc.key());
            ps.setLong(5, expected.value());

            int rows = ps.executeUpdate();
            LOG.debug("Update {} {} -> {}: {} row(s)", doc.key(), expected, doc.version(), rows);
            return rows == 1;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "update document " + doc.key(), LOG);
        }
    }

    private StoredDocument mapRow(ResultSet rs) throws SQLException {
        return new StoredDocument(
                rs.getString("id"),
                Version.of(rs.getLong("version")),
                rs.getBoolean("pending"),
                rs.getString("body"));
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    // Template methods for database-specific SQL

    /**
     * Statements creating the document table and its indexes; each must be idempotent.
     */
    protected abstract List<String> getSetupSql();

    /**
     * Parameters: id.
     */
    protected abstract String getSelectSql();

    /**
     * Parameters: id, version, pending, body. Must either insert one row or fail
     * (or affect no rows) if the id already exists.
     */
    protected abstract String getInsertSql();

    /**
     * Parameters: new version, pending, body, id, expected version.
     */
    protected abstract String getUpdateSql();

    /**
     * Parameters: LIKE pattern over id using backslash as escape, exclusive lower bound on id
     * (empty string for none). Returns at most one row, the lowest pending id.
     */
    protected abstract String getFindPendingSql();
}
