package com.acme.brewbucks.persistence.jdbc;

import com.acme.brewbucks.store.PermanentStorageException;
import com.acme.brewbucks.store.StorageException;
import com.acme.brewbucks.store.TransientStorageException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Translates SQLException into storage exceptions, deciding whether the failed
 * operation may be retried later.
 */
public final class ExceptionTranslator {

    // SQLState classes: connection exception, transaction rollback
    private static final List<String> TRANSIENT_STATE_CLASSES = List.of("08", "40");

    // data exception, integrity constraint, syntax/access, invalid catalog, invalid schema
    private static final List<String> PERMANENT_STATE_CLASSES = List.of("22", "23", "42", "3D", "3F");

    // 57P01 admin shutdown, 57P03 cannot connect now
    private static final Set<String> TRANSIENT_STATES = Set.of("57P01", "57P03");

    private static final List<String> TRANSIENT_HINTS = List.of(
            "timeout", "connection refused", "deadlock", "too many connections", "pool exhausted");

    private static final List<String> PERMANENT_HINTS = List.of(
            "syntax error", "not found", "does not exist", "constraint violation", "type mismatch");

    // H2: 90002 not a query, 90007 object closed, 42102-42104 table not found, 42122 column not found
    private static final Set<Integer> H2_PERMANENT_CODES = Set.of(90002, 90007, 42102, 42103, 42104, 42122);

    // H2: 50200 lock timeout, 90067 connection broken
    private static final Set<Integer> H2_TRANSIENT_CODES = Set.of(50200, 90067);

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Logs the failure and returns the exception to throw in its place.
     *
     * @param original  the SQLException raised by the driver
     * @param operation description of the operation that failed
     * @param logger    logger of the calling backend
     * @return a TransientStorageException when a retry may succeed, a PermanentStorageException
     *         when it cannot; unknown failures are treated as transient
     */
    public static StorageException translateException(
            SQLException original, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, original);

        String detail = original.getMessage();
        if (isTransient(original)) {
            return new TransientStorageException(
                    String.format("Transient database error during %s: %s", operation, detail), original);
        }
        if (isPermanent(original)) {
            return new PermanentStorageException(
                    String.format("Permanent database error during %s: %s", operation, detail), original);
        }
        return new TransientStorageException(
                String.format("Database error during %s: %s", operation, detail), original);
    }

    static boolean isTransient(SQLException e) {
        String state = e.getSQLState();
        if (state != null && (TRANSIENT_STATES.contains(state) || hasClass(state, TRANSIENT_STATE_CLASSES))) {
            return true;
        }
        return H2_TRANSIENT_CODES.contains(e.getErrorCode()) || mentions(e, TRANSIENT_HINTS);
    }

    static boolean isPermanent(SQLException e) {
        String state = e.getSQLState();
        if (state != null && hasClass(state, PERMANENT_STATE_CLASSES)) {
            return true;
        }
        return H2_PERMANENT_CODES.contains(e.getErrorCode()) || mentions(e, PERMANENT_HINTS);
    }

    private static boolean hasClass(String state, List<String> classes) {
        return classes.stream().anyMatch(state::startsWith);
    }

    private static boolean mentions(SQLException e, List<String> hints) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return hints.stream().anyMatch(lower::contains);
    }
}
