package io.stockingest.market;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Datastore failure. Transient failures (lost connection, deadlock, serialization conflict, server restarting)
 * are retried by the writer; everything else fails the batch immediately.
 */
public class StoreException extends IngestException {
    // deadlock, serialization failure, admin/crash shutdown, cannot connect now, too many connections
    private static final Set<String> TRANSIENT_STATES = Set.of("40001", "40P01", "57P01", "57P02", "57P03", "53300");

    private final boolean transientFailure;

    public StoreException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() { return transientFailure; }

    public static StoreException from(String message, SQLException e) {
        return new StoreException(message + ": " + e.getMessage(), e, isTransient(e));
    }

    static boolean isTransient(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) return true;
            String state = cur.getSQLState();
            if (state != null && (state.startsWith("08") || TRANSIENT_STATES.contains(state))) return true;
            if (cur.getNextException() == cur) break;
        }
        return false;
    }
}
