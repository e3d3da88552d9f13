package com.example.readrouting.endpoint;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;

/**
 * Splits endpoint failures into "could not talk to the node" and "the node rejected the statement".
 */
final class SqlErrorClassifier {

    private SqlErrorClassifier() {
    }

    /**
     * @return true if the failure means the endpoint is unreachable, stalled or refused our credentials
     */
    static boolean isConnectionFailure(Throwable ex) {
        if (ex instanceof DataAccessResourceFailureException || ex instanceof QueryTimeoutException) {
            return true;
        }
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof SQLTransientConnectionException || t instanceof SQLNonTransientConnectionException) {
                return true;
            }
            if (t instanceof SQLException && isConnectionState(((SQLException) t).getSQLState())) {
                return true;
            }
            if (hasConnectionMessage(t.getMessage())) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static boolean isConnectionState(String sqlState) {
        if (sqlState == null) {
            return false;
        }
        return sqlState.startsWith("08")        // connection exception
                || sqlState.startsWith("28")    // invalid authorization
                || sqlState.equals("57P01")     // admin shutdown
                || sqlState.equals("57P03")     // cannot connect now
                || sqlState.equals("57014");    // statement timeout / cancel
    }

    private static boolean hasConnectionMessage(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("connection refused")
                || lower.contains("connection reset")
                || lower.contains("connection is not available")
                || lower.contains("broken pipe");
    }
}
