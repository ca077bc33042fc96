package com.acme.publisher.db;

import com.acme.publisher.core.ConnectException;
import com.acme.publisher.core.NotConnectedException;
import java.io.EOFException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;

/**
 * Tells connectivity failures apart from logical ones. Only the former can be
 * fixed by reconnecting.
 */
public final class ConnectionErrors {

    // SQLSTATE class 08 is "connection exception"; 57P01-57P03 are PostgreSQL shutdown states
    private static final String CONNECTION_EXCEPTION_CLASS = "08";
    private static final Set<String> SERVER_GONE_STATES = Set.of("57P01", "57P02", "57P03");
    private static final int MAX_DEPTH = 16;

    private ConnectionErrors() {
    }

    public static boolean isConnectionError(Throwable error) {
        Throwable t = error;
        for (int depth = 0; t != null && depth < MAX_DEPTH; depth++) {
            if (isConnectionClass(t)) {
                return true;
            }
            if (t instanceof SQLException sql) {
                SQLException next = sql.getNextException();
                if (next != null && next != t && isConnectionClass(next)) {
                    return true;
                }
            }
            if (t.getCause() == t) {
                break;
            }
            t = t.getCause();
        }
        return false;
    }

    private static boolean isConnectionClass(Throwable t) {
        if (t instanceof SQLTransientConnectionException
            || t instanceof SQLNonTransientConnectionException
            || t instanceof SQLRecoverableException
            || t instanceof SocketException
            || t instanceof SocketTimeoutException
            || t instanceof EOFException
            || t instanceof ConnectException
            || t instanceof NotConnectedException) {
            return true;
        }
        if (t instanceof SQLException sql) {
            String state = sql.getSQLState();
            return state != null
                && (state.startsWith(CONNECTION_EXCEPTION_CLASS) || SERVER_GONE_STATES.contains(state));
        }
        return false;
    }
}
