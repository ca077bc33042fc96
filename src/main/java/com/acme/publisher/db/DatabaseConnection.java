package com.acme.publisher.db;

import com.acme.publisher.core.ConnectException;
import com.acme.publisher.core.NotConnectedException;
import com.acme.publisher.core.Sleeper;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A single, verified database connection owned by one publisher. Not pooled:
 * when the connection breaks it is replaced wholesale via {@link #reconnect(int)}.
 */
public class DatabaseConnection implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseConnection.class);
    private static final String VALIDATION_QUERY = "select 1";
    private static final Duration RETRY_PAUSE = Duration.ofSeconds(1);

    private final Opener opener;
    private final Sleeper sleeper;
    private volatile String connectionString;
    private volatile Connection connection;

    @FunctionalInterface
    public interface Opener {
        Connection open(String connectionString) throws SQLException;
    }

    public DatabaseConnection(Opener opener, Sleeper sleeper) {
        this.opener = opener;
        this.sleeper = sleeper;
    }

    public static DatabaseConnection driverManager(String username, String password) {
        return new DatabaseConnection(url -> open(url, username, password), Sleeper.THREAD);
    }

    public static Connection open(String url, String username, String password) throws SQLException {
        if (username == null) {
            return DriverManager.getConnection(url);
        }
        Properties props = new Properties();
        props.setProperty("user", username);
        if (password != null) {
            props.setProperty("password", password);
        }
        return DriverManager.getConnection(url, props);
    }

    /**
     * Opens and verifies a connection, trying up to {@code maxAttempts} times.
     */
    public void connect(String connectionString, int maxAttempts) {
        if (connectionString == null || connectionString.isBlank()) {
            throw new ConnectException("No connection string configured", new IllegalArgumentException("blank connection string"));
        }
        this.connectionString = connectionString;
        Connection previous = this.connection;
        this.connection = openVerified(maxAttempts);
        closeQuietly(previous);
    }

    /**
     * Replaces the held connection with a freshly opened and verified one.
     */
    public void reconnect(int maxAttempts) {
        String target = connectionString;
        if (target == null) {
            throw new NotConnectedException();
        }
        LOG.info("Reconnecting to database");
        Connection previous = this.connection;
        this.connection = null;
        closeQuietly(previous);
        this.connection = openVerified(maxAttempts);
        LOG.info("Reconnected to database");
    }

    public boolean isConnected() {
        return connection != null;
    }

    public Connection connection() {
        Connection c = connection;
        if (c == null) {
            throw new NotConnectedException();
        }
        return c;
    }

    @Override
    public void close() {
        Connection c = connection;
        connection = null;
        closeQuietly(c);
    }

    private Connection openVerified(int maxAttempts) {
        int attempts = Math.max(1, maxAttempts);
        Exception last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Connection candidate = null;
            try {
                candidate = opener.open(connectionString);
                verify(candidate);
                return candidate;
            } catch (SQLException | RuntimeException e) {
                last = e;
                closeQuietly(candidate);
                LOG.warn("Error connecting to database (attempt {}/{}): {}", attempt, attempts, e.getMessage());
            }
            if (attempt < attempts) {
                pause();
            }
        }
        throw new ConnectException("Unable to connect to database after " + attempts + " attempts", last);
    }

    private void pause() {
        try {
            sleeper.sleep(RETRY_PAUSE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectException("Interrupted while connecting to database", e);
        }
    }

    private static void verify(Connection c) throws SQLException {
        try (Statement st = c.createStatement()) {
            st.execute(VALIDATION_QUERY);
        }
    }

    private static void closeQuietly(Connection c) {
        if (c == null) {
            return;
        }
        try {
            c.close();
        } catch (SQLException e) {
            LOG.debug("Error closing connection: {}", e.getMessage());
        }
    }
}
