package com.acme.publisher.relay;

import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only view of relay health: no fatal loop exit and a reachable database.
 * The database is checked through the pool, never on the relay's own
 * connection, so a pass in progress is not disturbed.
 */
@Singleton
public class PublishHealth {
    private static final Logger LOG = LoggerFactory.getLogger(PublishHealth.class);
    private static final int PING_TIMEOUT_SECONDS = 2;

    private final PublishRelay relay;
    private final DataSource dataSource;

    public PublishHealth(PublishRelay relay, DataSource dataSource) {
        this.relay = relay;
        this.dataSource = dataSource;
    }

    public boolean isHealthy() {
        return relay.loopExitError().isEmpty() && ping();
    }

    public Optional<String> lastError() {
        return relay.loopExitError().map(Throwable::getMessage);
    }

    public int consecutiveErrors() {
        return relay.consecutiveErrors();
    }

    boolean ping() {
        try (Connection c = dataSource.getConnection()) {
            if (c.isValid(PING_TIMEOUT_SECONDS)) {
                return true;
            }
            LOG.info("Ping DB returns error: connection not valid");
            return false;
        } catch (SQLException e) {
            LOG.info("Ping DB returns error: {}", e.getMessage());
            return false;
        }
    }
}
