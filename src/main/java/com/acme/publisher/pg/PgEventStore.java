package com.acme.publisher.pg;

import com.acme.publisher.core.Event;
import com.acme.publisher.core.EventNotFoundException;
import com.acme.publisher.core.EventRef;
import com.acme.publisher.core.PublisherException;
import com.acme.publisher.spi.EventStore;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Reads event bodies from the {@code t_aeev_events} log. Log rows are never
 * updated, so the read is safe on any transaction.
 */
@Singleton
public class PgEventStore implements EventStore {

    static final String FETCH_SQL =
        "select typecode, payload from t_aeev_events where aggregate_id = ? and version = ?";

    @Override
    public Event fetch(Connection connection, String aggregateId, int version) {
        try (var ps = connection.prepareStatement(FETCH_SQL)) {
            ps.setString(1, aggregateId);
            ps.setInt(2, version);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new EventNotFoundException(new EventRef(aggregateId, version));
                }
                return new Event(aggregateId, version, rs.getString(1), rs.getBytes(2));
            }
        } catch (SQLException e) {
            throw new PublisherException("Failed to read event " + aggregateId + ":" + version, e);
        }
    }
}
