package com.acme.publisher.pg;

import com.acme.publisher.config.PublisherConfig;
import com.acme.publisher.core.EventRef;
import com.acme.publisher.core.PublisherException;
import com.acme.publisher.spi.PublishQueue;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PublishQueue over {@code t_aepb_publish}. The {@code for update} lock on the
 * polled rows is what lets several publishers share the table.
 */
@Singleton
public class PgPublishQueue implements PublishQueue {
    private static final Logger LOG = LoggerFactory.getLogger(PgPublishQueue.class);

    static final String POLL_SQL =
        "select aggregate_id, version from t_aepb_publish order by version, aggregate_id limit ? for update";
    static final String POLL_SKIP_LOCKED_SQL =
        "select aggregate_id, version from t_aepb_publish order by version, aggregate_id limit ? for update skip locked";
    static final String DELETE_SQL =
        "delete from t_aepb_publish where aggregate_id = ? and version = ?";

    private final String pollSql;

    public PgPublishQueue(PublisherConfig config) {
        this.pollSql = config.isSkipLocked() ? POLL_SKIP_LOCKED_SQL : POLL_SQL;
    }

    @Override
    public List<EventRef> poll(Connection tx, int max) {
        try (var ps = tx.prepareStatement(pollSql)) {
            ps.setInt(1, max);
            try (ResultSet rs = ps.executeQuery()) {
                List<EventRef> refs = new ArrayList<>();
                while (rs.next()) {
                    refs.add(new EventRef(rs.getString(1), rs.getInt(2)));
                }
                return refs;
            }
        } catch (SQLException e) {
            throw new PublisherException("Failed to poll publish table", e);
        }
    }

    @Override
    public boolean delete(Connection tx, EventRef ref) {
        try (var ps = tx.prepareStatement(DELETE_SQL)) {
            ps.setString(1, ref.aggregateId());
            ps.setInt(2, ref.version());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            LOG.warn("Error deleting aggregate, version {}, {}: {}", ref.aggregateId(), ref.version(), e.getMessage());
            throw new PublisherException("Failed to delete " + ref + " from publish table", e);
        }
    }
}
