package com.acme.publisher.pg;

import com.acme.publisher.core.PublisherException;
import com.acme.publisher.spi.FeedStore;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import javax.sql.DataSource;

/**
 * FeedStore over the {@code feeds}, {@code feed_state} and {@code feed_data}
 * tables, read through the pooled default datasource.
 */
@Singleton
public class PgFeedStore implements FeedStore {

    private final DataSource ds;

    public PgFeedStore(DataSource ds) {
        this.ds = ds;
    }

    @Override
    public Optional<String> currentFeed() {
        return query("select feedid from feed_state", ps -> { }, rs -> rs.getString(1));
    }

    @Override
    public Optional<FeedPage> lookupFeed(String feedId) {
        return query("select feedid, previous from feeds where feedid = ?",
            ps -> ps.setString(1, feedId),
            rs -> new FeedPage(rs.getString(1), rs.getString(2)));
    }

    @Override
    public Optional<String> lookupNext(String feedId) {
        return query("select feedid from feeds where previous = ?",
            ps -> ps.setString(1, feedId),
            rs -> rs.getString(1));
    }

    @Override
    public Optional<Instant> lastUpdate(String feedId) {
        return query("select event_time from feed_data where feedid = ? order by id desc limit 1",
            ps -> ps.setString(1, feedId),
            rs -> {
                Timestamp ts = rs.getTimestamp(1);
                return ts != null ? ts.toInstant() : null;
            });
    }

    private <T> Optional<T> query(String sql, SqlApplier a, RowMapper<T> mapper) {
        try (Connection conn = ds.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            a.apply(ps);
            try (ResultSet rs = ps.executeQuery()) {
                T last = null;
                while (rs.next()) {
                    last = mapper.map(rs);
                }
                return Optional.ofNullable(last);
            }
        } catch (SQLException e) {
            throw new PublisherException("Feed query failed: " + e.getMessage(), e);
        }
    }

    interface SqlApplier {
        void apply(PreparedStatement ps) throws SQLException;
    }

    interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
