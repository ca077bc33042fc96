package com.acme.publisher.integration;

import com.acme.publisher.config.PublisherConfig;
import com.acme.publisher.core.Event;
import com.acme.publisher.core.EventNotFoundException;
import com.acme.publisher.core.EventProcessor;
import com.acme.publisher.core.EventProcessorRegistry;
import com.acme.publisher.core.EventRef;
import com.acme.publisher.db.DatabaseConnection;
import com.acme.publisher.pg.PgEventStore;
import com.acme.publisher.pg.PgPublishQueue;
import com.acme.publisher.relay.PublishRelay;
import com.acme.publisher.test.CountingProcessor;
import com.acme.publisher.test.RecordingSleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PublishRelayIntegrationTest extends PostgresTestBase {

    private final List<DatabaseConnection> connections = new ArrayList<>();
    private EventProcessorRegistry registry;
    private PublishRelay relay;

    @BeforeEach
    void setUp() throws Exception {
        exec("delete from t_aepb_publish");
        exec("delete from t_aeev_events");
        exec("create table if not exists processed_events (aggregate_id varchar(60), version integer)");
        exec("delete from processed_events");
        registry = new EventProcessorRegistry();
        relay = newRelay(registry, new PublisherConfig());
    }

    @AfterEach
    void tearDown() {
        connections.forEach(DatabaseConnection::close);
        connections.clear();
    }

    private PublishRelay newRelay(EventProcessorRegistry r, PublisherConfig config) {
        DatabaseConnection db = DatabaseConnection.driverManager(POSTGRES.getUsername(), POSTGRES.getPassword());
        connections.add(db);
        PublishRelay pr = new PublishRelay(db, r, new PgPublishQueue(config), new PgEventStore(), config, new RecordingSleeper());
        pr.connect(POSTGRES.getJdbcUrl(), 3);
        return pr;
    }

    @Test
    void testSinglePassDrainsQueue() throws Exception {
        CountingProcessor counter = new CountingProcessor();
        registry.register("counter", counter);
        storeEvent("agg-1", 1, "TACreated", "{\"foo\":\"f\"}", true);
        storeEvent("agg-1", 2, "TAFooUpdated", "{\"foo\":\"some new foo\"}", true);
        storeEvent("agg-1", 3, "TAFooUpdated", "{\"foo\":\"i changed my mind\"}", true);

        assertEquals(3, relay.processEvents(false));

        assertEquals(3, counter.getCount());
        assertEquals(List.of(1, 2, 3), counter.getEvents().stream().map(Event::version).toList());
        assertEquals("TACreated", counter.getEvents().get(0).typeCode());
        assertEquals("{\"foo\":\"i changed my mind\"}", counter.getEvents().get(2).payloadAsString());
        assertEquals(0, count("select count(*) from t_aepb_publish"));
        assertEquals(3, count("select count(*) from t_aeev_events"));

        assertEquals(0, relay.processEvents(false));
        assertEquals(3, counter.getCount());
    }

    @Test
    void testOneSucceedingProcessorIsEnoughToDelete() throws Exception {
        CountingProcessor failing = new CountingProcessor(true);
        CountingProcessor succeeding = new CountingProcessor();
        registry.register("failing", failing);
        registry.register("succeeding", succeeding);
        storeEvent("agg-1", 1, "TACreated", "{}", true);

        relay.processEvents(false);

        assertEquals(1, failing.getCount());
        assertEquals(1, succeeding.getCount());
        assertEquals(0, count("select count(*) from t_aepb_publish"));

        relay.processEvents(false);
        assertEquals(1, failing.getCount());
    }

    @Test
    void testAllProcessorsFailingKeepsRowForRedelivery() throws Exception {
        CountingProcessor failing = new CountingProcessor(true);
        registry.register("failing", failing);
        storeEvent("agg-1", 1, "TACreated", "{}", true);

        relay.processEvents(false);
        relay.processEvents(false);

        assertEquals(2, failing.getCount());
        assertEquals(1, count("select count(*) from t_aepb_publish"));
        assertEquals(0, relay.consecutiveErrors());
    }

    @Test
    void testFailingProcessorWritesAreUndone() throws Exception {
        registry.register("half-done", conn -> { }, (conn, event) -> {
            insertProcessed(conn, event);
            throw new IllegalStateException("downstream rejected " + event.ref());
        });
        registry.register("recorder", conn -> { }, this::insertProcessed);
        storeEvent("agg-1", 1, "TACreated", "{}", true);

        assertEquals(1, relay.processEvents(false));

        assertEquals(1, count("select count(*) from processed_events"));
        assertEquals(0, count("select count(*) from t_aepb_publish"));
        assertEquals(0, relay.consecutiveErrors());
    }

    @Test
    void testFailingProcessorSqlDoesNotAbortPass() throws Exception {
        registry.register("bad-sql", conn -> { }, (conn, event) -> {
            try (var st = conn.createStatement()) {
                st.execute("select * from no_such_table");
            }
        });
        CountingProcessor counter = new CountingProcessor();
        registry.register("counter", counter);
        storeEvent("agg-1", 1, "TACreated", "{}", true);
        storeEvent("agg-1", 2, "TAFooUpdated", "{}", true);

        assertEquals(2, relay.processEvents(false));

        assertEquals(2, counter.getCount());
        assertEquals(0, count("select count(*) from t_aepb_publish"));
        assertEquals(0, relay.consecutiveErrors());
    }

    @Test
    void testPollIsCappedAtBatchSize() throws Exception {
        CountingProcessor counter = new CountingProcessor();
        registry.register("counter", counter);
        for (int v = 1; v <= 150; v++) {
            storeEvent("agg-" + (v % 7), v, "TAFooUpdated", "{}", true);
        }

        assertEquals(100, relay.processEvents(false));
        assertEquals(50, count("select count(*) from t_aepb_publish"));
        assertEquals(50, relay.processEvents(false));
        assertEquals(150, counter.getCount());
    }

    @Test
    void testEventsOfAnAggregateArriveInVersionOrder() throws Exception {
        CountingProcessor counter = new CountingProcessor();
        registry.register("counter", counter);
        PublisherConfig small = new PublisherConfig();
        small.setBatchSize(3);
        relay = newRelay(registry, small);
        for (int v = 1; v <= 5; v++) {
            storeEvent("agg-a", v, "TAFooUpdated", "{}", false);
            storeEvent("agg-b", v, "TAFooUpdated", "{}", false);
        }
        for (int v = 5; v >= 1; v--) {
            queueRef("agg-b", v);
            queueRef("agg-a", v);
        }

        while (relay.processEvents(false) > 0) {
            // drain
        }

        Map<String, List<Integer>> seen = new HashMap<>();
        for (Event e : counter.getEvents()) {
            seen.computeIfAbsent(e.aggregateId(), k -> new ArrayList<>()).add(e.version());
        }
        assertEquals(List.of(1, 2, 3, 4, 5), seen.get("agg-a"));
        assertEquals(List.of(1, 2, 3, 4, 5), seen.get("agg-b"));
    }

    @Test
    void testMissingLogEntryIsSkippedAndOthersDelivered() throws Exception {
        CountingProcessor counter = new CountingProcessor();
        registry.register("counter", counter);
        queueRef("ghost", 1);
        storeEvent("agg-2", 2, "TAFooUpdated", "{}", true);
        storeEvent("agg-3", 3, "TAFooUpdated", "{}", true);

        assertEquals(3, relay.processEvents(false));

        assertEquals(2, counter.getCount());
        assertEquals(1, count("select count(*) from t_aepb_publish"));
        assertEquals(1, count("select count(*) from t_aepb_publish where aggregate_id = 'ghost'"));
        assertEquals(1, relay.consecutiveErrors());

        assertEquals(1, relay.processEvents(false));
        assertEquals(2, counter.getCount());
        assertEquals(2, relay.consecutiveErrors());
    }

    @Test
    void testEventStoreFetch() throws Exception {
        storeEvent("agg-9", 4, "TAFooUpdated", "{\"foo\":\"bar\"}", false);
        DatabaseConnection db = connections.get(0);
        PgEventStore store = new PgEventStore();

        Event event = store.fetch(db.connection(), "agg-9", 4);

        assertEquals(new EventRef("agg-9", 4), event.ref());
        assertEquals("TAFooUpdated", event.typeCode());
        assertEquals("{\"foo\":\"bar\"}", event.payloadAsString());
        assertThrows(EventNotFoundException.class, () -> store.fetch(db.connection(), "agg-9", 5));
    }

    @Test
    void testDeleteIsIdempotent() throws Exception {
        storeEvent("agg-1", 1, "TACreated", "{}", true);
        PgPublishQueue queue = new PgPublishQueue(new PublisherConfig());
        Connection conn = connections.get(0).connection();

        assertTrue(queue.delete(conn, new EventRef("agg-1", 1)));
        assertFalse(queue.delete(conn, new EventRef("agg-1", 1)));
        assertEquals(0, count("select count(*) from t_aepb_publish"));
    }

    @Test
    void testLockedRowsAreInvisibleToSkipLockedPoller() throws Exception {
        storeEvent("agg-1", 1, "TACreated", "{}", true);
        storeEvent("agg-1", 2, "TAFooUpdated", "{}", true);
        PublisherConfig skipLocked = new PublisherConfig();
        skipLocked.setSkipLocked(true);
        PgPublishQueue queue = new PgPublishQueue(skipLocked);

        try (Connection holder = open(); Connection other = open()) {
            holder.setAutoCommit(false);
            other.setAutoCommit(false);

            assertEquals(2, queue.poll(holder, 100).size());
            assertEquals(0, queue.poll(other, 100).size());

            holder.rollback();
            assertEquals(2, queue.poll(other, 100).size());
            other.rollback();
        }
    }

    @Test
    void testCompetingRelaysDeliverEachEventOnce() throws Exception {
        for (int v = 1; v <= 300; v++) {
            storeEvent("agg-" + (v % 11), v, "TAFooUpdated", "{}", true);
        }
        Set<EventRef> delivered = ConcurrentHashMap.newKeySet();
        List<EventRef> duplicates = new CopyOnWriteArrayList<>();
        EventProcessor recorder = EventProcessor.of(conn -> { }, (conn, event) -> {
            if (!delivered.add(event.ref())) {
                duplicates.add(event.ref());
            }
        });

        PublisherConfig config = new PublisherConfig();
        config.setBatchSize(25);
        List<PublishRelay> relays = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            EventProcessorRegistry own = new EventProcessorRegistry();
            own.register("recorder", recorder);
            relays.add(newRelay(own, config));
        }

        ExecutorService pool = Executors.newFixedThreadPool(relays.size());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (PublishRelay r : relays) {
                futures.add(pool.submit(() -> {
                    int idle = 0;
                    while (idle < 3) {
                        idle = r.processEvents(false) == 0 ? idle + 1 : 0;
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(Collections.emptyList(), duplicates);
        assertThat(delivered).hasSize(300);
        assertEquals(0, count("select count(*) from t_aepb_publish"));
    }

    private void insertProcessed(Connection conn, Event event) throws Exception {
        try (PreparedStatement ps = conn.prepareStatement(
                "insert into processed_events(aggregate_id, version) values (?,?)")) {
            ps.setString(1, event.aggregateId());
            ps.setInt(2, event.version());
            ps.executeUpdate();
        }
    }
}
