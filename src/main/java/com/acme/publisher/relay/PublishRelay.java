package com.acme.publisher.relay;

import com.acme.publisher.config.PublisherConfig;
import com.acme.publisher.core.Event;
import com.acme.publisher.core.EventNotFoundException;
import com.acme.publisher.core.EventProcessor;
import com.acme.publisher.core.EventProcessorRegistry;
import com.acme.publisher.core.EventRef;
import com.acme.publisher.core.NoProcessorsRegisteredException;
import com.acme.publisher.core.NotConnectedException;
import com.acme.publisher.core.ProcessorInitializationException;
import com.acme.publisher.core.PublishLoopExitException;
import com.acme.publisher.core.PublisherException;
import com.acme.publisher.core.Sleeper;
import com.acme.publisher.db.ConnectionErrors;
import com.acme.publisher.db.DatabaseConnection;
import com.acme.publisher.spi.EventStore;
import com.acme.publisher.spi.PublishQueue;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves events from the publish table to the registered event processors.
 * <p>
 * Each pass locks a batch of publish rows inside one transaction, hands every
 * event to every processor and deletes a row as soon as any processor accepts
 * it. Several relays, in the same or other processes, may work the same table;
 * the row locks taken by the poll keep them from picking up the same rows.
 * <p>
 * Delivery is at least once. A row that no processor accepted stays in the
 * table and all processors see the event again on a later pass. A row that
 * one processor accepted is gone, even for processors that failed on it.
 * A row whose event is missing from the log is skipped and stays queued; it
 * counts against the consecutive error budget while the rest of the batch
 * is committed.
 */
@Singleton
public class PublishRelay {
    private static final Logger LOG = LoggerFactory.getLogger(PublishRelay.class);

    private final DatabaseConnection database;
    private final EventProcessorRegistry registry;
    private final PublishQueue queue;
    private final EventStore events;
    private final Sleeper sleeper;
    private final int batchSize;
    private final int maxConsecutiveErrors;
    private final int reconnectAttempts;
    private final Duration idleDelay;
    private final Duration errorDelay;

    private volatile Throwable loopExitError;
    private volatile int consecutiveErrors;
    private volatile boolean stopRequested;

    @Inject
    public PublishRelay(DatabaseConnection database, EventProcessorRegistry registry, PublishQueue queue,
                        EventStore events, PublisherConfig config) {
        this(database, registry, queue, events, config, Sleeper.THREAD);
    }

    public PublishRelay(DatabaseConnection database, EventProcessorRegistry registry, PublishQueue queue,
                        EventStore events, PublisherConfig config, Sleeper sleeper) {
        this.database = database;
        this.registry = registry;
        this.queue = queue;
        this.events = events;
        this.sleeper = sleeper;
        this.batchSize = config.getBatchSize();
        this.maxConsecutiveErrors = config.getMaxConsecutiveErrors();
        this.reconnectAttempts = config.getReconnectAttempts();
        this.idleDelay = config.getIdleDelay();
        this.errorDelay = config.getErrorDelay();
    }

    public void connect(String connectionString, int maxAttempts) {
        database.connect(connectionString, maxAttempts);
    }

    /**
     * Calls {@code initialize} on every registered processor, stopping at the
     * first failure.
     */
    public void initializeProcessors() {
        Connection conn = null;
        if (database.isConnected()) {
            conn = database.connection();
        } else {
            LOG.warn("No database connection for initializeProcessors - this only makes sense for unit testing");
        }
        for (Map.Entry<String, EventProcessor> entry : registry.entries()) {
            LOG.info("Initializing {}", entry.getKey());
            try {
                entry.getValue().initialize(conn);
            } catch (Exception e) {
                throw new ProcessorInitializationException(entry.getKey(), e);
            }
        }
    }

    /**
     * Processes the publish table. In loop mode passes repeat until
     * {@link #stop()} is called or the consecutive error budget runs out; otherwise
     * exactly one pass runs.
     *
     * @return number of rows polled by the last pass, 0 when it found none or failed
     * @throws NoProcessorsRegisteredException when nothing is registered
     * @throws NotConnectedException when {@link #connect} has not succeeded
     * @throws PublishLoopExitException when the consecutive error budget is exceeded
     */
    public int processEvents(boolean loop) {
        if (loopExitError != null) {
            consecutiveErrors = 0;
        }
        loopExitError = null;
        stopRequested = false;

        if (registry.isEmpty()) {
            NoProcessorsRegisteredException e = new NoProcessorsRegisteredException();
            loopExitError = e;
            throw e;
        }
        if (!database.isConnected()) {
            NotConnectedException e = new NotConnectedException();
            loopExitError = e;
            throw e;
        }

        int polled;
        do {
            polled = runPass();
        } while (loop && !stopRequested);
        return polled;
    }

    public void stop() {
        stopRequested = true;
    }

    /**
     * Records a failure that stopped the relay outside {@link #processEvents},
     * such as a startup error. The first recorded error is kept.
     */
    public void fail(Throwable cause) {
        if (loopExitError == null) {
            loopExitError = cause;
        }
    }

    public Optional<Throwable> loopExitError() {
        return Optional.ofNullable(loopExitError);
    }

    public int consecutiveErrors() {
        return consecutiveErrors;
    }

    private int runPass() {
        Connection tx = null;
        EventNotFoundException skipped = null;
        int polled;
        try {
            LOG.debug("start process events transaction");
            tx = begin();

            LOG.debug("poll for events");
            List<EventRef> refs = queue.poll(tx, batchSize);
            if (refs.isEmpty()) {
                rollback(tx);
                tx = null;
                LOG.info("Nothing to do... time for a {} ms sleep", idleDelay.toMillis());
                pause(idleDelay);
                return 0;
            }

            LOG.debug("process {} events", refs.size());
            for (EventRef ref : refs) {
                LOG.debug("process {}", ref);
                Event event;
                try {
                    event = events.fetch(tx, ref.aggregateId(), ref.version());
                } catch (EventNotFoundException e) {
                    // row stays queued for investigation
                    consecutiveErrors++;
                    skipped = e;
                    LOG.warn("Skipping {}: {}", ref, e.getMessage());
                    continue;
                } catch (RuntimeException e) {
                    LOG.warn("Error reading event to process ({}): {}", ref, e.getMessage());
                    throw e;
                }
                dispatch(tx, event);
            }

            LOG.debug("commit txn");
            commit(tx);
            tx = null;
            polled = refs.size();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
            return 0;
        } catch (SQLException | RuntimeException e) {
            Connection open = tx;
            tx = null;
            passFailed(open, e);
            return 0;
        } finally {
            rollbackQuietly(tx);
        }

        if (skipped == null) {
            consecutiveErrors = 0;
        } else {
            exitIfOverBudget(skipped);
        }
        return polled;
    }

    private void dispatch(Connection tx, Event event) throws SQLException {
        for (Map.Entry<String, EventProcessor> entry : registry.entries()) {
            String name = entry.getKey();
            LOG.debug("call processor {}", name);
            // processors share the pass transaction; a savepoint keeps a failing one from aborting it
            Savepoint savepoint = tx.setSavepoint();
            try {
                entry.getValue().process(tx, event);
            } catch (Throwable t) {
                tx.rollback(savepoint);
                LOG.warn("{}: error processing event {}: {}", name, event, t.toString());
                continue;
            }
            tx.releaseSavepoint(savepoint);
            queue.delete(tx, event.ref());
        }
    }

    private void passFailed(Connection tx, Exception error) {
        consecutiveErrors++;
        LOG.warn("Publish pass failed ({} consecutive): {}", consecutiveErrors, error.toString());
        rollbackQuietly(tx);

        try {
            pause(errorDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }

        if (ConnectionErrors.isConnectionError(error) && !Thread.currentThread().isInterrupted()) {
            try {
                database.reconnect(reconnectAttempts);
                consecutiveErrors = 0;
            } catch (PublisherException e) {
                LOG.warn("Reconnect failed: {}", e.getMessage());
            }
        }

        exitIfOverBudget(error);
    }

    private void exitIfOverBudget(Throwable trigger) {
        if (consecutiveErrors > maxConsecutiveErrors) {
            LOG.error("Giving up after {} consecutive errors, last error: {}", consecutiveErrors, trigger.toString());
            loopExitError = trigger;
            throw new PublishLoopExitException(consecutiveErrors, trigger);
        }
    }

    private Connection begin() throws SQLException {
        Connection conn = database.connection();
        conn.setAutoCommit(false);
        return conn;
    }

    private void commit(Connection tx) throws SQLException {
        tx.commit();
        tx.setAutoCommit(true);
    }

    private void rollback(Connection tx) throws SQLException {
        tx.rollback();
        tx.setAutoCommit(true);
    }

    private void rollbackQuietly(Connection tx) {
        if (tx == null) {
            return;
        }
        try {
            rollback(tx);
        } catch (SQLException | RuntimeException e) {
            LOG.debug("Rollback failed: {}", e.getMessage());
        }
    }

    private void pause(Duration duration) throws InterruptedException {
        sleeper.sleep(duration);
    }
}
