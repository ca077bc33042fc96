package com.acme.publisher.spi;

import com.acme.publisher.core.EventRef;
import java.sql.Connection;
import java.util.List;

/**
 * The event store publish table. Both operations run on the caller's
 * transaction.
 */
public interface PublishQueue {

    /**
     * Locks and returns up to {@code max} pending rows, lowest version first.
     * The locks are held until the caller's transaction ends.
     */
    List<EventRef> poll(Connection tx, int max);

    /**
     * Removes a row. Returns false when the row was already gone.
     */
    boolean delete(Connection tx, EventRef ref);
}
