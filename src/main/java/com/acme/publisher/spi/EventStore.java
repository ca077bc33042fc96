package com.acme.publisher.spi;

import com.acme.publisher.core.Event;
import java.sql.Connection;

public interface EventStore {

    /**
     * Point lookup in the event log.
     *
     * @throws com.acme.publisher.core.EventNotFoundException when no such event exists
     */
    Event fetch(Connection connection, String aggregateId, int version);
}
