package com.acme.publisher.core;

import java.sql.Connection;

/**
 * Hook into the processing of events in the event store publish table.
 * <p>
 * The same event may be delivered more than once and to processors in any
 * order, so implementations must be idempotent and independent of each other.
 * The connection is the publisher's own; processors must not commit or roll
 * it back.
 */
public interface EventProcessor {

    void initialize(Connection connection) throws Exception;

    void process(Connection connection, Event event) throws Exception;

    @FunctionalInterface
    interface Initializer {
        void initialize(Connection connection) throws Exception;
    }

    @FunctionalInterface
    interface Processor {
        void process(Connection connection, Event event) throws Exception;
    }

    /**
     * Builds a processor from its two callbacks. Both are required.
     */
    static EventProcessor of(Initializer initializer, Processor processor) {
        if (initializer == null || processor == null) {
            throw new InvalidRegistrationException("Registered event processor with one or more nil fields.");
        }
        return new EventProcessor() {
            @Override
            public void initialize(Connection connection) throws Exception {
                initializer.initialize(connection);
            }

            @Override
            public void process(Connection connection, Event event) throws Exception {
                processor.process(connection, event);
            }
        };
    }
}
