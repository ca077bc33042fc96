package com.acme.publisher.sample;

import com.acme.publisher.core.Event;
import com.acme.publisher.core.EventProcessor;
import com.acme.publisher.core.EventProcessorRegistry;
import io.micronaut.context.annotation.Context;
import io.micronaut.context.annotation.Requires;
import jakarta.annotation.PostConstruct;
import java.sql.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs every published event. Registers itself at startup so the relay has
 * at least one processor out of the box.
 */
@Context
@Requires(property = "publisher.event-log.enabled", value = "true", defaultValue = "true")
public class EventLogProcessor implements EventProcessor {
    private static final Logger LOG = LoggerFactory.getLogger(EventLogProcessor.class);
    public static final String NAME = "event-log";

    private final EventProcessorRegistry registry;

    public EventLogProcessor(EventProcessorRegistry registry) {
        this.registry = registry;
    }

    @PostConstruct
    void register() {
        registry.register(NAME, this);
    }

    @Override
    public void initialize(Connection connection) {
        LOG.info("event log processor initialized");
    }

    @Override
    public void process(Connection connection, Event event) {
        if (event.typeCode() == null || event.typeCode().isBlank()) {
            throw new IllegalArgumentException("Event " + event.ref() + " has no type code");
        }
        LOG.info("{} {} v{}: {}", event.typeCode(), event.aggregateId(), event.version(), event.payloadAsString());
    }
}
