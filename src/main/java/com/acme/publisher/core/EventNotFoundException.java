package com.acme.publisher.core;

/**
 * The publish table references a log entry that does not exist.
 */
public class EventNotFoundException extends PublisherException {
    private final EventRef ref;

    public EventNotFoundException(EventRef ref) {
        super("Aggregate " + ref.aggregateId() + " version " + ref.version() + " not found");
        this.ref = ref;
    }

    public EventRef ref() {
        return ref;
    }
}
