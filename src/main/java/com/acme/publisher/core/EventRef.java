package com.acme.publisher.core;

/**
 * Pointer into the event log held by the publish table. The pair is the
 * composite key of both tables.
 */
public record EventRef(String aggregateId, int version) {

    @Override
    public String toString() {
        return aggregateId + ":" + version;
    }
}
