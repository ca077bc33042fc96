package com.acme.publisher.core;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * An event as stored in the append-only log. Never mutated after it is written.
 */
public record Event(String aggregateId, int version, String typeCode, byte[] payload) {

    public Event {
        Objects.requireNonNull(aggregateId, "aggregateId");
        payload = payload != null ? payload.clone() : new byte[0];
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public EventRef ref() {
        return new EventRef(aggregateId, version);
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event other)) {
            return false;
        }
        return version == other.version
            && aggregateId.equals(other.aggregateId)
            && Objects.equals(typeCode, other.typeCode)
            && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(aggregateId, version, typeCode);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Event[" + aggregateId + ":" + version + " " + typeCode + " (" + payload.length + " bytes)]";
    }
}
