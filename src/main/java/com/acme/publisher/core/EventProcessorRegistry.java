package com.acme.publisher.core;

import jakarta.inject.Singleton;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named event processors that receive every published event.
 * <p>
 * Populate before starting the relay; registering while a pass is
 * dispatching is not supported. Iteration follows insertion order, but
 * processors must not depend on it.
 */
@Singleton
public class EventProcessorRegistry {
    private final Map<String, EventProcessor> processors = new LinkedHashMap<>();

    /**
     * Registers a processor under the given name, replacing any previous one.
     */
    public void register(String name, EventProcessor processor) {
        if (name == null || processor == null) {
            throw new InvalidRegistrationException("Registered event processor with one or more nil fields.");
        }
        processors.put(name, processor);
    }

    public void register(String name, EventProcessor.Initializer initializer, EventProcessor.Processor processor) {
        register(name, EventProcessor.of(initializer, processor));
    }

    public void clearAll() {
        processors.clear();
    }

    public boolean isEmpty() {
        return processors.isEmpty();
    }

    public int size() {
        return processors.size();
    }

    public Set<String> names() {
        return new LinkedHashSet<>(processors.keySet());
    }

    public List<Map.Entry<String, EventProcessor>> entries() {
        return new ArrayList<>(processors.entrySet());
    }
}
