package com.acme.publisher.spi;

import java.time.Instant;
import java.util.Optional;

public interface FeedStore {

    Optional<String> currentFeed();

    Optional<FeedPage> lookupFeed(String feedId);

    Optional<String> lookupNext(String feedId);

    Optional<Instant> lastUpdate(String feedId);

    record FeedPage(String feedId, String previous) {
        public boolean hasPrevious() {
            return previous != null && !previous.isBlank();
        }
    }
}
