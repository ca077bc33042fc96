package com.acme.publisher.feed;

import com.acme.publisher.config.FeedConfig;
import com.acme.publisher.spi.FeedStore;
import com.acme.publisher.spi.FeedStore.FeedPage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the notification feed pages. Pages form a backward linked list;
 * the most recent one is named in {@code feed_state}.
 */
@Singleton
public class FeedService {
    private static final Logger LOG = LoggerFactory.getLogger(FeedService.class);
    private static final XmlMapper XML = new XmlMapper();

    private final FeedStore store;
    private final FeedConfig config;
    private final Clock clock;

    @Inject
    public FeedService(FeedStore store, FeedConfig config) {
        this(store, config, Clock.systemUTC());
    }

    public FeedService(FeedStore store, FeedConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    /**
     * The most recent page, or empty when nothing has been fed yet.
     */
    public Optional<AtomFeed> recent() {
        Optional<String> current = store.currentFeed().filter(id -> !id.isBlank());
        if (current.isEmpty()) {
            return Optional.empty();
        }
        String feedId = current.get();
        Instant updated = clock.instant().truncatedTo(ChronoUnit.HOURS);

        AtomFeed feed = new AtomFeed(config.getTitle(), feedId, format(updated))
            .addLink("self", config.getBaseUrl() + "/notifications/recent")
            .addLink("via", config.buildFeedLink(feedId));
        store.lookupFeed(feedId)
            .filter(FeedPage::hasPrevious)
            .ifPresent(page -> feed.addLink("previous", config.buildFeedLink(page.previous())));
        return Optional.of(feed);
    }

    /**
     * A page by id, or empty when no such page exists.
     */
    public Optional<AtomFeed> page(String feedId) {
        LOG.info("processing request for feed {}", feedId);
        Optional<FeedPage> page = store.lookupFeed(feedId);
        if (page.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> next = store.lookupNext(feedId).filter(id -> !id.isBlank());
        Instant updated = store.lastUpdate(feedId).orElse(Instant.EPOCH);
        LOG.debug("feed {}: previous={} next={} updated={}", feedId, page.get().previous(), next.orElse(""), updated);

        AtomFeed feed = new AtomFeed(config.getTitle(), feedId, format(updated))
            .addLink("self", config.buildFeedLink(feedId));
        if (page.get().hasPrevious()) {
            feed.addLink("previous", config.buildFeedLink(page.get().previous()));
        }
        next.ifPresent(n -> feed.addLink("next", config.buildFeedLink(n)));
        return Optional.of(feed);
    }

    public String toXml(AtomFeed feed) {
        try {
            return XML.writeValueAsString(feed);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write feed " + feed.getId(), e);
        }
    }

    private static String format(Instant instant) {
        return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
