package com.acme.publisher.web;

import com.acme.publisher.feed.AtomFeed;
import com.acme.publisher.feed.FeedService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Controller("/notifications")
public class FeedController {
    private static final Logger LOG = LoggerFactory.getLogger(FeedController.class);
    private static final String ATOM = "application/atom+xml";

    private final FeedService feeds;

    public FeedController(FeedService feeds) {
        this.feeds = feeds;
    }

    @Get(value = "/recent", produces = {ATOM, MediaType.TEXT_PLAIN})
    public HttpResponse<String> recent() {
        Optional<AtomFeed> feed;
        try {
            feed = feeds.recent();
        } catch (RuntimeException e) {
            LOG.warn("Error reading current feed: {}", e.getMessage());
            return HttpResponse.<String>serverError().body(e.getMessage()).contentType(MediaType.TEXT_PLAIN);
        }
        if (feed.isEmpty()) {
            // 204 carries no body; the reason goes in a header
            return HttpResponse.<String>noContent().header("X-Feed-Status", "Nothing to feed yet");
        }
        return atom(feed.get());
    }

    @Get(value = "/{feedId}", produces = {ATOM, MediaType.TEXT_PLAIN})
    public HttpResponse<String> page(@PathVariable String feedId) {
        Optional<AtomFeed> feed;
        try {
            feed = feeds.page(feedId);
        } catch (RuntimeException e) {
            LOG.warn("Error reading feed {}: {}", feedId, e.getMessage());
            return HttpResponse.<String>serverError().body(e.getMessage()).contentType(MediaType.TEXT_PLAIN);
        }
        if (feed.isEmpty()) {
            return HttpResponse.notFound();
        }
        return atom(feed.get());
    }

    private HttpResponse<String> atom(AtomFeed feed) {
        return HttpResponse.ok(feeds.toXml(feed)).contentType(ATOM);
    }
}
