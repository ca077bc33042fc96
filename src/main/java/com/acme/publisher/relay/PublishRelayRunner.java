package com.acme.publisher.relay;

import com.acme.publisher.config.PublisherConfig;
import com.acme.publisher.core.PublisherException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects the relay and runs its loop on a dedicated thread once the
 * application has started. A fatal loop exit leaves the process running so
 * the health endpoint can report it.
 */
@Singleton
@Requires(property = "publisher.enabled", value = "true", defaultValue = "false")
public class PublishRelayRunner implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(PublishRelayRunner.class);

    private final PublishRelay relay;
    private final PublisherConfig config;
    private Thread worker;

    public PublishRelayRunner(PublishRelay relay, PublisherConfig config) {
        this.relay = relay;
        this.config = config;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        worker = new Thread(this::run, "publish-relay");
        worker.setDaemon(true);
        worker.start();
    }

    void run() {
        try {
            relay.connect(config.getUrl(), config.getConnectAttempts());
            relay.initializeProcessors();
            LOG.info("Publish relay started");
            relay.processEvents(true);
            LOG.info("Publish relay stopped");
        } catch (PublisherException e) {
            LOG.error("Publish relay exited: {}", e.getMessage(), e);
            relay.fail(e);
        } catch (RuntimeException | Error e) {
            LOG.error("Publish relay died", e);
            relay.fail(e);
        }
    }

    @PreDestroy
    void shutdown() {
        relay.stop();
        Thread w = worker;
        if (w == null) {
            return;
        }
        w.interrupt();
        try {
            w.join(TimeUnit.SECONDS.toMillis(10));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted waiting for publish relay to stop");
        }
    }
}
