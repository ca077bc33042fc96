package com.acme.publisher.relay;

import com.acme.publisher.config.PublisherConfig;
import com.acme.publisher.db.DatabaseConnection;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

@Factory
public class PublisherFactory {

    @Singleton
    @Bean(preDestroy = "close")
    DatabaseConnection publisherConnection(PublisherConfig config) {
        return DatabaseConnection.driverManager(config.getUsername(), config.getPassword());
    }
}
