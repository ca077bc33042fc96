package com.acme.publisher.config;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Settings for the notification feed endpoints.
 */
@ConfigurationProperties("feed")
public class FeedConfig {

    private String baseUrl = "http://localhost:4000";
    private String title = "Event store feed";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    /**
     * Example: 42 -> http://localhost:4000/notifications/42
     */
    public String buildFeedLink(String feedId) {
        return baseUrl + "/notifications/" + feedId;
    }
}
