package com.acme.publisher.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

/**
 * Connection, batching and back-off settings for the publish relay.
 */
@ConfigurationProperties("publisher")
public class PublisherConfig {

    private boolean enabled = false;
    private String url;
    private String username;
    private String password;
    private int connectAttempts = 5;
    private int reconnectAttempts = 5;
    private int batchSize = 100;
    private int maxConsecutiveErrors = 100;
    private boolean skipLocked = false;
    private Duration idleDelay = Duration.ofSeconds(5);
    private Duration errorDelay = Duration.ofSeconds(1);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public int getConnectAttempts() {
        return connectAttempts;
    }

    public void setConnectAttempts(int connectAttempts) {
        this.connectAttempts = connectAttempts;
    }

    public int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public void setReconnectAttempts(int reconnectAttempts) {
        this.reconnectAttempts = reconnectAttempts;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxConsecutiveErrors() {
        return maxConsecutiveErrors;
    }

    public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
        this.maxConsecutiveErrors = maxConsecutiveErrors;
    }

    /**
     * When set, pollers skip rows another relay has locked instead of waiting
     * for its transaction to end.
     */
    public boolean isSkipLocked() {
        return skipLocked;
    }

    public void setSkipLocked(boolean skipLocked) {
        this.skipLocked = skipLocked;
    }

    public Duration getIdleDelay() {
        return idleDelay;
    }

    public void setIdleDelay(Duration idleDelay) {
        this.idleDelay = idleDelay;
    }

    public long getIdleDelayMillis() {
        return idleDelay.toMillis();
    }

    public Duration getErrorDelay() {
        return errorDelay;
    }

    public void setErrorDelay(Duration errorDelay) {
        this.errorDelay = errorDelay;
    }

    public long getErrorDelayMillis() {
        return errorDelay.toMillis();
    }
}
