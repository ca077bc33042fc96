package com.acme.publisher.core;

/**
 * Thrown when the publish loop gives up after too many consecutive failures.
 * The failure that tipped it over is the cause.
 */
public class PublishLoopExitException extends PublisherException {
    private final int consecutiveErrors;

    public PublishLoopExitException(int consecutiveErrors, Throwable cause) {
        super("Publish loop exiting after " + consecutiveErrors + " consecutive errors: " + cause.getMessage(), cause);
        this.consecutiveErrors = consecutiveErrors;
    }

    public int consecutiveErrors() {
        return consecutiveErrors;
    }
}
