package com.acme.publisher.core;

/**
 * Opening or verifying a database connection failed. The driver error is the cause.
 */
public class ConnectException extends PublisherException {
    public ConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
