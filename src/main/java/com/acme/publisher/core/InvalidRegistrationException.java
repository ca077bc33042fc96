package com.acme.publisher.core;

public class InvalidRegistrationException extends PublisherException {
    public InvalidRegistrationException(String message) {
        super(message);
    }
}
