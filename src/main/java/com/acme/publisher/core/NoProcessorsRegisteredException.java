package com.acme.publisher.core;

public class NoProcessorsRegisteredException extends PublisherException {
    public NoProcessorsRegisteredException() {
        super("No event processors registered - exiting event processing loop");
    }
}
