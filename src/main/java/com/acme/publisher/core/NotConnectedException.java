package com.acme.publisher.core;

public class NotConnectedException extends PublisherException {
    public NotConnectedException() {
        super("Not connected to database - call connect first");
    }
}
