package com.acme.publisher.core;

public class ProcessorInitializationException extends PublisherException {
    private final String processorName;

    public ProcessorInitializationException(String processorName, Throwable cause) {
        super("Error initializing event processor " + processorName + ": " + cause.getMessage(), cause);
        this.processorName = processorName;
    }

    public String processorName() {
        return processorName;
    }
}
