package com.acme.publisher.core;

import java.time.Duration;

/**
 * Blocking pause used for back-off. Tests substitute a recording no-op.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isZero() && !duration.isNegative()) {
            Thread.sleep(duration.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
