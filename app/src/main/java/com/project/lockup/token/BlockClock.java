package com.project.lockup.token;

import java.time.Instant;

/**
 * Source of the current block timestamp in epoch seconds.
 * Implementations must never go backwards.
 */
@FunctionalInterface
public interface BlockClock {

    long now();

    static BlockClock system() {
        return () -> Instant.now().getEpochSecond();
    }
}
