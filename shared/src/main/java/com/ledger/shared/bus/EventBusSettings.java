package com.ledger.shared.bus;

import java.time.Duration;

/**
 * Consumer loop tuning.
 *
 * @param pollInterval    delay between the end of one consumer cycle and the start of the next
 * @param batchSize       maximum channel entries consumed per cycle
 * @param shutdownTimeout how long stop() waits for an in-flight cycle to drain
 */
public record EventBusSettings(Duration pollInterval, int batchSize, Duration shutdownTimeout) {

    public static EventBusSettings defaults() {
        return new EventBusSettings(Duration.ofSeconds(1), 100, Duration.ofSeconds(10));
    }
}
