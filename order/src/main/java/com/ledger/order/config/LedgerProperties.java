package com.ledger.order.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Order ledger settings, bound from the {@code ledger.*} keys of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Store store = new Store();
    private Bus bus = new Bus();
    private Replay replay = new Replay();
    private Summary summary = new Summary();

    @Data
    public static class Store {
        /** Default deadline for event store and event bus operations. */
        private Duration timeout = Duration.ofSeconds(2);
        private int workerThreads = 8;
    }

    @Data
    public static class Bus {
        private Duration pollInterval = Duration.ofSeconds(1);
        private int batchSize = 100;
        private Duration shutdownTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Replay {
        private boolean onStartup = true;
        /** Deadline for reading the whole event history in one batch. */
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Summary {
        private int topCustomers = 10;
    }
}
