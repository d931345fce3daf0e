package com.ledger.shared.bus;

import com.ledger.shared.events.EventTypes;
import com.ledger.shared.log.InMemoryLogStore;
import com.ledger.shared.support.DeadlineExecutor;
import com.ledger.shared.test.SampleEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * Unit Tests — EventBus delivery semantics over the in-memory channel.
 */
class EventBusTest {

    ExecutorService workers;
    InMemoryLogStore logStore;
    ProjectionGate gate;
    SimpleMeterRegistry meterRegistry;
    EventBus<SampleEvent> bus;

    final List<String> received = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        workers = Executors.newCachedThreadPool();
        logStore = new InMemoryLogStore();
        gate = new ProjectionGate();
        meterRegistry = new SimpleMeterRegistry();
        bus = newBus(new EventBusSettings(Duration.ofMillis(20), 100, Duration.ofSeconds(2)));
    }

    @AfterEach
    void tearDown() {
        bus.stop();
        workers.shutdownNow();
    }

    private EventBus<SampleEvent> newBus(EventBusSettings settings) {
        return new EventBus<>(logStore, logStore, SampleEvent.objectMapper(), SampleEvent.class,
                new DeadlineExecutor(workers, Duration.ofSeconds(2)), gate, settings, meterRegistry);
    }

    private EventHandler<SampleEvent> recording(String name) {
        return event -> received.add(name + ":" + event.aggregateId() + "@" + event.version());
    }

    // ─── Dispatch ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("pollOnce — delivers to every handler of the type, in registration order")
    void pollOnce_shouldDispatchInRegistrationOrder() {
        bus.registerHandler("Created", recording("first"));
        bus.registerHandler("Created", recording("second"));
        bus.registerHandler("Other", recording("other"));

        bus.publishEvents(List.of(SampleEvent.ofType("Created", "agg-1", 1)));
        DispatchReport report = bus.pollOnce();

        assertThat(report.delivered()).isEqualTo(1);
        assertThat(report.hasFailures()).isFalse();
        assertThat(received).containsExactly("first:agg-1@1", "second:agg-1@1");
    }

    @Test
    @DisplayName("pollOnce — a failing handler does not stop later handlers or later events")
    void pollOnce_handlerFailure_shouldBeIsolated() {
        bus.registerHandler("Created", event -> {
            throw new IllegalStateException("projection down");
        });
        bus.registerHandler("Created", recording("after"));

        bus.publishEvents(List.of(
                SampleEvent.ofType("Created", "agg-1", 1),
                SampleEvent.ofType("Created", "agg-2", 1)));
        DispatchReport report = bus.pollOnce();

        assertThat(report.delivered()).isEqualTo(2);
        assertThat(report.failures()).hasSize(2)
                .allSatisfy(f -> assertThat(f.message()).isEqualTo("projection down"));
        assertThat(received).containsExactly("after:agg-1@1", "after:agg-2@1");
        assertThat(meterRegistry.counter("eventbus.handler.errors").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("pollOnce — cursor is incremental: consumed entries are not re-delivered")
    void pollOnce_shouldConsumeIncrementally() {
        bus.registerHandler("Created", recording("h"));

        bus.publishEvents(List.of(SampleEvent.ofType("Created", "agg-1", 1)));
        bus.pollOnce();
        assertThat(bus.pollOnce().delivered()).isZero();

        bus.publishEvents(List.of(SampleEvent.ofType("Created", "agg-2", 1)));
        bus.pollOnce();

        assertThat(received).containsExactly("h:agg-1@1", "h:agg-2@1");
        assertThat(logStore.get(EventTypes.EVENT_BUS_CURSOR)).isEqualTo(2);
    }

    @Test
    @DisplayName("pollOnce — honours batch size")
    void pollOnce_shouldRespectBatchSize() {
        bus = newBus(new EventBusSettings(Duration.ofMillis(20), 2, Duration.ofSeconds(2)));
        bus.registerHandler("Created", recording("h"));
        bus.publishEvents(List.of(
                SampleEvent.ofType("Created", "agg-1", 1),
                SampleEvent.ofType("Created", "agg-2", 1),
                SampleEvent.ofType("Created", "agg-3", 1)));

        assertThat(bus.pollOnce().delivered()).isEqualTo(2);
        assertThat(bus.pollOnce().delivered()).isEqualTo(1);
        assertThat(received).hasSize(3);
    }

    @Test
    @DisplayName("pollOnce — undecodable entries are reported and skipped")
    void pollOnce_undecodableEntry_shouldBeSkipped() {
        bus.registerHandler("Created", recording("h"));
        logStore.append(EventTypes.EVENT_BUS_STREAM, "{not json");
        bus.publishEvents(List.of(SampleEvent.ofType("Created", "agg-1", 1)));

        DispatchReport report = bus.pollOnce();

        assertThat(report.delivered()).isEqualTo(2);
        assertThat(report.failures()).singleElement()
                .satisfies(f -> assertThat(f.position()).isZero());
        assertThat(received).containsExactly("h:agg-1@1");
    }

    // ─── Rebuild Gate ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("pollOnce — while a rebuild holds the gate, entries stay queued")
    void pollOnce_duringRebuild_shouldQueue() throws Exception {
        bus.registerHandler("Created", recording("h"));
        bus.publishEvents(List.of(SampleEvent.ofType("Created", "agg-1", 1)));

        CountDownLatch rebuilding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<?> rebuild = workers.submit(() -> gate.rebuild(() -> {
            rebuilding.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        rebuilding.await();

        DispatchReport skipped = bus.pollOnce();
        assertThat(skipped.skipped()).isTrue();
        assertThat(received).isEmpty();

        release.countDown();
        rebuild.get();

        assertThat(bus.pollOnce().delivered()).isEqualTo(1);
        assertThat(received).containsExactly("h:agg-1@1");
    }

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("start/stop — background consumer delivers, stop drains and halts")
    void startStop_shouldRunBackgroundConsumer() {
        bus.registerHandler("Created", recording("h"));
        bus.start();
        assertThat(bus.isRunning()).isTrue();

        bus.publishEvents(List.of(SampleEvent.ofType("Created", "agg-1", 1)));
        await().atMost(Duration.ofSeconds(5)).until(() -> received.size() == 1);

        bus.stop();
        assertThat(bus.isRunning()).isFalse();

        bus.publishEvents(List.of(SampleEvent.ofType("Created", "agg-2", 1)));
        assertThat(received).containsExactly("h:agg-1@1");
        assertThat(meterRegistry.counter("eventbus.events.published").count()).isEqualTo(2.0);
    }
}
