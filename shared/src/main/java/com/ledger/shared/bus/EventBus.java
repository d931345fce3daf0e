package com.ledger.shared.bus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.ledger.shared.events.DomainEvent;
import com.ledger.shared.events.EventTypes;
import com.ledger.shared.log.AppendOnlyLog;
import com.ledger.shared.log.CounterStore;
import com.ledger.shared.support.DeadlineExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Event Bus — decouples the write path from read-model maintainers.
 *
 * publishEvents() only appends to a shared, durable, ordered channel (EventTypes.EVENT_BUS_STREAM),
 * so command latency does not depend on how many handlers exist.
 *
 * A single background consumer reads the channel from a durable cursor (EventTypes.EVENT_BUS_CURSOR)
 * and hands each entry to every handler registered for its event type, in registration order.
 * The cursor advances after each entry is dispatched:
 *  - handler failures are logged, counted and reported, never retried, never stop the cycle
 *  - a crash between dispatch and cursor advance re-delivers the entry (at-least-once)
 *
 * Lifecycle is explicit: start() schedules the consumer task, stop() cancels it and waits for the
 * in-flight cycle to drain.
 */
@Slf4j
public class EventBus<E extends DomainEvent> {

    private final AppendOnlyLog channel;
    private final CounterStore cursors;
    private final DeadlineExecutor deadlines;
    private final ProjectionGate gate;
    private final EventBusSettings settings;
    private final ObjectWriter writer;
    private final ObjectReader reader;

    private final Map<String, List<EventHandler<? super E>>> handlers = new ConcurrentHashMap<>();

    private final Counter publishedCounter;
    private final Counter dispatchedCounter;
    private final Counter handlerErrorCounter;

    private final Object lifecycleMonitor = new Object();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> consumerTask;

    public EventBus(AppendOnlyLog channel, CounterStore cursors, ObjectMapper objectMapper,
                    Class<E> eventClass, DeadlineExecutor deadlines, ProjectionGate gate,
                    EventBusSettings settings, MeterRegistry meterRegistry) {
        this.channel = channel;
        this.cursors = cursors;
        this.deadlines = deadlines;
        this.gate = gate;
        this.settings = settings;
        this.writer = objectMapper.writerFor(eventClass);
        this.reader = objectMapper.readerFor(eventClass);

        this.publishedCounter = Counter.builder("eventbus.events.published")
                .description("Events appended to the event bus channel")
                .register(meterRegistry);
        this.dispatchedCounter = Counter.builder("eventbus.events.dispatched")
                .description("Channel entries consumed by the event bus")
                .register(meterRegistry);
        this.handlerErrorCounter = Counter.builder("eventbus.handler.errors")
                .description("Handler failures during event delivery")
                .register(meterRegistry);
    }

    // ─── Registration ─────────────────────────────────────────────────────────

    public void registerHandler(String eventType, EventHandler<? super E> handler) {
        handlers.computeIfAbsent(eventType, type -> new CopyOnWriteArrayList<>()).add(handler);
        log.info("Event handler registered: eventType={}, handler={}", eventType, handler.name());
    }

    public List<EventHandler<? super E>> handlersFor(String eventType) {
        return handlers.getOrDefault(eventType, List.of());
    }

    // ─── Publish ──────────────────────────────────────────────────────────────

    public void publishEvents(List<? extends E> events) {
        publishEvents(events, deadlines.defaultTimeout());
    }

    /**
     * Append events to the distribution channel, in order. Handlers run later, on the consumer.
     */
    public void publishEvents(List<? extends E> events, Duration timeout) {
        List<String> entries = new ArrayList<>(events.size());
        for (E event : events) {
            try {
                entries.add(writer.writeValueAsString(event));
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Cannot serialize event " + event.eventId(), e);
            }
        }
        deadlines.run("publishEvents", timeout, () -> entries.forEach(
                entry -> channel.append(EventTypes.EVENT_BUS_STREAM, entry)));
        publishedCounter.increment(events.size());
        events.forEach(event -> log.debug("Event published: eventId={}, type={}, aggregateId={}, version={}",
                event.eventId(), event.eventType(), event.aggregateId(), event.version()));
    }

    // ─── Consume ──────────────────────────────────────────────────────────────

    /**
     * Run one consumer cycle: dispatch up to batchSize undelivered entries.
     * Skipped (entries stay queued) while the projection gate is held by a rebuild.
     */
    public DispatchReport pollOnce() {
        if (!gate.tryEnterDelivery()) {
            log.debug("Event bus cycle skipped: read models are being rebuilt");
            return DispatchReport.skippedCycle();
        }
        try {
            return consumeBatch();
        } finally {
            gate.exitDelivery();
        }
    }

    private DispatchReport consumeBatch() {
        long cursor = deadlines.call("readCursor", () -> cursors.get(EventTypes.EVENT_BUS_CURSOR));
        List<String> entries = deadlines.call("readChannel",
                () -> channel.readFrom(EventTypes.EVENT_BUS_STREAM, cursor, settings.batchSize()));
        if (entries.isEmpty()) {
            return new DispatchReport(0, List.of(), false);
        }

        log.debug("Event bus: processing {} entries from position {}", entries.size(), cursor);

        List<DispatchReport.Failure> failures = new ArrayList<>();
        int delivered = 0;
        long position = cursor;
        for (String entry : entries) {
            dispatch(position, entry, failures);

            long current = position;
            boolean advanced = deadlines.call("advanceCursor",
                    () -> cursors.compareAndSet(EventTypes.EVENT_BUS_CURSOR, current, current + 1));
            if (!advanced) {
                log.warn("Event bus cursor moved concurrently at position {}; ending cycle", position);
                break;
            }
            position++;
            delivered++;
            dispatchedCounter.increment();
        }
        return new DispatchReport(delivered, List.copyOf(failures), false);
    }

    private void dispatch(long position, String entry, List<DispatchReport.Failure> failures) {
        E event;
        try {
            event = reader.readValue(entry);
        } catch (Exception e) {
            log.error("Undecodable event bus entry skipped: position={}", position, e);
            handlerErrorCounter.increment();
            failures.add(new DispatchReport.Failure(position, null, null, null, e.getMessage()));
            return;
        }

        for (EventHandler<? super E> handler : handlersFor(event.eventType())) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                log.error("Error in event handler: handler={}, eventId={}, type={}, aggregateId={}",
                        handler.name(), event.eventId(), event.eventType(), event.aggregateId(), e);
                handlerErrorCounter.increment();
                failures.add(new DispatchReport.Failure(position, event.eventId(), event.eventType(),
                        handler.name(), e.getMessage()));
            }
        }
    }

    private void consumeSafely() {
        try {
            DispatchReport report = pollOnce();
            if (report.hasFailures()) {
                log.warn("Event bus cycle finished with failures: delivered={}, failures={}",
                        report.delivered(), report.failures().size());
            }
        } catch (Exception e) {
            // An exception escaping a scheduled task would silently cancel every later cycle.
            log.error("Event bus cycle failed; retrying next cycle", e);
        }
    }

    // ─── Lifecycle ────────────────────────────────────────────────────────────

    public void start() {
        synchronized (lifecycleMonitor) {
            if (consumerTask != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "event-bus-consumer");
                thread.setDaemon(true);
                return thread;
            });
            long intervalMs = settings.pollInterval().toMillis();
            consumerTask = scheduler.scheduleWithFixedDelay(this::consumeSafely, 0, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Event bus consumer started: pollIntervalMs={}, batchSize={}", intervalMs, settings.batchSize());
        }
    }

    public void stop() {
        synchronized (lifecycleMonitor) {
            if (consumerTask == null) {
                return;
            }
            consumerTask.cancel(false);
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Event bus consumer did not drain within {} ms; interrupting",
                            settings.shutdownTimeout().toMillis());
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
            consumerTask = null;
            scheduler = null;
            log.info("Event bus consumer stopped");
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleMonitor) {
            return consumerTask != null;
        }
    }
}
