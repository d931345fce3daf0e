package com.ledger.order.service;

import com.ledger.order.domain.OrderAggregate;
import com.ledger.order.domain.OrderEvent;
import com.ledger.order.domain.OrderState;
import com.ledger.order.exception.OrderException;
import com.ledger.order.projection.OrderProjectionHandler;
import com.ledger.order.readmodel.OrderViewStore;
import com.ledger.shared.bus.ProjectionGate;
import com.ledger.shared.eventstore.EventHistory;
import com.ledger.shared.eventstore.EventStore;
import com.ledger.shared.eventstore.Snapshot;
import com.ledger.shared.eventstore.StoredEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Event Replay Service — rebuilds read models from the event store and manages snapshots.
 *
 * Every replay runs under the exclusive projection gate: while it holds the gate, live event
 * bus delivery skips its cycles and entries queue in the channel. Commands keep flowing.
 *
 * Replay is partial-success: a failing or undecodable event is logged, counted and reported,
 * and the pass continues with the next one. The history is read before anything is cleared, so
 * a failed read leaves the read models as they were.
 */
@Slf4j
public class EventReplayService {

    private final EventStore<OrderEvent> eventStore;
    private final OrderProjectionHandler projection;
    private final OrderViewStore viewStore;
    private final ProjectionGate gate;
    private final Duration readTimeout;

    private final Counter replayedCounter;
    private final Counter replayFailureCounter;
    private final Timer replayTimer;

    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

    public EventReplayService(EventStore<OrderEvent> eventStore, OrderProjectionHandler projection,
                              OrderViewStore viewStore, ProjectionGate gate, MeterRegistry meterRegistry) {
        this(eventStore, projection, viewStore, gate, meterRegistry, DEFAULT_READ_TIMEOUT);
    }

    /**
     * @param readTimeout deadline for reading the global history in one batch
     */
    public EventReplayService(EventStore<OrderEvent> eventStore, OrderProjectionHandler projection,
                              OrderViewStore viewStore, ProjectionGate gate, MeterRegistry meterRegistry,
                              Duration readTimeout) {
        this.eventStore = eventStore;
        this.projection = projection;
        this.viewStore = viewStore;
        this.gate = gate;
        this.readTimeout = readTimeout;

        this.replayedCounter = Counter.builder("replay.events")
                .tag("outcome", "success")
                .description("Events re-applied to the read models during replay")
                .register(meterRegistry);
        this.replayFailureCounter = Counter.builder("replay.events")
                .tag("outcome", "failure")
                .description("Events skipped during replay because the projection failed")
                .register(meterRegistry);
        this.replayTimer = Timer.builder("replay.duration")
                .description("Wall time of replay passes")
                .register(meterRegistry);
    }

    // ─── Replay ───────────────────────────────────────────────────────────────

    /**
     * Read the complete history, clear every read model, then re-apply the history in replay
     * order. If the read fails, nothing is cleared.
     */
    public ReplayReport replayAllEvents() {
        return gate.rebuild(() -> {
            log.info("Starting event replay: scope=all");
            EventHistory<OrderEvent> history = eventStore.readHistory(null, readTimeout);
            viewStore.deleteAll();
            return replay("all", history);
        });
    }

    /**
     * Re-apply events that occurred at or after {@code fromTimestamp}, without clearing.
     * Events the views already reflect are skipped by the projection.
     */
    public ReplayReport replayEventsFromTimestamp(Instant fromTimestamp) {
        return gate.rebuild(() -> {
            log.info("Starting event replay: scope=from, fromTimestamp={}", fromTimestamp);
            EventHistory<OrderEvent> history = eventStore.readHistory(fromTimestamp, readTimeout);
            return replay("from:" + fromTimestamp, history);
        });
    }

    public ReplayReport replayEventsForAggregate(String aggregateId) {
        return gate.rebuild(() -> {
            log.info("Starting event replay: scope=aggregate, aggregateId={}", aggregateId);
            List<StoredEvent<OrderEvent>> events = eventStore.getEvents(aggregateId);
            return replay("aggregate:" + aggregateId, new EventHistory<>(events, List.of()));
        });
    }

    private ReplayReport replay(String scope, EventHistory<OrderEvent> history) {
        long started = System.nanoTime();
        List<ReplayReport.Failure> failures = new ArrayList<>();
        int succeeded = 0;
        int total = history.size();

        log.info("Found {} events to replay: scope={}, unreadable={}", total, scope, history.unreadable().size());

        for (EventHistory.UnreadableRecord record : history.unreadable()) {
            replayFailureCounter.increment();
            failures.add(new ReplayReport.Failure(null, record.aggregateId(), null, record.version(), record.message()));
        }

        for (StoredEvent<OrderEvent> stored : history.events()) {
            try {
                projection.handle(stored.event());
                succeeded++;
                replayedCounter.increment();
            } catch (Exception e) {
                log.error("Error replaying event: eventId={}, type={}, aggregateId={}, version={}",
                        stored.eventId(), stored.eventType(), stored.aggregateId(), stored.version(), e);
                replayFailureCounter.increment();
                failures.add(new ReplayReport.Failure(stored.eventId(), stored.aggregateId(), stored.eventType(),
                        stored.version(), e.getMessage()));
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        replayTimer.record(elapsed);

        if (failures.isEmpty()) {
            log.info("Event replay completed: scope={}, events={}, elapsedMs={}", scope, total, elapsed.toMillis());
        } else {
            log.warn("Event replay completed with failures: scope={}, events={}, failed={}, elapsedMs={}",
                    scope, total, failures.size(), elapsed.toMillis());
        }
        return new ReplayReport(scope, total, succeeded, List.copyOf(failures), elapsed);
    }

    // ─── Snapshots ────────────────────────────────────────────────────────────

    /**
     * Fold the full history of an aggregate and persist it as a snapshot at its last version.
     *
     * @throws OrderException NOT_FOUND when the aggregate has no events
     */
    public OrderState createSnapshot(String aggregateId) {
        List<StoredEvent<OrderEvent>> events = eventStore.getEvents(aggregateId);
        if (events.isEmpty()) {
            throw OrderException.notFound(aggregateId);
        }
        OrderState state = OrderAggregate.fromEvents(aggregateId, unwrap(events)).toState();
        eventStore.saveSnapshot(aggregateId, state, state.version());
        return state;
    }

    /**
     * Latest snapshot plus the events recorded after it; empty when no snapshot exists.
     */
    public Optional<OrderAggregate> rebuildAggregateFromSnapshot(String aggregateId) {
        Optional<Snapshot<OrderState>> snapshot = eventStore.getLatestSnapshot(aggregateId, OrderState.class);
        if (snapshot.isEmpty()) {
            log.info("No snapshot found: aggregateId={}", aggregateId);
            return Optional.empty();
        }
        List<StoredEvent<OrderEvent>> tail = eventStore.getEvents(aggregateId, snapshot.get().version());
        return Optional.of(OrderAggregate.fromEvents(aggregateId, unwrap(tail), snapshot.get().state()));
    }

    static List<OrderEvent> unwrap(List<StoredEvent<OrderEvent>> stored) {
        return stored.stream().map(StoredEvent::event).toList();
    }
}
