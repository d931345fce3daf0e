package com.ledger.shared.eventstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledger.shared.events.DomainEvent;
import com.ledger.shared.events.EventTypes;
import com.ledger.shared.log.AppendOnlyLog;
import com.ledger.shared.log.CounterStore;
import com.ledger.shared.support.DeadlineExecutor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Event Store — per-aggregate append-only event log with a snapshot side-store.
 *
 * Layout (see EventTypes):
 *   events:{aggregateId}     append-only stream of serialized StoredEvent envelopes
 *   versions:{aggregateId}   version pointer = version of the last appended event
 *   snapshots:{aggregateId}  append-only stream of serialized snapshots
 *
 * Optimistic concurrency: saveEvents is a single conditional append on the version pointer.
 * There is no separate read-then-write, so two writers that loaded the same version can never
 * both succeed.
 *
 * Every operation accepts a deadline; the overloads without one use the executor's default.
 */
@Slf4j
public class EventStore<E extends DomainEvent> {

    private final AppendOnlyLog eventLog;
    private final CounterStore counters;
    private final ObjectMapper objectMapper;
    private final DeadlineExecutor deadlines;
    private final JavaType storedEventType;

    public EventStore(AppendOnlyLog eventLog, CounterStore counters, ObjectMapper objectMapper,
                      DeadlineExecutor deadlines, Class<E> eventClass) {
        this.eventLog = eventLog;
        this.counters = counters;
        this.objectMapper = objectMapper;
        this.deadlines = deadlines;
        this.storedEventType = objectMapper.getTypeFactory()
                .constructParametricType(StoredEvent.class, eventClass);
    }

    // ─── Write Path ───────────────────────────────────────────────────────────

    public void saveEvents(String aggregateId, List<? extends E> events, long expectedVersion) {
        saveEvents(aggregateId, events, expectedVersion, deadlines.defaultTimeout());
    }

    /**
     * Append events for one aggregate if its persisted version still equals {@code expectedVersion}.
     *
     * Events must belong to {@code aggregateId} and carry the contiguous versions
     * expectedVersion+1 .. expectedVersion+n. All of them are appended, or none.
     *
     * @throws ConcurrencyConflictException if the persisted version differs
     */
    public void saveEvents(String aggregateId, List<? extends E> events, long expectedVersion, Duration timeout) {
        if (events.isEmpty()) {
            throw new IllegalArgumentException("No events to save for aggregate " + aggregateId);
        }
        String streamName = streamName(aggregateId);
        List<String> records = new ArrayList<>(events.size());
        long nextVersion = expectedVersion;
        for (E event : events) {
            nextVersion++;
            if (!aggregateId.equals(event.aggregateId())) {
                throw new IllegalArgumentException(String.format(
                        "Event %s belongs to aggregate %s, not %s", event.eventId(), event.aggregateId(), aggregateId));
            }
            if (event.version() != nextVersion) {
                throw new IllegalArgumentException(String.format(
                        "Event %s has version %d, expected %d", event.eventId(), event.version(), nextVersion));
            }
            records.add(serialize(new StoredEvent<>(streamName, event)));
        }

        long lastVersion = nextVersion;
        boolean appended = deadlines.call("saveEvents " + aggregateId, timeout, () -> eventLog.appendIf(
                streamName, pointerKey(aggregateId), expectedVersion, lastVersion, records));

        if (!appended) {
            long actual = deadlines.call("getCurrentVersion " + aggregateId, timeout,
                    () -> counters.get(pointerKey(aggregateId)));
            log.warn("Concurrency conflict: aggregateId={}, expectedVersion={}, actualVersion={}",
                    aggregateId, expectedVersion, actual);
            throw new ConcurrencyConflictException(aggregateId, expectedVersion, actual);
        }

        log.debug("Events appended: aggregateId={}, count={}, version={}", aggregateId, events.size(), lastVersion);
    }

    // ─── Read Path ────────────────────────────────────────────────────────────

    public List<StoredEvent<E>> getEvents(String aggregateId) {
        return getEvents(aggregateId, 0L);
    }

    public List<StoredEvent<E>> getEvents(String aggregateId, long fromVersion) {
        return getEvents(aggregateId, fromVersion, deadlines.defaultTimeout());
    }

    /**
     * Events of one aggregate with version strictly greater than {@code fromVersion}, ascending.
     */
    public List<StoredEvent<E>> getEvents(String aggregateId, long fromVersion, Duration timeout) {
        // Versions start at 1 and are contiguous, so version v sits at position v - 1.
        List<String> records = deadlines.call("getEvents " + aggregateId, timeout,
                () -> eventLog.readFrom(streamName(aggregateId), Math.max(0L, fromVersion)));
        return records.stream()
                .map(this::deserialize)
                .filter(stored -> stored.version() > fromVersion)
                .sorted(Comparator.comparingLong(StoredEvent::version))
                .toList();
    }

    public long getCurrentVersion(String aggregateId) {
        return getCurrentVersion(aggregateId, deadlines.defaultTimeout());
    }

    public long getCurrentVersion(String aggregateId, Duration timeout) {
        return deadlines.call("getCurrentVersion " + aggregateId, timeout, () -> counters.get(pointerKey(aggregateId)));
    }

    public List<StoredEvent<E>> getAllEvents() {
        return getAllEvents(null, deadlines.defaultTimeout());
    }

    public List<StoredEvent<E>> getAllEvents(Instant fromTimestamp) {
        return getAllEvents(fromTimestamp, deadlines.defaultTimeout());
    }

    /**
     * Every stored event across every aggregate, in replay order (see {@link #readHistory}).
     *
     * @param fromTimestamp lower bound on occurredOn, or null for the full history
     * @throws IllegalStateException if any stored record cannot be decoded
     */
    public List<StoredEvent<E>> getAllEvents(Instant fromTimestamp, Duration timeout) {
        EventHistory<E> history = readHistory(fromTimestamp, timeout);
        if (!history.isClean()) {
            EventHistory.UnreadableRecord first = history.unreadable().get(0);
            throw new IllegalStateException(String.format(
                    "Corrupt record in event store: aggregateId=%s, version=%d: %s",
                    first.aggregateId(), first.version(), first.message()));
        }
        return history.events();
    }

    /**
     * The global history for replay. Batch/offline operation, not for the command path.
     *
     * Each aggregate's stream stays in version order; streams are merged by occurrence time,
     * ties broken by aggregate id. Timestamps are taken from commands and may run backwards
     * within one stream, so the merge never reorders two events of the same aggregate.
     *
     * Records are decoded one by one: an undecodable record is returned in
     * {@link EventHistory#unreadable()} instead of failing the read.
     *
     * @param fromTimestamp when set, each stream starts at its first event that occurred at or
     *                      after this instant; unreadable records are always reported
     */
    public EventHistory<E> readHistory(Instant fromTimestamp, Duration timeout) {
        Map<String, List<String>> streams = deadlines.call("readHistory", timeout, () -> {
            Map<String, List<String>> byStream = new LinkedHashMap<>();
            for (String stream : eventLog.listStreams(EventTypes.EVENT_STREAM_PREFIX)) {
                byStream.put(stream, eventLog.readFrom(stream, 0L));
            }
            return byStream;
        });

        List<EventHistory.UnreadableRecord> unreadable = new ArrayList<>();
        PriorityQueue<Deque<StoredEvent<E>>> heads = new PriorityQueue<>(
                Comparator.<Deque<StoredEvent<E>>, Instant>comparing(stream -> stream.peekFirst().event().occurredOn())
                        .thenComparing(stream -> stream.peekFirst().aggregateId()));

        for (Map.Entry<String, List<String>> entry : streams.entrySet()) {
            String aggregateId = entry.getKey().substring(EventTypes.EVENT_STREAM_PREFIX.length());
            List<String> records = entry.getValue();
            Deque<StoredEvent<E>> decoded = new ArrayDeque<>(records.size());
            for (int position = 0; position < records.size(); position++) {
                try {
                    decoded.addLast(deserialize(records.get(position)));
                } catch (IllegalStateException e) {
                    log.error("Undecodable event record skipped: aggregateId={}, version={}",
                            aggregateId, position + 1, e);
                    unreadable.add(new EventHistory.UnreadableRecord(aggregateId, position + 1, e.getMessage()));
                }
            }
            if (fromTimestamp != null) {
                while (!decoded.isEmpty() && decoded.peekFirst().event().occurredOn().isBefore(fromTimestamp)) {
                    decoded.removeFirst();
                }
            }
            if (!decoded.isEmpty()) {
                heads.add(decoded);
            }
        }

        List<StoredEvent<E>> ordered = new ArrayList<>();
        while (!heads.isEmpty()) {
            Deque<StoredEvent<E>> stream = heads.poll();
            ordered.add(stream.removeFirst());
            if (!stream.isEmpty()) {
                heads.add(stream);
            }
        }
        return new EventHistory<>(List.copyOf(ordered), List.copyOf(unreadable));
    }

    // ─── Snapshots ────────────────────────────────────────────────────────────

    public <S> void saveSnapshot(String aggregateId, S state, long version) {
        saveSnapshot(aggregateId, state, version, deadlines.defaultTimeout());
    }

    public <S> void saveSnapshot(String aggregateId, S state, long version, Duration timeout) {
        String record = serialize(new Snapshot<>(aggregateId, version, state, Instant.now()));
        deadlines.call("saveSnapshot " + aggregateId, timeout,
                () -> eventLog.append(snapshotKey(aggregateId), record));
        log.info("Snapshot saved: aggregateId={}, version={}", aggregateId, version);
    }

    public <S> Optional<Snapshot<S>> getLatestSnapshot(String aggregateId, Class<S> stateClass) {
        return getLatestSnapshot(aggregateId, stateClass, deadlines.defaultTimeout());
    }

    /**
     * The snapshot with the highest version for an aggregate, if any.
     */
    public <S> Optional<Snapshot<S>> getLatestSnapshot(String aggregateId, Class<S> stateClass, Duration timeout) {
        JavaType snapshotType = objectMapper.getTypeFactory().constructParametricType(Snapshot.class, stateClass);
        List<String> records = deadlines.call("getLatestSnapshot " + aggregateId, timeout,
                () -> eventLog.readFrom(snapshotKey(aggregateId), 0L));
        return records.stream()
                .map(record -> this.<Snapshot<S>>read(record, snapshotType))
                .max(Comparator.comparingLong(Snapshot::version));
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    public static String streamName(String aggregateId) {
        return EventTypes.EVENT_STREAM_PREFIX + aggregateId;
    }

    private static String pointerKey(String aggregateId) {
        return EventTypes.VERSION_POINTER_PREFIX + aggregateId;
    }

    private static String snapshotKey(String aggregateId) {
        return EventTypes.SNAPSHOT_PREFIX + aggregateId;
    }

    private String serialize(StoredEvent<E> stored) {
        try {
            return objectMapper.writerFor(storedEventType).writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize event " + stored.eventId(), e);
        }
    }

    private String serialize(Snapshot<?> snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize snapshot of " + snapshot.aggregateId(), e);
        }
    }

    private StoredEvent<E> deserialize(String record) {
        return read(record, storedEventType);
    }

    private <T> T read(String record, JavaType type) {
        try {
            return objectMapper.readValue(record, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt record in event store: " + e.getOriginalMessage(), e);
        }
    }
}
