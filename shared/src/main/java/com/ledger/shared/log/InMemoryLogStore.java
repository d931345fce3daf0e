package com.ledger.shared.log;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-local log and counter store.
 *
 * Every method synchronizes on the store, which makes {@link #appendIf} a true
 * compare-and-swap within one JVM. Used by tests and the {@code memory} profile.
 */
public class InMemoryLogStore implements AppendOnlyLog, CounterStore {

    private final Map<String, List<String>> streams = new HashMap<>();
    private final Map<String, Long> counters = new HashMap<>();

    @Override
    public synchronized long append(String streamKey, String record) {
        List<String> stream = streams.computeIfAbsent(streamKey, k -> new ArrayList<>());
        stream.add(record);
        return stream.size() - 1L;
    }

    @Override
    public synchronized boolean appendIf(String streamKey, String pointerKey, long expected, long next,
                                         List<String> records) {
        if (counters.getOrDefault(pointerKey, 0L) != expected) {
            return false;
        }
        streams.computeIfAbsent(streamKey, k -> new ArrayList<>()).addAll(records);
        counters.put(pointerKey, next);
        return true;
    }

    @Override
    public synchronized List<String> readFrom(String streamKey, long position) {
        return readFrom(streamKey, position, Integer.MAX_VALUE);
    }

    @Override
    public synchronized List<String> readFrom(String streamKey, long position, int limit) {
        List<String> stream = streams.getOrDefault(streamKey, List.of());
        if (position >= stream.size()) {
            return List.of();
        }
        int end = (int) Math.min(stream.size(), position + (long) limit);
        return List.copyOf(stream.subList((int) position, end));
    }

    @Override
    public synchronized long size(String streamKey) {
        return streams.getOrDefault(streamKey, List.of()).size();
    }

    @Override
    public synchronized Set<String> listStreams(String prefix) {
        Set<String> keys = new TreeSet<>();
        for (String key : streams.keySet()) {
            if (key.startsWith(prefix)) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Override
    public synchronized long get(String key) {
        return counters.getOrDefault(key, 0L);
    }

    @Override
    public synchronized boolean compareAndSet(String key, long expected, long next) {
        if (counters.getOrDefault(key, 0L) != expected) {
            return false;
        }
        counters.put(key, next);
        return true;
    }
}
