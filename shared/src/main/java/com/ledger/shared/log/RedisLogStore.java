package com.ledger.shared.log;

import com.ledger.shared.support.StorageUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed log and counter store.
 *
 * Streams are Redis lists (RPUSH / LRANGE), so a record's position is its list index.
 * Pointers and cursors are plain string keys holding a decimal number.
 *
 * The conditional append runs as a Lua script: Redis executes scripts atomically, so the
 * pointer check, the RPUSHes and the pointer update cannot interleave with another writer,
 * even across processes.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisLogStore implements AppendOnlyLog, CounterStore {

    private static final RedisScript<Long> CONDITIONAL_APPEND = new DefaultRedisScript<>("""
            local current = tonumber(redis.call('GET', KEYS[2]) or '0')
            if current ~= tonumber(ARGV[1]) then
                return 0
            end
            for i = 3, #ARGV do
                redis.call('RPUSH', KEYS[1], ARGV[i])
            end
            redis.call('SET', KEYS[2], ARGV[2])
            return 1
            """, Long.class);

    private static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>("""
            local current = tonumber(redis.call('GET', KEYS[1]) or '0')
            if current ~= tonumber(ARGV[1]) then
                return 0
            end
            redis.call('SET', KEYS[1], ARGV[2])
            return 1
            """, Long.class);

    private static final int SCAN_COUNT = 500;

    private final StringRedisTemplate redis;

    @Override
    public long append(String streamKey, String record) {
        Long size = execute("append " + streamKey, () -> redis.opsForList().rightPush(streamKey, record));
        return size == null ? 0 : size - 1;
    }

    @Override
    public boolean appendIf(String streamKey, String pointerKey, long expected, long next, List<String> records) {
        Object[] args = new Object[records.size() + 2];
        args[0] = String.valueOf(expected);
        args[1] = String.valueOf(next);
        for (int i = 0; i < records.size(); i++) {
            args[i + 2] = records.get(i);
        }
        Long result = execute("conditional append " + streamKey,
                () -> redis.execute(CONDITIONAL_APPEND, List.of(streamKey, pointerKey), args));
        return Long.valueOf(1L).equals(result);
    }

    @Override
    public List<String> readFrom(String streamKey, long position) {
        List<String> records = execute("read " + streamKey,
                () -> redis.opsForList().range(streamKey, position, -1));
        return records == null ? List.of() : records;
    }

    @Override
    public List<String> readFrom(String streamKey, long position, int limit) {
        List<String> records = execute("read " + streamKey,
                () -> redis.opsForList().range(streamKey, position, position + limit - 1));
        return records == null ? List.of() : records;
    }

    @Override
    public long size(String streamKey) {
        Long size = execute("size " + streamKey, () -> redis.opsForList().size(streamKey));
        return size == null ? 0 : size;
    }

    @Override
    public Set<String> listStreams(String prefix) {
        return execute("scan " + prefix, () -> {
            Set<String> keys = new LinkedHashSet<>();
            ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(SCAN_COUNT).build();
            try (Cursor<String> cursor = redis.scan(options)) {
                cursor.forEachRemaining(keys::add);
            }
            return keys;
        });
    }

    @Override
    public long get(String key) {
        String value = execute("get " + key, () -> redis.opsForValue().get(key));
        return value == null ? 0 : Long.parseLong(value);
    }

    @Override
    public boolean compareAndSet(String key, long expected, long next) {
        Long result = execute("compare-and-set " + key, () -> redis.execute(COMPARE_AND_SET,
                List.of(key), String.valueOf(expected), String.valueOf(next)));
        return Long.valueOf(1L).equals(result);
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Redis operation failed: operation={}", operation, e);
            throw new StorageUnavailableException("Redis unavailable during " + operation, e);
        }
    }
}
