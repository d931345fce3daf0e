package com.ledger.shared.log;

import java.util.List;
import java.util.Set;

/**
 * Append-only ordered log of opaque records, partitioned into streams.
 *
 * Positions are zero-based and assigned in append order. A record, once appended,
 * is never rewritten or removed.
 */
public interface AppendOnlyLog {

    /**
     * Append a record to the tail of a stream.
     *
     * @return the position assigned to the record
     */
    long append(String streamKey, String record);

    /**
     * Atomically append records to a stream if, and only if, the pointer stored under
     * {@code pointerKey} currently equals {@code expected}. On success the pointer is set to
     * {@code next}. On mismatch nothing is written.
     *
     * Implementations MUST perform the check and the writes as one indivisible operation.
     *
     * @return true if the records were appended
     */
    boolean appendIf(String streamKey, String pointerKey, long expected, long next, List<String> records);

    /**
     * Read every record at or after {@code position}, in append order.
     */
    List<String> readFrom(String streamKey, long position);

    /**
     * Read at most {@code limit} records starting at {@code position}, in append order.
     */
    List<String> readFrom(String streamKey, long position, int limit);

    /**
     * Number of records in a stream (0 for an unknown stream).
     */
    long size(String streamKey);

    /**
     * All stream keys starting with {@code prefix}.
     */
    Set<String> listStreams(String prefix);
}
