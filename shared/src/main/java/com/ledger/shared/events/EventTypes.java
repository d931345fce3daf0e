package com.ledger.shared.events;

/**
 * Canonical event type constants and storage key layout.
 * All modules MUST use these constants — never hardcode strings.
 * Changing a type here is a breaking change: stored events carry the type name.
 */
public final class EventTypes {

    private EventTypes() {}

    // ── Order Domain ──────────────────────────────────────────────────────────
    public static final String ORDER_CREATED        = "OrderCreated";
    public static final String ORDER_STATUS_CHANGED = "OrderStatusChanged";
    public static final String ORDER_CANCELLED      = "OrderCancelled";
    public static final String ORDER_DELETED        = "OrderDeleted";

    // ── Storage Keys ──────────────────────────────────────────────────────────
    /** Per-aggregate append-only event stream: events:{aggregateId} */
    public static final String EVENT_STREAM_PREFIX    = "events:";
    /** Per-aggregate version pointer: versions:{aggregateId} */
    public static final String VERSION_POINTER_PREFIX = "versions:";
    /** Per-aggregate snapshot stream: snapshots:{aggregateId} */
    public static final String SNAPSHOT_PREFIX        = "snapshots:";
    /** Shared distribution channel read by the event bus consumer */
    public static final String EVENT_BUS_STREAM       = "event-bus";
    public static final String EVENT_BUS_CURSOR       = "event-bus:cursor";
}
