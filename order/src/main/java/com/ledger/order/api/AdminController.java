package com.ledger.order.api;

import com.ledger.order.domain.OrderAggregate;
import com.ledger.order.domain.OrderState;
import com.ledger.order.exception.ErrorCode;
import com.ledger.order.exception.OrderException;
import com.ledger.order.service.EventReplayService;
import com.ledger.order.service.OrderService;
import com.ledger.order.service.ReplayReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * Operator endpoints: read-model rebuilds and snapshots.
 *
 * Replays block until the pass completes and return its report; a report with failures
 * means the read models are partial.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {

    private final OrderService orderService;
    private final EventReplayService replayService;

    /**
     * POST /api/admin/replay[?from=2024-03-01T00:00:00Z]
     * Without {@code from}: clear and rebuild every read model. With it: catch up from that instant.
     */
    @PostMapping("/replay")
    public ReplayReport replay(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from) {
        log.info("Replay requested: from={}", from);
        return from == null ? orderService.replayAll() : replayService.replayEventsFromTimestamp(from);
    }

    @PostMapping("/replay/{orderId}")
    public ReplayReport replayOrder(@PathVariable String orderId) {
        return replayService.replayEventsForAggregate(orderId);
    }

    @PostMapping("/snapshots/{orderId}")
    public OrderState createSnapshot(@PathVariable String orderId) {
        return orderService.createSnapshot(orderId);
    }

    /**
     * GET /api/admin/snapshots/{orderId}/aggregate
     * Aggregate state rebuilt from the latest snapshot plus the events after it.
     */
    @GetMapping("/snapshots/{orderId}/aggregate")
    public OrderState rebuildFromSnapshot(@PathVariable String orderId) {
        return orderService.rebuildFromSnapshot(orderId)
                .map(OrderAggregate::toState)
                .orElseThrow(() -> new OrderException(ErrorCode.NOT_FOUND, "No snapshot for order " + orderId));
    }
}
