package com.ledger.order.api;

import com.ledger.order.domain.OrderCommand;
import com.ledger.order.domain.OrderEvent;
import com.ledger.order.domain.OrderStatus;
import com.ledger.order.readmodel.CustomerRanking;
import com.ledger.order.readmodel.OrderPage;
import com.ledger.order.readmodel.OrderQuery;
import com.ledger.order.readmodel.OrderSummaryView;
import com.ledger.order.readmodel.OrderView;
import com.ledger.order.service.OrderQueryService;
import com.ledger.order.service.OrderService;
import com.ledger.shared.eventstore.StoredEvent;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Order REST Controller
 *
 * CQRS: Write and Read endpoints are explicitly separated.
 *
 * Write endpoints: POST /api/orders, PATCH /api/orders/{id}/status, PATCH /api/orders/{id}/cancel,
 * DELETE /api/orders/{id}
 *   → OrderService → command handler → event store + event bus
 *
 * Read endpoints: everything under GET /api/orders
 *   → OrderQueryService → read models (eventually consistent with the writes above)
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;
    private final OrderQueryService queryService;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    /**
     * POST /api/orders
     * Accepted once the OrderCreated event is stored; the view appears after the next bus cycle.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        List<OrderCommand.Line> items = request.getItems().stream()
                .map(i -> new OrderCommand.Line(i.getProductId(), i.getProductName(), i.getQuantity(), i.getPrice()))
                .toList();

        String orderId = orderService.createOrder(request.getCustomerName(), request.getCustomerEmail(), items);

        return ResponseEntity
                .created(URI.create("/api/orders/" + orderId))
                .body(Map.of(
                        "orderId", orderId,
                        "links", Map.of(
                                "self", "/api/orders/" + orderId,
                                "events", "/api/orders/" + orderId + "/events")));
    }

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<Map<String, Object>> changeStatus(@PathVariable String orderId,
                                                            @Valid @RequestBody ChangeStatusRequest request) {
        orderService.changeOrderStatus(orderId, request.getStatus());
        return ResponseEntity.ok(Map.of("orderId", orderId, "status", request.getStatus().wireName()));
    }

    @PatchMapping("/{orderId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelOrder(@PathVariable String orderId,
                                                           @RequestBody(required = false) Map<String, String> body) {
        String reason = body != null ? body.getOrDefault("reason", "Customer requested cancellation")
                                     : "Customer requested cancellation";
        orderService.cancelOrder(orderId, reason);
        return ResponseEntity.ok(Map.of("orderId", orderId, "status", OrderStatus.CANCELLED.wireName(), "reason", reason));
    }

    @DeleteMapping("/{orderId}")
    public ResponseEntity<Void> deleteOrder(@PathVariable String orderId) {
        orderService.deleteOrder(orderId);
        return ResponseEntity.noContent().build();
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    @GetMapping("/{orderId}")
    public OrderView getOrder(@PathVariable String orderId) {
        return orderService.getOrder(orderId);
    }

    /**
     * GET /api/orders?status=&customerEmail=&fromDate=&toDate=&minAmount=&maxAmount=&limit=&offset=
     */
    @GetMapping
    public OrderPage listOrders(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String customerEmail,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant fromDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant toDate,
            @RequestParam(required = false) BigDecimal minAmount,
            @RequestParam(required = false) BigDecimal maxAmount,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return orderService.listOrders(OrderQuery.builder()
                .status(status == null ? null : OrderStatus.fromValue(status))
                .customerEmail(customerEmail)
                .fromDate(fromDate)
                .toDate(toDate)
                .minAmount(minAmount)
                .maxAmount(maxAmount)
                .limit(limit)
                .offset(offset)
                .build());
    }

    /**
     * GET /api/orders/{orderId}/events
     * Full event history (event sourcing audit trail).
     */
    @GetMapping("/{orderId}/events")
    public Map<String, Object> getOrderEvents(@PathVariable String orderId) {
        List<OrderEvent> events = queryService.getOrderEvents(orderId).stream()
                .map(StoredEvent::event)
                .toList();
        return Map.of("orderId", orderId, "events", events, "count", events.size());
    }

    @GetMapping("/summary")
    public OrderSummaryView getSummary() {
        return orderService.getSummary();
    }

    @GetMapping("/search")
    public List<OrderView> searchOrders(@RequestParam("q") String term) {
        return queryService.searchOrders(term);
    }

    @GetMapping("/status/{status}")
    public List<OrderView> getOrdersByStatus(@PathVariable String status) {
        return queryService.getOrdersByStatus(OrderStatus.fromValue(status));
    }

    @GetMapping("/customer/{customerEmail}")
    public List<OrderView> getOrdersByCustomer(@PathVariable String customerEmail) {
        return queryService.getOrdersByCustomer(customerEmail);
    }

    @GetMapping("/date-range")
    public List<OrderView> getOrdersByDateRange(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return queryService.getOrdersByDateRange(from, to);
    }

    @GetMapping("/month/{year}/{month}")
    public List<OrderView> getOrdersByMonth(@PathVariable int year, @PathVariable int month) {
        return queryService.getOrdersByMonth(year, month);
    }

    @GetMapping("/top-customers")
    public List<CustomerRanking> getTopCustomers(@RequestParam(defaultValue = "10") int limit) {
        return queryService.getTopCustomers(limit);
    }

    @GetMapping("/revenue-by-status")
    public Map<String, BigDecimal> getRevenueByStatus() {
        return queryService.getRevenueByStatus();
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
class CreateOrderRequest {
    @NotBlank @Size(min = 2, max = 100) private String customerName;
    @NotBlank @Email private String customerEmail;
    @NotEmpty private List<@Valid OrderItemRequest> items;

    @Data
    static class OrderItemRequest {
        @NotBlank private String productId;
        @NotBlank private String productName;
        @Min(1) private int quantity;
        @NotNull @DecimalMin("0") private BigDecimal price;
    }
}

@Data
class ChangeStatusRequest {
    @NotNull private OrderStatus status;
}
