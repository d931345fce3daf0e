package com.ledger.order.service;

import com.ledger.order.domain.OrderCommand;
import com.ledger.order.domain.OrderItem;
import com.ledger.order.domain.OrderStatus;
import com.ledger.order.exception.ErrorCode;
import com.ledger.order.exception.OrderException;
import com.ledger.order.readmodel.CustomerRanking;
import com.ledger.order.readmodel.OrderPage;
import com.ledger.order.readmodel.OrderQuery;
import com.ledger.order.readmodel.OrderView;
import com.ledger.order.support.OrderLedgerFixture;
import com.ledger.shared.eventstore.StoredEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static com.ledger.order.support.OrderLedgerFixture.line;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit Tests — OrderQueryService
 *
 * Views are seeded straight into the in-memory read model so order dates can be pinned.
 */
class OrderQueryServiceTest {

    OrderLedgerFixture ledger;
    OrderQueryService queries;

    @BeforeEach
    void setUp() {
        ledger = new OrderLedgerFixture();
        queries = ledger.queryService;
    }

    @AfterEach
    void tearDown() {
        ledger.close();
    }

    private void seed(String orderId, String name, String email, String product, String amount,
                      OrderStatus status, String orderDate) {
        BigDecimal price = new BigDecimal(amount);
        ledger.viewStore.save(OrderView.builder()
                .orderId(orderId)
                .customerName(name)
                .customerEmail(email)
                .items(List.of(OrderItem.of("sku-" + orderId, product, 1, price)))
                .totalAmount(price)
                .status(status)
                .orderDate(Instant.parse(orderDate))
                .updatedAt(Instant.parse(orderDate))
                .statusHistory(List.of())
                .lastEventVersion(1)
                .build());
    }

    private void seedCatalogue() {
        seed("o1", "Alice Smith", "alice@example.com", "Blue Widget", "10.00", OrderStatus.PENDING, "2024-01-05T10:00:00Z");
        seed("o2", "Bob Jones", "bob@example.com", "Red Gadget", "25.00", OrderStatus.SHIPPED, "2024-01-31T23:59:59Z");
        seed("o3", "Alice Smith", "alice@example.com", "Green Widget", "40.00", OrderStatus.PENDING, "2024-02-01T00:00:00Z");
        seed("o4", "Carol White", "carol@example.com", "Gizmo", "5.00", OrderStatus.CANCELLED, "2024-02-14T12:00:00Z");
    }

    // ─── Single Order ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("getOrder — unknown id fails NOT_FOUND")
    void getOrder_unknown_shouldFailNotFound() {
        assertThatThrownBy(() -> queries.getOrder("ord_missing"))
                .isInstanceOf(OrderException.class).extracting("code").isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    @DisplayName("getOrderEvents — audit trail in version order, NOT_FOUND when empty")
    void getOrderEvents_shouldReturnHistory() {
        String orderId = ledger.createOrder("Jane Doe", "jane@example.com", line("p1", 1, "10"));
        ledger.commandHandler.handle(OrderCommand.Cancel.of(orderId, "no longer needed"));

        assertThat(queries.getOrderEvents(orderId))
                .extracting(StoredEvent::version, StoredEvent::eventType)
                .containsExactly(tuple(1L, "OrderCreated"), tuple(2L, "OrderCancelled"));
        assertThatThrownBy(() -> queries.getOrderEvents("ord_missing"))
                .isInstanceOf(OrderException.class).extracting("code").isEqualTo(ErrorCode.NOT_FOUND);
    }

    // ─── Listing ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("listOrders")
    class ListOrders {

        @BeforeEach
        void seedViews() {
            seedCatalogue();
        }

        @Test
        @DisplayName("defaults — limit 10, offset 0, newest first")
        void defaults_shouldApply() {
            OrderPage page = queries.listOrders(OrderQuery.all());

            assertThat(page.limit()).isEqualTo(10);
            assertThat(page.offset()).isZero();
            assertThat(page.total()).isEqualTo(4);
            assertThat(page.items()).extracting(OrderView::getOrderId).containsExactly("o4", "o3", "o2", "o1");
        }

        @Test
        @DisplayName("pagination — total counts every match")
        void pagination_shouldSliceAndCount() {
            OrderPage page = queries.listOrders(OrderQuery.builder().limit(2).offset(1).build());

            assertThat(page.total()).isEqualTo(4);
            assertThat(page.items()).extracting(OrderView::getOrderId).containsExactly("o3", "o2");
        }

        @Test
        @DisplayName("filters combine: status, customer and amount bounds are inclusive")
        void filters_shouldCombine() {
            OrderPage page = queries.listOrders(OrderQuery.builder()
                    .status(OrderStatus.PENDING)
                    .customerEmail("alice@example.com")
                    .minAmount(new BigDecimal("10.00"))
                    .maxAmount(new BigDecimal("40.00"))
                    .build());

            assertThat(page.items()).extracting(OrderView::getOrderId).containsExactly("o3", "o1");
        }

        @Test
        @DisplayName("non-positive limit or negative offset — VALIDATION_ERROR")
        void invalidPaging_shouldFailValidation() {
            assertThatThrownBy(() -> queries.listOrders(OrderQuery.builder().limit(0).build()))
                    .isInstanceOf(OrderException.class).extracting("code").isEqualTo(ErrorCode.VALIDATION_ERROR);
            assertThatThrownBy(() -> queries.listOrders(OrderQuery.builder().offset(-1).build()))
                    .isInstanceOf(OrderException.class).extracting("code").isEqualTo(ErrorCode.VALIDATION_ERROR);
        }
    }

    // ─── Filters ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("by status and by customer")
    void byStatusAndCustomer() {
        seedCatalogue();

        assertThat(queries.getOrdersByStatus(OrderStatus.PENDING))
                .extracting(OrderView::getOrderId).containsExactly("o3", "o1");
        assertThat(queries.getOrdersByCustomer("bob@example.com"))
                .extracting(OrderView::getOrderId).containsExactly("o2");
        assertThat(queries.getOrdersByStatus(OrderStatus.DELIVERED)).isEmpty();
    }

    @Test
    @DisplayName("by month — UTC calendar month, boundaries inclusive")
    void byMonth_shouldUseUtcBoundaries() {
        seedCatalogue();

        assertThat(queries.getOrdersByMonth(2024, 1)).extracting(OrderView::getOrderId).containsExactly("o2", "o1");
        assertThat(queries.getOrdersByMonth(2024, 2)).extracting(OrderView::getOrderId).containsExactly("o4", "o3");
        assertThat(queries.getOrdersByMonth(2023, 12)).isEmpty();
        assertThatThrownBy(() -> queries.getOrdersByMonth(2024, 13))
                .isInstanceOf(OrderException.class).extracting("code").isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("by date range — inverted range fails VALIDATION_ERROR")
    void byDateRange_shouldValidateBounds() {
        seedCatalogue();

        assertThat(queries.getOrdersByDateRange(Instant.parse("2024-01-31T23:59:59Z"), Instant.parse("2024-02-01T00:00:00Z")))
                .extracting(OrderView::getOrderId).containsExactly("o3", "o2");
        assertThatThrownBy(() -> queries.getOrdersByDateRange(Instant.parse("2024-02-01T00:00:00Z"),
                Instant.parse("2024-01-01T00:00:00Z")))
                .isInstanceOf(OrderException.class).extracting("code").isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("search — case-insensitive over name, email and product names")
    void search_shouldMatchAcrossFields() {
        seedCatalogue();

        assertThat(queries.searchOrders("WIDGET")).extracting(OrderView::getOrderId).containsExactly("o3", "o1");
        assertThat(queries.searchOrders("carol@")).extracting(OrderView::getOrderId).containsExactly("o4");
        assertThat(queries.searchOrders("jones")).extracting(OrderView::getOrderId).containsExactly("o2");
        assertThat(queries.searchOrders("nothing-like-this")).isEmpty();
        assertThatThrownBy(() -> queries.searchOrders("  "))
                .isInstanceOf(OrderException.class).extracting("code").isEqualTo(ErrorCode.VALIDATION_ERROR);
    }

    // ─── Summary ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("summary before any projection — zeros, stamped with the clock")
    void summary_whenEmpty_shouldBeZero() {
        assertThat(queries.getSummary().getTotalOrders()).isZero();
        assertThat(queries.getSummary().getLastUpdated()).isEqualTo(OrderLedgerFixture.NOW);
        assertThat(queries.getTopCustomers(5)).isEmpty();
        assertThat(queries.getRevenueByStatus()).isEmpty();
    }

    @Test
    @DisplayName("top customers and revenue by status come from the projected summary")
    void summary_shouldReflectProjection() {
        ledger.createOrder("Alice Smith", "alice@example.com", line("p1", 3, "10"));
        ledger.createOrder("Bob Jones", "bob@example.com", line("p2", 1, "50"));
        ledger.createOrder("Alice Smith", "alice@example.com", line("p3", 1, "5"));
        ledger.deliver();

        assertThat(queries.getTopCustomers(1))
                .extracting(CustomerRanking::customerEmail, CustomerRanking::orderCount)
                .containsExactly(tuple("bob@example.com", 1L));
        assertThat(queries.getTopCustomers(10)).hasSize(2);
        assertThat(queries.getRevenueByStatus().get("pending")).isEqualByComparingTo("85");
    }
}
