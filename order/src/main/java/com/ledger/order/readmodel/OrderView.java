package com.ledger.order.readmodel;

import com.ledger.order.domain.OrderItem;
import com.ledger.order.domain.OrderStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-order read model — denormalized, query-optimized view derived from the event stream.
 *
 * Never written by the command path; only the projection handler and replay touch it.
 * lastEventVersion is the version of the last event folded in, which makes re-delivered
 * events detectable.
 */
@Entity
@Table(name = "order_views", indexes = {
    @Index(name = "idx_order_views_status_date", columnList = "status, order_date"),
    @Index(name = "idx_order_views_customer_date", columnList = "customer_email, order_date"),
    @Index(name = "idx_order_views_total", columnList = "total_amount"),
    @Index(name = "idx_order_views_order_date", columnList = "order_date")
})
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OrderView {

    @Id
    @Column(name = "order_id", length = 50)
    private String orderId;

    @Column(name = "customer_name", nullable = false, length = 100)
    private String customerName;

    @Column(name = "customer_email", nullable = false)
    private String customerEmail;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "items", nullable = false, columnDefinition = "jsonb")
    private List<OrderItem> items;

    @Column(name = "total_amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "order_date", nullable = false)
    private Instant orderDate;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "status_history", nullable = false, columnDefinition = "jsonb")
    private List<StatusHistoryEntry> statusHistory;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "customer_info", columnDefinition = "jsonb")
    private CustomerInfo customerInfo;

    @Column(name = "last_event_version", nullable = false)
    private long lastEventVersion;

    public void recordStatus(OrderStatus newStatus, Instant changedAt, long eventVersion) {
        List<StatusHistoryEntry> history = new ArrayList<>(statusHistory == null ? List.of() : statusHistory);
        history.add(new StatusHistoryEntry(newStatus, changedAt));
        this.statusHistory = history;
        this.status = newStatus;
        this.updatedAt = changedAt;
        this.lastEventVersion = eventVersion;
    }

    public OrderView copy() {
        return toBuilder()
                .items(items == null ? null : List.copyOf(items))
                .statusHistory(statusHistory == null ? null : List.copyOf(statusHistory))
                .build();
    }
}
