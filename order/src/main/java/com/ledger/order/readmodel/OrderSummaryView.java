package com.ledger.order.readmodel;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
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
import java.util.List;
import java.util.Map;

/**
 * Cross-order summary read model. A single row, recomputed from the per-order views
 * after every projection mutation.
 *
 * Status maps are keyed by the lower-case status name.
 */
@Entity
@Table(name = "order_summary")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderSummaryView {

    public static final String SINGLETON_ID = "global";

    @Id
    @Column(name = "id", length = 20)
    @Builder.Default
    private String id = SINGLETON_ID;

    @Column(name = "total_orders", nullable = false)
    private long totalOrders;

    @Column(name = "total_revenue", nullable = false, precision = 16, scale = 2)
    private BigDecimal totalRevenue;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "orders_by_status", columnDefinition = "jsonb")
    private Map<String, Long> ordersByStatus;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "revenue_by_status", columnDefinition = "jsonb")
    private Map<String, BigDecimal> revenueByStatus;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "orders_by_month", columnDefinition = "jsonb")
    private List<MonthlyBucket> ordersByMonth;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "top_customers", columnDefinition = "jsonb")
    private List<CustomerRanking> topCustomers;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    /** Summary reported before any order has been projected. */
    public static OrderSummaryView empty(Instant now) {
        return OrderSummaryView.builder()
                .totalOrders(0)
                .totalRevenue(BigDecimal.ZERO)
                .ordersByStatus(Map.of())
                .revenueByStatus(Map.of())
                .ordersByMonth(List.of())
                .topCustomers(List.of())
                .lastUpdated(now)
                .build();
    }
}
