package com.ledger.order.projection;

import com.ledger.order.readmodel.CustomerRanking;
import com.ledger.order.readmodel.MonthlyBucket;
import com.ledger.order.readmodel.OrderSummaryView;
import com.ledger.order.readmodel.OrderView;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Full-scan computation of the cross-order summary from the current per-order views.
 *
 * Views are visited in the order given (the store returns oldest orderDate first); that
 * encounter order breaks ties in the top-customer ranking and fixes the first-seen customer name.
 * Months are calendar months in UTC, ascending.
 */
public class OrderSummaryCalculator {

    private final int topCustomers;

    public OrderSummaryCalculator(int topCustomers) {
        this.topCustomers = topCustomers;
    }

    public OrderSummaryView calculate(List<OrderView> views, Instant now) {
        BigDecimal totalRevenue = BigDecimal.ZERO;
        Map<String, Long> ordersByStatus = new LinkedHashMap<>();
        Map<String, BigDecimal> revenueByStatus = new LinkedHashMap<>();
        Map<YearMonth, Tally> months = new TreeMap<>();
        Map<String, CustomerTally> customers = new LinkedHashMap<>();

        for (OrderView view : views) {
            BigDecimal amount = view.getTotalAmount();
            totalRevenue = totalRevenue.add(amount);

            String status = view.getStatus().wireName();
            ordersByStatus.merge(status, 1L, Long::sum);
            revenueByStatus.merge(status, amount, BigDecimal::add);

            YearMonth month = YearMonth.from(view.getOrderDate().atZone(ZoneOffset.UTC));
            months.computeIfAbsent(month, m -> new Tally()).add(amount);

            customers.computeIfAbsent(view.getCustomerEmail(), email -> new CustomerTally(view.getCustomerName()))
                    .add(amount);
        }

        List<MonthlyBucket> ordersByMonth = new ArrayList<>();
        months.forEach((month, tally) -> ordersByMonth.add(new MonthlyBucket(
                month.getYear(), String.format("%02d", month.getMonthValue()), tally.count, tally.revenue)));

        // List.sort is stable: equal spenders keep encounter order.
        List<CustomerRanking> ranking = new ArrayList<>();
        customers.forEach((email, tally) -> ranking.add(
                new CustomerRanking(email, tally.name, tally.count, tally.revenue)));
        ranking.sort(Comparator.comparing(CustomerRanking::totalSpent).reversed());

        return OrderSummaryView.builder()
                .totalOrders(views.size())
                .totalRevenue(totalRevenue)
                .ordersByStatus(ordersByStatus)
                .revenueByStatus(revenueByStatus)
                .ordersByMonth(ordersByMonth)
                .topCustomers(List.copyOf(ranking.subList(0, Math.min(topCustomers, ranking.size()))))
                .lastUpdated(now)
                .build();
    }

    private static class Tally {
        long count;
        BigDecimal revenue = BigDecimal.ZERO;

        void add(BigDecimal amount) {
            count++;
            revenue = revenue.add(amount);
        }
    }

    private static final class CustomerTally extends Tally {
        final String name;

        CustomerTally(String name) {
            this.name = name;
        }
    }
}
