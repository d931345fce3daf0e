package com.ledger.order.service;

import com.ledger.order.domain.OrderAggregate;
import com.ledger.order.domain.OrderCommand;
import com.ledger.order.domain.OrderStatus;
import com.ledger.order.domain.OrderState;
import com.ledger.order.readmodel.OrderPage;
import com.ledger.order.readmodel.OrderQuery;
import com.ledger.order.readmodel.OrderSummaryView;
import com.ledger.order.readmodel.OrderView;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * Operation surface of the order service. Transports (REST, tests, tooling) call this; it turns
 * arguments into commands and routes reads to the query side.
 */
@RequiredArgsConstructor
public class OrderService {

    private final OrderCommandHandler commandHandler;
    private final OrderQueryService queryService;
    private final EventReplayService replayService;

    public String createOrder(String customerName, String customerEmail, List<OrderCommand.Line> items) {
        return commandHandler.handle(OrderCommand.CreateOrder.of(customerName, customerEmail, items));
    }

    public void changeOrderStatus(String orderId, OrderStatus newStatus) {
        commandHandler.handle(OrderCommand.ChangeStatus.of(orderId, newStatus));
    }

    public void cancelOrder(String orderId, String reason) {
        commandHandler.handle(OrderCommand.Cancel.of(orderId, reason));
    }

    public void deleteOrder(String orderId) {
        commandHandler.handle(OrderCommand.Delete.of(orderId));
    }

    public OrderView getOrder(String orderId) {
        return queryService.getOrder(orderId);
    }

    public OrderPage listOrders(OrderQuery query) {
        return queryService.listOrders(query);
    }

    public OrderSummaryView getSummary() {
        return queryService.getSummary();
    }

    public ReplayReport replayAll() {
        return replayService.replayAllEvents();
    }

    public OrderState createSnapshot(String orderId) {
        return replayService.createSnapshot(orderId);
    }

    public Optional<OrderAggregate> rebuildFromSnapshot(String orderId) {
        return replayService.rebuildAggregateFromSnapshot(orderId);
    }
}
