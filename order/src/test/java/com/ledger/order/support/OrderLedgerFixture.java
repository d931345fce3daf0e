package com.ledger.order.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ledger.order.domain.OrderCommand;
import com.ledger.order.domain.OrderEvent;
import com.ledger.order.projection.OrderProjectionHandler;
import com.ledger.order.projection.OrderSummaryCalculator;
import com.ledger.order.readmodel.InMemoryOrderViewStore;
import com.ledger.order.service.EventReplayService;
import com.ledger.order.service.OrderCommandHandler;
import com.ledger.order.service.OrderQueryService;
import com.ledger.shared.bus.DispatchReport;
import com.ledger.shared.bus.EventBus;
import com.ledger.shared.bus.EventBusSettings;
import com.ledger.shared.bus.ProjectionGate;
import com.ledger.shared.events.EventTypes;
import com.ledger.shared.eventstore.EventStore;
import com.ledger.shared.log.InMemoryLogStore;
import com.ledger.shared.support.DeadlineExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Whole order stack wired in memory, the way OrderServiceConfig wires it in production.
 * The bus consumer is not started: tests drive delivery with {@link #deliver()}.
 */
public class OrderLedgerFixture implements AutoCloseable {

    public static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    public final ExecutorService workers = Executors.newCachedThreadPool();
    public final ObjectMapper objectMapper = objectMapper();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    public final InMemoryLogStore logStore = new InMemoryLogStore();
    public final DeadlineExecutor deadlines = new DeadlineExecutor(workers, Duration.ofSeconds(2));
    public final ProjectionGate gate = new ProjectionGate();
    public final InMemoryOrderViewStore viewStore = new InMemoryOrderViewStore();

    public final EventStore<OrderEvent> eventStore =
            new EventStore<>(logStore, logStore, objectMapper, deadlines, OrderEvent.class);
    public final OrderProjectionHandler projection =
            new OrderProjectionHandler(viewStore, new OrderSummaryCalculator(10), clock);
    public final EventBus<OrderEvent> bus = new EventBus<>(logStore, logStore, objectMapper, OrderEvent.class,
            deadlines, gate, new EventBusSettings(Duration.ofMillis(20), 100, Duration.ofSeconds(2)), meterRegistry);
    public final OrderCommandHandler commandHandler = new OrderCommandHandler(eventStore, bus, meterRegistry);
    public final EventReplayService replayService =
            new EventReplayService(eventStore, projection, viewStore, gate, meterRegistry);
    public final OrderQueryService queryService = new OrderQueryService(viewStore, eventStore, clock);

    public OrderLedgerFixture() {
        for (String type : List.of(EventTypes.ORDER_CREATED, EventTypes.ORDER_STATUS_CHANGED,
                EventTypes.ORDER_CANCELLED, EventTypes.ORDER_DELETED)) {
            bus.registerHandler(type, projection);
        }
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /** Run one bus cycle: project everything published so far. */
    public DispatchReport deliver() {
        return bus.pollOnce();
    }

    public String createOrder(String name, String email, OrderCommand.Line... lines) {
        return commandHandler.handle(OrderCommand.CreateOrder.of(name, email, List.of(lines)));
    }

    public static OrderCommand.Line line(String productId, int quantity, String price) {
        return new OrderCommand.Line(productId, "Product " + productId, quantity, new BigDecimal(price));
    }

    @Override
    public void close() {
        bus.stop();
        workers.shutdownNow();
    }
}
