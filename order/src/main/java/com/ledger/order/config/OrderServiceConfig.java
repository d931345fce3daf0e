package com.ledger.order.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ledger.order.domain.OrderEvent;
import com.ledger.order.projection.OrderProjectionHandler;
import com.ledger.order.projection.OrderSummaryCalculator;
import com.ledger.order.readmodel.OrderViewStore;
import com.ledger.order.service.EventReplayService;
import com.ledger.order.service.OrderCommandHandler;
import com.ledger.order.service.OrderQueryService;
import com.ledger.order.service.OrderService;
import com.ledger.order.service.StartupReplayRunner;
import com.ledger.shared.bus.EventBus;
import com.ledger.shared.bus.EventBusSettings;
import com.ledger.shared.bus.ProjectionGate;
import com.ledger.shared.events.EventTypes;
import com.ledger.shared.eventstore.EventStore;
import com.ledger.shared.log.AppendOnlyLog;
import com.ledger.shared.log.CounterStore;
import com.ledger.shared.log.InMemoryLogStore;
import com.ledger.shared.log.RedisLogStore;
import com.ledger.shared.support.DeadlineExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Order Service Spring Configuration
 *
 * Wires one instance of each core component (store, bus, projection, replay, command and
 * query handlers) at startup. The event bus consumer is started once the context is up and
 * stopped, draining its in-flight cycle, on shutdown.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class OrderServiceConfig {

    // ─── Jackson ──────────────────────────────────────────────────────────────

    @Bean
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder
                .modules(new JavaTimeModule())
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ─── Event Log ────────────────────────────────────────────────────────────

    @Bean
    @ConditionalOnProperty(name = "ledger.event-log.store", havingValue = "redis", matchIfMissing = true)
    public RedisLogStore redisLogStore(StringRedisTemplate redisTemplate) {
        return new RedisLogStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.event-log.store", havingValue = "memory")
    public InMemoryLogStore inMemoryLogStore() {
        return new InMemoryLogStore();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService storeWorkers(LedgerProperties properties) {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getStore().getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "store-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public DeadlineExecutor deadlineExecutor(ExecutorService storeWorkers, LedgerProperties properties) {
        return new DeadlineExecutor(storeWorkers, properties.getStore().getTimeout());
    }

    @Bean
    public EventStore<OrderEvent> orderEventStore(AppendOnlyLog eventLog,
                                                  CounterStore counters,
                                                  ObjectMapper objectMapper, DeadlineExecutor deadlines) {
        return new EventStore<>(eventLog, counters, objectMapper, deadlines, OrderEvent.class);
    }

    // ─── Event Bus & Projection ───────────────────────────────────────────────

    @Bean
    public ProjectionGate projectionGate() {
        return new ProjectionGate();
    }

    @Bean
    public OrderProjectionHandler orderProjectionHandler(OrderViewStore viewStore, LedgerProperties properties,
                                                         Clock clock) {
        return new OrderProjectionHandler(viewStore,
                new OrderSummaryCalculator(properties.getSummary().getTopCustomers()), clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public EventBus<OrderEvent> orderEventBus(AppendOnlyLog channel,
                                              CounterStore cursors,
                                              ObjectMapper objectMapper, DeadlineExecutor deadlines,
                                              ProjectionGate gate, OrderProjectionHandler projection,
                                              LedgerProperties properties, MeterRegistry meterRegistry) {
        LedgerProperties.Bus bus = properties.getBus();
        EventBus<OrderEvent> eventBus = new EventBus<>(channel, cursors, objectMapper, OrderEvent.class, deadlines,
                gate, new EventBusSettings(bus.getPollInterval(), bus.getBatchSize(), bus.getShutdownTimeout()),
                meterRegistry);
        for (String eventType : List.of(EventTypes.ORDER_CREATED, EventTypes.ORDER_STATUS_CHANGED,
                EventTypes.ORDER_CANCELLED, EventTypes.ORDER_DELETED)) {
            eventBus.registerHandler(eventType, projection);
        }
        return eventBus;
    }

    // ─── Services ─────────────────────────────────────────────────────────────

    @Bean
    public OrderCommandHandler orderCommandHandler(EventStore<OrderEvent> eventStore, EventBus<OrderEvent> eventBus,
                                                   MeterRegistry meterRegistry) {
        return new OrderCommandHandler(eventStore, eventBus, meterRegistry);
    }

    @Bean
    public OrderQueryService orderQueryService(OrderViewStore viewStore, EventStore<OrderEvent> eventStore,
                                               Clock clock) {
        return new OrderQueryService(viewStore, eventStore, clock);
    }

    @Bean
    public EventReplayService eventReplayService(EventStore<OrderEvent> eventStore,
                                                 OrderProjectionHandler projection, OrderViewStore viewStore,
                                                 ProjectionGate gate, LedgerProperties properties,
                                                 MeterRegistry meterRegistry) {
        return new EventReplayService(eventStore, projection, viewStore, gate, meterRegistry,
                properties.getReplay().getReadTimeout());
    }

    @Bean
    public OrderService orderService(OrderCommandHandler commandHandler, OrderQueryService queryService,
                                     EventReplayService replayService) {
        return new OrderService(commandHandler, queryService, replayService);
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.replay.on-startup", havingValue = "true", matchIfMissing = true)
    public StartupReplayRunner startupReplayRunner(EventReplayService replayService) {
        return new StartupReplayRunner(replayService);
    }
}
