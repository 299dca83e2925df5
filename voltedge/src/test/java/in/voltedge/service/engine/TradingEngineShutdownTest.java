package in.voltedge.service.engine;

import in.voltedge.broker.Broker;
import in.voltedge.broker.BrokerGateway;
import in.voltedge.config.EngineConfig;
import in.voltedge.config.ExecutionConfig;
import in.voltedge.config.LoopConfig;
import in.voltedge.config.RiskConfig;
import in.voltedge.config.TrailingStopsConfig;
import in.voltedge.domain.common.EngineEvent;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.order.OrderHandle;
import in.voltedge.domain.order.OrderState;
import in.voltedge.domain.order.OrderStatus;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.signal.SignalAction;
import in.voltedge.infrastructure.broker.common.ReconnectionPolicy;
import in.voltedge.infrastructure.metrics.EngineMetrics;
import in.voltedge.service.core.EventService;
import in.voltedge.service.execution.EntryCoordinator;
import in.voltedge.service.execution.ExitEvaluator;
import in.voltedge.service.execution.OrderExecutor;
import in.voltedge.service.execution.PositionBook;
import in.voltedge.service.execution.PositionLifecycleManager;
import in.voltedge.service.execution.PositionReconciler;
import in.voltedge.service.execution.PositionSizer;
import in.voltedge.service.market.MarketDataRefresher;
import in.voltedge.service.market.SeriesStore;
import in.voltedge.service.risk.RateBudget;
import in.voltedge.service.risk.RiskController;
import in.voltedge.service.signal.Scanner;
import in.voltedge.service.signal.TimeframeSignalRefresher;
import in.voltedge.testing.RecordingSink;
import in.voltedge.util.Sleeper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Shutdown of a running engine while an entry order is working at the broker.
 *
 * Uses real schedulers and the system clock; the entry loop fires after one second.
 *
 * Tests:
 * - stop() interrupts the blocked fill wait, cancels the order and fails the reservation
 */
@ExtendWith(MockitoExtension.class)
class TradingEngineShutdownTest {

    @Mock private Broker broker;
    @Mock private MarketDataRefresher marketData;
    @Mock private Scanner scanner;
    @Mock private EntryCoordinator entries;
    @Mock private TimeframeSignalRefresher timeframes;
    @Mock private PositionReconciler reconciler;

    @Test
    void testStopCancelsWorkingEntryOrder() throws Exception {
        Clock clock = Clock.systemUTC();
        RecordingSink sink = new RecordingSink();
        EventService events = new EventService(List.of(sink), clock);
        ExecutionConfig execution = ExecutionConfig.defaults().withDryRun(false).withFillTiming(60_000, 50);
        EngineConfig config = new EngineConfig(List.of("BTCUSD"), null, null, null, null, null,
            execution, null, new LoopConfig(3600, 1, 3600, 3600, 100, 1), null);

        PositionBook book = new PositionBook();
        RiskController risk = new RiskController(RiskConfig.defaults(), new BigDecimal("10000"), book, events,
            EngineMetrics.noop(), clock);
        BrokerGateway gateway = new BrokerGateway(broker,
            new RateBudget(1000, Duration.ofSeconds(60), clock, Sleeper.system()),
            Duration.ofSeconds(30), EngineMetrics.noop(), events);
        OrderExecutor executor = new OrderExecutor(gateway, execution, ReconnectionPolicy.forBrokerCalls(execution),
            Sleeper.system(), clock, EngineMetrics.noop());
        ErrorBudget errorBudget = new ErrorBudget(10);
        PositionLifecycleManager lifecycle = new PositionLifecycleManager(book, risk,
            new PositionSizer(execution, () -> new BigDecimal("10000")),
            new ExitEvaluator(execution, TrailingStopsConfig.defaults()),
            executor, new SeriesStore(500, clock), symbol -> Double.NaN, execution, errorBudget, events,
            EngineMetrics.noop(), clock);

        CountDownLatch blocked = new CountDownLatch(1);
        when(broker.submitOrder(any())).thenReturn(
            CompletableFuture.completedFuture(new OrderHandle("ord-1", "c1", clock.instant())));
        when(broker.getOrderStatus("ord-1"))
            .thenAnswer(inv -> {
                blocked.countDown();
                return new CompletableFuture<OrderState>();
            })
            .thenReturn(CompletableFuture.completedFuture(
                new OrderState("ord-1", OrderStatus.CANCELLED, null, null, "cancelled by user")));
        when(broker.cancelOrder("ord-1")).thenReturn(CompletableFuture.completedFuture(null));

        Signal signal = new Signal("BTCUSD", SignalAction.BUY, 0.8, 100.0, 0.06, 0.8, true,
            0.008, 0.005, clock.instant());
        when(entries.run(any(), any())).thenAnswer(inv -> lifecycle.enter(signal).opened() ? 1 : 0);

        SignalMailbox mailbox = new SignalMailbox();
        mailbox.publish(List.of(signal), clock.instant());
        TradingEngine engine = new TradingEngine(config, marketData, scanner, mailbox, entries, lifecycle,
            timeframes, reconciler, risk, gateway, errorBudget, events, clock);

        engine.start();
        assertTrue(blocked.await(5, TimeUnit.SECONDS), "Entry reached the fill wait");
        engine.stop();

        assertTimeoutPreemptively(Duration.ofSeconds(1), engine::awaitTermination);
        assertFalse(engine.isRunning());
        assertFalse(engine.isHalted());
        verify(broker).cancelOrder("ord-1");
        assertFalse(book.contains("BTCUSD"), "No NEW reservation left behind");

        List<EngineEvent> failures = sink.ofType(EventType.ORDER_FAILED);
        assertEquals(1, failures.size());
        assertEquals("CANCELLED", failures.get(0).after().get("category").asText());
    }
}
