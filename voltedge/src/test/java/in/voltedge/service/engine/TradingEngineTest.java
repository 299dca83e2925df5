package in.voltedge.service.engine;

import in.voltedge.broker.BrokerGateway;
import in.voltedge.config.EngineConfig;
import in.voltedge.config.LoopConfig;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.signal.SignalAction;
import in.voltedge.domain.trade.Position;
import in.voltedge.domain.trade.Side;
import in.voltedge.service.core.EventService;
import in.voltedge.service.execution.EntryCoordinator;
import in.voltedge.service.execution.PositionLifecycleManager;
import in.voltedge.service.execution.PositionReconciler;
import in.voltedge.service.market.MarketDataRefresher;
import in.voltedge.service.risk.RiskController;
import in.voltedge.service.signal.Scanner;
import in.voltedge.service.signal.TimeframeSignalRefresher;
import in.voltedge.testing.MutableClock;
import in.voltedge.testing.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TradingEngine loop orchestration.
 *
 * Loop intervals are set to an hour so the schedulers never fire; cycles are driven directly.
 *
 * Tests:
 * - Startup seeding and timeframe refresh
 * - Signal batches are consumed once
 * - Loop failures count against the error budget
 * - Halting stops every loop
 */
@ExtendWith(MockitoExtension.class)
class TradingEngineTest {

    @Mock private MarketDataRefresher marketData;
    @Mock private Scanner scanner;
    @Mock private EntryCoordinator entries;
    @Mock private PositionLifecycleManager lifecycle;
    @Mock private TimeframeSignalRefresher timeframes;
    @Mock private PositionReconciler reconciler;
    @Mock private RiskController risk;
    @Mock private BrokerGateway gateway;

    private MutableClock clock;
    private SignalMailbox mailbox;
    private ErrorBudget errorBudget;
    private RecordingSink sink;
    private TradingEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        mailbox = new SignalMailbox();
        errorBudget = new ErrorBudget(2);
        sink = new RecordingSink();
        EngineConfig base = EngineConfig.defaults();
        EngineConfig config = new EngineConfig(List.of("BTCUSD", "SOLUSD"), null, null, null, null, null,
            null, null, new LoopConfig(3600, 3600, 3600, 3600, 100, 1), base.monitoring());
        engine = new TradingEngine(config, marketData, scanner, mailbox, entries, lifecycle, timeframes,
            reconciler, risk, gateway, errorBudget, new EventService(List.of(sink), clock), clock);
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    private Signal signal(String symbol) {
        return new Signal(symbol, SignalAction.BUY, 0.9, 100.0, 0.06, 0.8, true, 0.008, 0.005, clock.instant());
    }

    @Test
    void testStartSeedsAndRefreshesConfiguredSymbols() {
        engine.start();

        assertTrue(engine.isRunning());
        verify(marketData).seed(any());
        verify(timeframes).refresh(eq(List.of("BTCUSD", "SOLUSD")), any());
        assertThrows(IllegalStateException.class, engine::start);
    }

    @Test
    void testMarketDataCyclePublishesScan() {
        when(scanner.scan()).thenReturn(List.of(signal("BTCUSD")));
        engine.start();

        engine.marketDataCycle();

        verify(marketData).refresh(any());
        assertEquals(1, mailbox.latest().generation());
        assertEquals("BTCUSD", mailbox.latest().signals().get(0).symbol());
        assertEquals(clock.instant(), engine.status().lastScanAt());
    }

    @Test
    void testEntryCycleConsumesEachBatchOnce() {
        engine.start();
        List<Signal> batch = List.of(signal("BTCUSD"));
        mailbox.publish(batch, clock.instant());

        engine.entryCycle();
        engine.entryCycle();

        verify(entries, times(1)).run(eq(batch), any());
    }

    @Test
    void testCacheRefreshCoversCandidatesAndHeldSymbols() {
        Position held = Position.adopt("ETHUSD", Side.BUY, BigDecimal.ONE, new BigDecimal("100"),
            0.005, 0.003, clock.instant());
        when(lifecycle.positions()).thenReturn(List.of(held));
        engine.start();
        mailbox.publish(List.of(signal("BTCUSD")), clock.instant());

        engine.cacheRefreshCycle();

        verify(timeframes).refresh(eq(List.of("BTCUSD", "ETHUSD")), any());
        verify(reconciler).reconcile();
    }

    @Test
    void testLoopFailuresExhaustErrorBudget() throws InterruptedException {
        engine.start();
        Runnable failing = engine.guarded("market-data", () -> {
            throw new IllegalStateException("bad sample");
        });

        failing.run();
        assertEquals(1, errorBudget.getCount());
        assertEquals(1, sink.ofType(EventType.LOOP_ERROR).size());
        assertFalse(engine.isHalted());

        failing.run();
        assertTrue(engine.isHalted());
        assertFalse(engine.isRunning());
        assertEquals(1, sink.ofType(EventType.ENGINE_HALTED).size());
        engine.awaitTermination();
    }

    @Test
    void testHaltStopsFurtherLoopWork() {
        engine.start();
        engine.guarded("entry-search", () -> {
            throw new EngineHaltedException("OrderExecutor", "connection attempts exhausted");
        }).run();

        assertTrue(engine.isHalted());
        assertTrue(engine.status().haltReason().contains("connection attempts exhausted"));
        assertEquals("OrderExecutor",
            sink.ofType(EventType.ENGINE_HALTED).get(0).after().get("source").asText());

        AtomicBoolean ran = new AtomicBoolean();
        engine.guarded("exit-check", () -> ran.set(true)).run();
        assertFalse(ran.get());
    }

    @Test
    void testGuardSkipsBeforeStart() {
        AtomicBoolean ran = new AtomicBoolean();
        engine.guarded("market-data", () -> ran.set(true)).run();
        assertFalse(ran.get());
    }
}
