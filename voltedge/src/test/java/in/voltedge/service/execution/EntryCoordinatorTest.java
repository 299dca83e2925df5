package in.voltedge.service.execution;

import in.voltedge.config.ExecutionConfig;
import in.voltedge.config.MultiTimeframeConfig;
import in.voltedge.config.RiskConfig;
import in.voltedge.config.TrailingStopsConfig;
import in.voltedge.config.VolumeConfirmationConfig;
import in.voltedge.domain.common.EngineEvent;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.market.Timeframe;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.signal.SignalAction;
import in.voltedge.domain.signal.TimeframeSignal;
import in.voltedge.domain.trade.Position;
import in.voltedge.domain.trade.Side;
import in.voltedge.infrastructure.broker.common.ReconnectionPolicy;
import in.voltedge.infrastructure.metrics.EngineMetrics;
import in.voltedge.service.core.EventService;
import in.voltedge.service.engine.ErrorBudget;
import in.voltedge.service.market.SeriesStore;
import in.voltedge.service.risk.RiskController;
import in.voltedge.service.signal.MultiTimeframeValidator;
import in.voltedge.service.signal.TimeframeSignalCache;
import in.voltedge.service.signal.VolumeConfirmationFilter;
import in.voltedge.testing.MutableClock;
import in.voltedge.testing.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EntryCoordinator in dry-run mode.
 *
 * Tests:
 * - Signal filtering before the gates
 * - Volume gate
 * - Multi-timeframe gate (no data, disagreement)
 */
class EntryCoordinatorTest {

    private MutableClock clock;
    private SeriesStore store;
    private PositionBook book;
    private TimeframeSignalCache cache;
    private RecordingSink sink;
    private EntryCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        store = new SeriesStore(500, clock);
        book = new PositionBook();
        cache = new TimeframeSignalCache();
        sink = new RecordingSink();
        EventService events = new EventService(List.of(sink), clock);

        ExecutionConfig execution = ExecutionConfig.defaults().withDryRun(true);
        RiskController risk = new RiskController(RiskConfig.defaults(), new BigDecimal("10000"), book, events,
            EngineMetrics.noop(), clock);
        PositionLifecycleManager manager = new PositionLifecycleManager(book, risk,
            new PositionSizer(execution, () -> new BigDecimal("10000")),
            new ExitEvaluator(execution, TrailingStopsConfig.defaults()),
            new OrderExecutor(null, execution, ReconnectionPolicy.forBrokerCalls(execution), clock.sleeper(),
                clock, EngineMetrics.noop()),
            store, symbol -> Double.NaN, execution, new ErrorBudget(10), events, EngineMetrics.noop(), clock);

        VolumeConfirmationConfig volume = VolumeConfirmationConfig.defaults();
        MultiTimeframeConfig mtf = MultiTimeframeConfig.defaults();
        coordinator = new EntryCoordinator(manager, book, risk, store,
            new VolumeConfirmationFilter(volume, events), new MultiTimeframeValidator(mtf, events), cache,
            execution, volume, mtf);
    }

    private void seed(String symbol, double lastVolume) {
        for (int i = 0; i < 40; i++) {
            clock.advance(Duration.ofSeconds(1));
            store.record(symbol, 100.0, 1_000);
        }
        clock.advance(Duration.ofSeconds(1));
        store.record(symbol, 100.0, lastVolume);
    }

    private void timeframes(String symbol, int direction) {
        cache.put(symbol, Map.of(
            Timeframe.FIVE_MIN, TimeframeSignal.of(Timeframe.FIVE_MIN, direction, 0.8),
            Timeframe.FIFTEEN_MIN, TimeframeSignal.of(Timeframe.FIFTEEN_MIN, direction, 0.7),
            Timeframe.ONE_HOUR, TimeframeSignal.of(Timeframe.ONE_HOUR, direction, 0.6)));
    }

    private Signal signal(String symbol, SignalAction action, double confidence) {
        return new Signal(symbol, action, confidence, 100.0, 0.06, 0.8, true, 0.008, 0.005, clock.instant());
    }

    private String lastRejection() {
        List<EngineEvent> rejected = sink.ofType(EventType.ENTRY_REJECTED);
        return rejected.get(rejected.size() - 1).after().get("reason").asText();
    }

    @Test
    void testAllGatesPassOpensPosition() {
        seed("BTCUSD", 3_000);
        timeframes("BTCUSD", 1);

        assertEquals(1, coordinator.run(List.of(signal("BTCUSD", SignalAction.BUY, 0.9)), () -> true));
        assertTrue(book.contains("BTCUSD"));
    }

    @Test
    void testVolumeGate() {
        seed("ETHUSD", 1_000);
        timeframes("ETHUSD", 1);

        assertEquals(0, coordinator.run(List.of(signal("ETHUSD", SignalAction.BUY, 0.9)), () -> true));
        assertEquals("VOLUME_NOT_CONFIRMED", lastRejection());
    }

    @Test
    void testMissingTimeframesRejected() {
        seed("SOLUSD", 3_000);

        assertEquals(0, coordinator.run(List.of(signal("SOLUSD", SignalAction.BUY, 0.9)), () -> true));
        assertEquals("MTF_NO_DATA", lastRejection());
    }

    @Test
    void testTimeframesDisagree() {
        seed("SOLUSD", 3_000);
        timeframes("SOLUSD", -1);

        assertEquals(0, coordinator.run(List.of(signal("SOLUSD", SignalAction.BUY, 0.9)), () -> true));
        assertEquals("MTF_DISAGREES", lastRejection());
    }

    @Test
    void testSellSignalMatchesBearishTimeframes() {
        seed("SOLUSD", 3_000);
        timeframes("SOLUSD", -1);

        assertEquals(1, coordinator.run(List.of(signal("SOLUSD", SignalAction.SELL, 0.9)), () -> true));
        assertEquals(Side.SELL, book.get("SOLUSD").orElseThrow().side());
    }

    @Test
    void testFiltersBeforeGates() {
        seed("BTCUSD", 3_000);
        timeframes("BTCUSD", 1);
        book.adopt(Position.adopt("ETHUSD", Side.BUY, BigDecimal.ONE, new BigDecimal("100"), 0.005, 0.003,
            clock.instant()));

        int opened = coordinator.run(List.of(
            signal("ADAUSD", SignalAction.BUY, 0.5),
            signal("ETHUSD", SignalAction.BUY, 0.9),
            signal("LTCUSD", SignalAction.HOLD, 0.9)), () -> true);

        assertEquals(0, opened);
        assertTrue(sink.ofType(EventType.ENTRY_REJECTED).isEmpty(), "Filtered signals never reach the gates");
    }

    @Test
    void testStopsWhenNotRunning() {
        seed("BTCUSD", 3_000);
        timeframes("BTCUSD", 1);

        assertEquals(0, coordinator.run(List.of(signal("BTCUSD", SignalAction.BUY, 0.9)), () -> false));
        assertFalse(book.contains("BTCUSD"));
    }
}
