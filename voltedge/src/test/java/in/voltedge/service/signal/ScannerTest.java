package in.voltedge.service.signal;

import in.voltedge.config.ScannerConfig;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.signal.SignalAction;
import in.voltedge.infrastructure.metrics.EngineMetrics;
import in.voltedge.service.core.EventService;
import in.voltedge.service.market.SeriesStore;
import in.voltedge.testing.MutableClock;
import in.voltedge.testing.RecordingSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Scanner.
 *
 * Tests:
 * - Tier classification
 * - Low volatility symbols skipped
 * - Ranking and per-symbol failure isolation
 */
class ScannerTest {

    private MutableClock clock;
    private SeriesStore store;
    private RecordingSink sink;
    private EventService events;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T00:00:00Z");
        store = new SeriesStore(1000, clock);
        sink = new RecordingSink();
        events = new EventService(List.of(sink), clock);
    }

    private Scanner scanner(List<String> symbols) {
        return new Scanner(store, ScannerConfig.defaults(), () -> symbols, events, EngineMetrics.noop(), clock);
    }

    private void feed(String symbol, double up, double down, int n) {
        double price = 100.0;
        for (int i = 0; i < n; i++) {
            price = i % 2 == 0 ? price * (1 + up) : price * (1 - down);
            store.record(symbol, price, 1000.0);
            clock.advance(Duration.ofMinutes(1));
        }
    }

    @Test
    void testHighVolatilityUptrendBuys() {
        feed("BTCUSD", 0.03, 0.01, 30);
        Optional<Signal> signal = scanner(List.of("BTCUSD")).evaluate("BTCUSD");

        assertTrue(signal.isPresent());
        assertEquals(SignalAction.BUY, signal.get().action());
        assertEquals(0.9, signal.get().confidence(), 1e-9, "Confidence capped at 0.9");
        assertEquals(0.008, signal.get().targetProfit());
        assertEquals(0.005, signal.get().stopLoss());
        assertFalse(signal.get().volumeSurge());
    }

    @Test
    void testFlatSymbolProducesNothing() {
        for (int i = 0; i < 40; i++) {
            store.record("ETHUSD", 2000.0, 10.0);
        }
        assertTrue(scanner(List.of("ETHUSD")).evaluate("ETHUSD").isEmpty());
    }

    @Test
    void testInsufficientDataSkipped() {
        feed("SOLUSD", 0.03, 0.01, 5);
        assertTrue(scanner(List.of("SOLUSD")).evaluate("SOLUSD").isEmpty());
    }

    @Test
    void testClassifyTiers() {
        Scanner scanner = scanner(List.of());

        Signal high = scanner.classify("A", 100, 0.06, 0.2, true).orElseThrow();
        assertEquals(SignalAction.SELL, high.action());
        assertEquals(0.9, high.confidence(), 1e-9);

        Signal highNoSurge = scanner.classify("A", 100, 0.06, 0.8, false).orElseThrow();
        assertEquals(0.6, highNoSurge.confidence(), 1e-9);

        Signal medium = scanner.classify("B", 100, 0.03, 0.85, true).orElseThrow();
        assertEquals(SignalAction.BUY, medium.action());
        assertEquals(0.7, medium.confidence(), 1e-9);
        assertEquals(0.005, medium.targetProfit());

        Signal surgeOnly = scanner.classify("C", 100, 0.03, 0.35, true).orElseThrow();
        assertEquals(SignalAction.SELL, surgeOnly.action());
        assertEquals(0.6, surgeOnly.confidence(), 1e-9);
        assertEquals(0.004, surgeOnly.targetProfit());
        assertEquals(0.002, surgeOnly.stopLoss());

        assertTrue(scanner.classify("D", 100, 0.03, 0.85, false).isEmpty(), "Medium tier needs a surge");
        assertTrue(scanner.classify("E", 100, 0.06, 0.5, false).isEmpty(), "Neutral momentum holds");
    }

    @Test
    void testScanRanksAndIsolatesFailures() {
        feed("BTCUSD", 0.03, 0.01, 30);
        feed("ETHUSD", 0.01, 0.03, 30);

        List<Signal> signals = scanner(Arrays.asList("BTCUSD", null, "ETHUSD")).scan();

        assertEquals(2, signals.size());
        assertTrue(signals.get(0).confidence() >= signals.get(1).confidence());
        assertEquals(1, sink.ofType(EventType.SCAN_COMPLETED).size());
        assertEquals(2, sink.ofType(EventType.SCAN_COMPLETED).get(0).after().get("signals").asInt());
    }

    @Test
    void testVolatilityIsNaNUntilWindowFilled() {
        feed("LTCUSD", 0.01, 0.01, 5);
        assertTrue(Double.isNaN(scanner(List.of()).volatility("LTCUSD")));
    }
}
