package in.voltedge.service.market;

import in.voltedge.domain.market.Bar;
import in.voltedge.domain.market.Sample;
import in.voltedge.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SeriesStore.
 *
 * Tests:
 * - Eviction at capacity keeps size constant and order chronological
 * - Invalid prices rejected
 * - Bulk seeding from bars
 */
class SeriesStoreTest {

    @Test
    void testEvictionAtCapacityIsIdempotent() {
        MutableClock clock = MutableClock.at("2024-03-01T00:00:00Z");
        SeriesStore store = new SeriesStore(5, clock);

        for (int i = 1; i <= 20; i++) {
            store.record("BTCUSD", 100.0 + i, 10.0);
            clock.advance(Duration.ofSeconds(1));
            assertEquals(Math.min(i, 5), store.size("BTCUSD"));
        }

        List<Sample> window = store.window("BTCUSD", 10);
        assertEquals(5, window.size());
        assertArrayEquals(new double[]{116, 117, 118, 119, 120}, store.prices("BTCUSD", 5));
        for (int i = 1; i < window.size(); i++) {
            assertTrue(window.get(i).timestamp().isAfter(window.get(i - 1).timestamp()),
                "Samples must stay chronological");
        }
    }

    @Test
    void testLateSampleDoesNotBreakOrdering() {
        SeriesStore store = new SeriesStore(10);
        Instant t = Instant.parse("2024-03-01T00:00:10Z");
        store.record(new Sample("ETHUSD", 2000, 1, t));
        store.record(new Sample("ETHUSD", 2001, 1, t.minusSeconds(5)));

        List<Sample> window = store.window("ETHUSD", 2);
        assertFalse(window.get(1).timestamp().isBefore(window.get(0).timestamp()));
        assertEquals(2001, store.latest("ETHUSD").orElseThrow().price());
    }

    @Test
    void testRejectsNonPositivePrice() {
        SeriesStore store = new SeriesStore(10);
        assertThrows(IllegalArgumentException.class, () -> store.record("BTCUSD", 0.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> store.record("BTCUSD", Double.NaN, 1.0));
        assertThrows(IllegalArgumentException.class, () -> store.record("BTCUSD", 10.0, -1.0));
        assertEquals(0, store.size("BTCUSD"));
    }

    @Test
    void testUnknownSymbolIsEmpty() {
        SeriesStore store = new SeriesStore(10);
        assertTrue(store.window("NOPE", 5).isEmpty());
        assertTrue(store.latest("NOPE").isEmpty());
        assertEquals(0, store.prices("NOPE", 5).length);
    }

    @Test
    void testBulkLoadSkipsInvalidBarsAndRespectsCapacity() {
        SeriesStore store = new SeriesStore(3);
        List<Bar> bars = new ArrayList<>();
        Instant t = Instant.parse("2024-03-01T00:00:00Z");
        for (int i = 0; i < 5; i++) {
            bars.add(new Bar(t.plusSeconds(60L * i), 1, 1, 1, i == 2 ? 0.0 : 10.0 + i, 100));
        }

        assertEquals(4, store.bulkLoad("SOLUSD", bars));
        assertEquals(3, store.size("SOLUSD"));
        assertArrayEquals(new double[]{11, 13, 14}, store.prices("SOLUSD", 3));
    }
}
