package in.voltedge.service.market;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolUniverseTest {

    @Test
    void testNormalize() {
        assertEquals("BTCUSD", SymbolUniverse.normalize("BTC/USD"));
        assertEquals("ETHUSD", SymbolUniverse.normalize(" eth-usd "));
        assertThrows(IllegalArgumentException.class, () -> SymbolUniverse.normalize(" / "));
    }

    @Test
    void testMergeKeepsFirstOccurrenceOrder() {
        List<String> merged = SymbolUniverse.merge(List.of("BTC/USD", "ETHUSD"), List.of("ethusd", "DOGE/USD"));
        assertEquals(List.of("BTCUSD", "ETHUSD", "DOGEUSD"), merged);
    }
}
