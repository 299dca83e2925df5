package in.voltedge.domain.trade;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Position transitions and price math.
 */
class PositionTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void testOpenComputesDirectionAwareTargets() {
        Position buy = Position.reserve("BTCUSD", Side.BUY, new BigDecimal("1"), 0.003, 0.002, T0)
            .open(new BigDecimal("1"), new BigDecimal("100"), T0, "o-1");
        assertEquals(0, new BigDecimal("100.3").compareTo(buy.targetPrice()));
        assertEquals(0, new BigDecimal("99.8").compareTo(buy.stopPrice()));
        assertEquals(PositionState.OPEN, buy.state());

        Position sell = Position.reserve("BTCUSD", Side.SELL, new BigDecimal("1"), 0.003, 0.002, T0)
            .open(new BigDecimal("1"), new BigDecimal("100"), T0, "o-2");
        assertEquals(0, new BigDecimal("99.7").compareTo(sell.targetPrice()));
        assertEquals(0, new BigDecimal("100.2").compareTo(sell.stopPrice()));
    }

    @Test
    void testIllegalTransitionsRejected() {
        Position reserved = Position.reserve("ETHUSD", Side.BUY, BigDecimal.ONE, 0.005, 0.003, T0);
        assertThrows(IllegalStateException.class, () -> reserved.requestExit(ExitReason.STOP_LOSS, T0));
        assertThrows(IllegalStateException.class, () -> reserved.close("x", T0));

        Position open = reserved.open(BigDecimal.ONE, new BigDecimal("2000"), T0, "o-1");
        assertThrows(IllegalStateException.class, () -> open.fail(T0), "OPEN cannot fail directly");
        assertThrows(IllegalStateException.class, () -> open.withExitAttempt(T0));

        Position closed = open.requestExit(ExitReason.PROFIT_TARGET, T0).close("o-2", T0);
        assertTrue(closed.state().isTerminal());
        assertThrows(IllegalStateException.class, () -> closed.requestExit(ExitReason.TIME_LIMIT, T0));
    }

    @Test
    void testExitAttemptsAccumulate() {
        Position requested = Position.reserve("SOLUSD", Side.BUY, BigDecimal.ONE, 0.005, 0.003, T0)
            .open(BigDecimal.ONE, new BigDecimal("150"), T0, "o-1")
            .requestExit(ExitReason.TIME_LIMIT, T0);

        Position twice = requested.withExitAttempt(T0).withExitAttempt(T0);
        assertEquals(2, twice.exitAttempts());
        assertEquals(PositionState.EXIT_REQUESTED, twice.state());
        assertEquals(ExitReason.TIME_LIMIT, twice.exitReason());
    }

    @Test
    void testPnlMath() {
        Position sell = Position.reserve("BTCUSD", Side.SELL, new BigDecimal("2"), 0.005, 0.003, T0)
            .open(new BigDecimal("2"), new BigDecimal("100"), T0, "o-1");

        assertEquals(0, new BigDecimal("4").compareTo(sell.realizedPnl(new BigDecimal("98"), new BigDecimal("2"))));
        assertEquals(0.02, sell.unrealizedReturn(new BigDecimal("98")), 1e-9);
        assertEquals(-0.01, sell.unrealizedReturn(new BigDecimal("101")), 1e-9);
    }

    @Test
    void testStopPriceUpdateMarksTrailing() {
        Position open = Position.reserve("BTCUSD", Side.BUY, BigDecimal.ONE, 0.05, 0.01, T0)
            .open(BigDecimal.ONE, new BigDecimal("100"), T0, "o-1");
        assertFalse(open.trailingActive());

        Position trailed = open.withStopPrice(new BigDecimal("101"), T0);
        assertTrue(trailed.trailingActive());
        assertEquals(0, new BigDecimal("101").compareTo(trailed.stopPrice()));
        assertEquals(open.targetPrice(), trailed.targetPrice());
    }
}
