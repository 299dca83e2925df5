package in.voltedge.service.execution;

import in.voltedge.domain.trade.ExitReason;
import in.voltedge.domain.trade.Side;
import in.voltedge.domain.trade.TradeRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SessionStatsTest {

    private static TradeRecord trade(String pnl) {
        Instant t = Instant.parse("2024-03-01T10:00:00Z");
        return new TradeRecord("BTCUSD", Side.BUY, BigDecimal.ONE, new BigDecimal("100"), new BigDecimal("100"),
            t, t.plusSeconds(60), new BigDecimal(pnl), ExitReason.PROFIT_TARGET, true);
    }

    @Test
    void testStreaksAndWinRate() {
        SessionStats stats = new SessionStats();
        stats.record(trade("5"));
        stats.record(trade("3"));
        stats.record(trade("-1"));
        stats.record(trade("-2"));
        stats.record(trade("-1"));
        SessionStats.Snapshot s = stats.record(trade("4"));

        assertEquals(6, s.totalTrades());
        assertEquals(3, s.wins());
        assertEquals(3, s.losses());
        assertEquals(0.5, s.winRate(), 1e-9);
        assertEquals(0, new BigDecimal("8").compareTo(s.totalPnl()));
        assertEquals(1, s.currentStreak());
        assertEquals(2, s.longestWinStreak());
        assertEquals(3, s.longestLossStreak());
    }

    @Test
    void testBreakEvenCountsAsLoss() {
        SessionStats stats = new SessionStats();
        SessionStats.Snapshot s = stats.record(trade("0"));
        assertEquals(1, s.losses());
        assertEquals(-1, s.currentStreak());
    }

    @Test
    void testEmptySnapshot() {
        SessionStats.Snapshot s = new SessionStats().snapshot();
        assertEquals(0, s.totalTrades());
        assertEquals(0.0, s.winRate());
    }
}
