package in.voltedge.service.execution;

import in.voltedge.domain.trade.TradeRecord;

import java.math.BigDecimal;

/**
 * Running win/loss statistics for the process lifetime.
 */
public final class SessionStats {

    public record Snapshot(
        int totalTrades,
        int wins,
        int losses,
        BigDecimal totalPnl,
        double winRate,
        int currentStreak,      // +n for n wins in a row, -n for losses
        int longestWinStreak,
        int longestLossStreak
    ) {}

    private int totalTrades;
    private int wins;
    private int losses;
    private BigDecimal totalPnl = BigDecimal.ZERO;
    private int currentStreak;
    private int longestWinStreak;
    private int longestLossStreak;

    public synchronized Snapshot record(TradeRecord trade) {
        totalTrades++;
        totalPnl = totalPnl.add(trade.realizedPnl());
        if (trade.isWin()) {
            wins++;
            currentStreak = currentStreak > 0 ? currentStreak + 1 : 1;
            longestWinStreak = Math.max(longestWinStreak, currentStreak);
        } else {
            losses++;
            currentStreak = currentStreak < 0 ? currentStreak - 1 : -1;
            longestLossStreak = Math.max(longestLossStreak, -currentStreak);
        }
        return snapshot();
    }

    public synchronized Snapshot snapshot() {
        double winRate = totalTrades == 0 ? 0.0 : (double) wins / totalTrades;
        return new Snapshot(totalTrades, wins, losses, totalPnl, winRate,
            currentStreak, longestWinStreak, longestLossStreak);
    }
}
