package in.voltedge.domain.trade;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Closed round trip, appended to the trade log when an exit fills.
 */
public record TradeRecord(
    String symbol,
    Side side,
    BigDecimal quantity,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    Instant entryTime,
    Instant exitTime,
    BigDecimal realizedPnl,
    ExitReason exitReason,
    boolean dryRun
) {
    public boolean isWin() {
        return realizedPnl.signum() > 0;
    }

    public Duration holdingTime() {
        return Duration.between(entryTime, exitTime);
    }
}
