package in.voltedge.service.risk;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of admission state.
 */
public record RiskState(
    BigDecimal currentDailyLoss,
    BigDecimal dailyLossLimit,
    int openPositions,
    int maxConcurrentPositions,
    Instant lastReset
) {
    public boolean lossLimitReached() {
        return currentDailyLoss.compareTo(dailyLossLimit) >= 0;
    }
}
