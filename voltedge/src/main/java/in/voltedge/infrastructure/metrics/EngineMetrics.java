package in.voltedge.infrastructure.metrics;

import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.trade.ExitReason;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Engine metrics interface.
 *
 * Implementations can publish to Prometheus or anything else; the engine only calls these methods.
 */
public interface EngineMetrics {

    // ═══════════════════════════════════════════════════════════════
    // BROKER
    // ═══════════════════════════════════════════════════════════════

    /**
     * Record one broker call.
     *
     * @param operation Broker operation (submit_order, get_order_status, ...)
     * @param failure Error category, or null on success
     * @param latency Time spent in the call, excluding rate-budget waits
     */
    void recordBrokerCall(String operation, ErrorCategory failure, Duration latency);

    void recordRetry(String operation, ErrorCategory reason, int attempt);

    void recordRateLimitWait(Duration waited);

    void updateRateUtilization(double utilization);

    // ═══════════════════════════════════════════════════════════════
    // SIGNALS & RISK
    // ═══════════════════════════════════════════════════════════════

    void recordScan(int symbolsScanned, int signalsEmitted);

    void recordEntryRejected(String reason);

    void updateDailyLoss(BigDecimal dailyLoss);

    // ═══════════════════════════════════════════════════════════════
    // POSITIONS
    // ═══════════════════════════════════════════════════════════════

    void recordPositionOpened(String symbol);

    void recordPositionClosed(ExitReason reason, BigDecimal realizedPnl);

    void recordPositionFailed(ErrorCategory category);

    void updateOpenPositions(int count);

    void updateWinRate(double winRate);

    /**
     * Metrics sink that records nothing.
     */
    static EngineMetrics noop() {
        return NoopEngineMetrics.INSTANCE;
    }
}
