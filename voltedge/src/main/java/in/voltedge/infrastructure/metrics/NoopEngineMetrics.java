package in.voltedge.infrastructure.metrics;

import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.trade.ExitReason;

import java.math.BigDecimal;
import java.time.Duration;

final class NoopEngineMetrics implements EngineMetrics {
    static final NoopEngineMetrics INSTANCE = new NoopEngineMetrics();

    private NoopEngineMetrics() {}

    @Override public void recordBrokerCall(String operation, ErrorCategory failure, Duration latency) {}
    @Override public void recordRetry(String operation, ErrorCategory reason, int attempt) {}
    @Override public void recordRateLimitWait(Duration waited) {}
    @Override public void updateRateUtilization(double utilization) {}
    @Override public void recordScan(int symbolsScanned, int signalsEmitted) {}
    @Override public void recordEntryRejected(String reason) {}
    @Override public void updateDailyLoss(BigDecimal dailyLoss) {}
    @Override public void recordPositionOpened(String symbol) {}
    @Override public void recordPositionClosed(ExitReason reason, BigDecimal realizedPnl) {}
    @Override public void recordPositionFailed(ErrorCategory category) {}
    @Override public void updateOpenPositions(int count) {}
    @Override public void updateWinRate(double winRate) {}
}
