package in.voltedge.infrastructure.metrics;

import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.trade.ExitReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Prometheus implementation of EngineMetrics.
 *
 * Key Metrics:
 * - engine_broker_calls_total{operation, outcome} - Broker call outcomes
 * - engine_broker_call_latency_seconds{operation} - Broker call latency
 * - engine_rate_limit_wait_seconds - Time spent waiting for the call budget
 * - engine_signals_emitted_total - Signals produced by the scanner
 * - engine_entries_rejected_total{reason} - Admission rejections
 * - engine_positions_closed_total{reason, result} - Closed positions by exit reason
 * - engine_open_positions / engine_daily_loss / engine_win_rate - Gauges
 */
public class PrometheusEngineMetrics implements EngineMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusEngineMetrics.class);

    private final CollectorRegistry registry;

    // Broker
    private final Counter brokerCalls;
    private final Histogram brokerLatency;
    private final Counter retries;
    private final Histogram rateLimitWait;
    private final Gauge rateUtilization;

    // Signals & risk
    private final Counter symbolsScanned;
    private final Counter signalsEmitted;
    private final Counter entriesRejected;
    private final Gauge dailyLoss;

    // Positions
    private final Counter positionsOpened;
    private final Counter positionsClosed;
    private final Counter positionsFailed;
    private final Counter realizedPnl;
    private final Gauge openPositions;
    private final Gauge winRate;

    public PrometheusEngineMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusEngineMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.brokerCalls = Counter.build()
            .name("engine_broker_calls_total")
            .help("Broker calls by operation and outcome")
            .labelNames("operation", "outcome")
            .register(registry);

        this.brokerLatency = Histogram.build()
            .name("engine_broker_call_latency_seconds")
            .help("Broker call latency in seconds")
            .labelNames("operation")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0)
            .register(registry);

        this.retries = Counter.build()
            .name("engine_broker_retries_total")
            .help("Broker call retries by operation and reason")
            .labelNames("operation", "reason")
            .register(registry);

        this.rateLimitWait = Histogram.build()
            .name("engine_rate_limit_wait_seconds")
            .help("Time callers waited for a rate budget slot")
            .buckets(0.1, 1.0, 5.0, 15.0, 30.0, 60.0)
            .register(registry);

        this.rateUtilization = Gauge.build()
            .name("engine_rate_utilization")
            .help("Share of the rolling call budget in use (0-1)")
            .register(registry);

        this.symbolsScanned = Counter.build()
            .name("engine_symbols_scanned_total")
            .help("Symbols evaluated by the scanner")
            .register(registry);

        this.signalsEmitted = Counter.build()
            .name("engine_signals_emitted_total")
            .help("Signals emitted by the scanner")
            .register(registry);

        this.entriesRejected = Counter.build()
            .name("engine_entries_rejected_total")
            .help("Entry attempts rejected by admission control or filters")
            .labelNames("reason")
            .register(registry);

        this.dailyLoss = Gauge.build()
            .name("engine_daily_loss")
            .help("Realized loss accumulated since the last daily reset")
            .register(registry);

        this.positionsOpened = Counter.build()
            .name("engine_positions_opened_total")
            .help("Positions that reached OPEN")
            .register(registry);

        this.positionsClosed = Counter.build()
            .name("engine_positions_closed_total")
            .help("Positions closed by exit reason and result")
            .labelNames("reason", "result")
            .register(registry);

        this.positionsFailed = Counter.build()
            .name("engine_positions_failed_total")
            .help("Positions moved to FAILED by error category")
            .labelNames("category")
            .register(registry);

        this.realizedPnl = Counter.build()
            .name("engine_realized_pnl_abs_total")
            .help("Absolute realized P&L by sign")
            .labelNames("sign")
            .register(registry);

        this.openPositions = Gauge.build()
            .name("engine_open_positions")
            .help("Positions currently in the live set")
            .register(registry);

        this.winRate = Gauge.build()
            .name("engine_win_rate")
            .help("Session win rate (0-1)")
            .register(registry);

        log.info("[PrometheusEngineMetrics] Initialized");
    }

    @Override
    public void recordBrokerCall(String operation, ErrorCategory failure, Duration latency) {
        brokerCalls.labels(operation, failure == null ? "success" : failure.name()).inc();
        brokerLatency.labels(operation).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordRetry(String operation, ErrorCategory reason, int attempt) {
        retries.labels(operation, reason.name()).inc();
    }

    @Override
    public void recordRateLimitWait(Duration waited) {
        rateLimitWait.observe(waited.toMillis() / 1000.0);
    }

    @Override
    public void updateRateUtilization(double utilization) {
        rateUtilization.set(utilization);
    }

    @Override
    public void recordScan(int scanned, int emitted) {
        symbolsScanned.inc(scanned);
        signalsEmitted.inc(emitted);
    }

    @Override
    public void recordEntryRejected(String reason) {
        entriesRejected.labels(reason).inc();
    }

    @Override
    public void updateDailyLoss(BigDecimal loss) {
        dailyLoss.set(loss.doubleValue());
    }

    @Override
    public void recordPositionOpened(String symbol) {
        positionsOpened.inc();
    }

    @Override
    public void recordPositionClosed(ExitReason reason, BigDecimal pnl) {
        String result = pnl.signum() > 0 ? "win" : "loss";
        positionsClosed.labels(reason.name(), result).inc();
        realizedPnl.labels(pnl.signum() >= 0 ? "gain" : "loss").inc(pnl.abs().doubleValue());
    }

    @Override
    public void recordPositionFailed(ErrorCategory category) {
        positionsFailed.labels(category.name()).inc();
    }

    @Override
    public void updateOpenPositions(int count) {
        openPositions.set(count);
    }

    @Override
    public void updateWinRate(double rate) {
        winRate.set(rate);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
