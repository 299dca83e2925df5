package in.voltedge.bootstrap;

import in.voltedge.broker.Broker;
import in.voltedge.broker.BrokerGateway;
import in.voltedge.broker.BrokerResult;
import in.voltedge.broker.adapters.PaperBroker;
import in.voltedge.config.EngineConfig;
import in.voltedge.config.ExecutionConfig;
import in.voltedge.domain.order.Account;
import in.voltedge.infrastructure.broker.common.ReconnectionPolicy;
import in.voltedge.infrastructure.metrics.PrometheusEngineMetrics;
import in.voltedge.service.core.EventService;
import in.voltedge.service.core.LoggingEventSink;
import in.voltedge.service.core.RecentEventBuffer;
import in.voltedge.service.engine.ErrorBudget;
import in.voltedge.service.engine.SignalMailbox;
import in.voltedge.service.engine.TradingEngine;
import in.voltedge.service.execution.EntryCoordinator;
import in.voltedge.service.execution.ExitEvaluator;
import in.voltedge.service.execution.OrderExecutor;
import in.voltedge.service.execution.PositionBook;
import in.voltedge.service.execution.PositionLifecycleManager;
import in.voltedge.service.execution.PositionReconciler;
import in.voltedge.service.execution.PositionSizer;
import in.voltedge.service.market.MarketDataRefresher;
import in.voltedge.service.market.SeriesStore;
import in.voltedge.service.risk.RateBudget;
import in.voltedge.service.risk.RiskController;
import in.voltedge.service.signal.MultiTimeframeValidator;
import in.voltedge.service.signal.Scanner;
import in.voltedge.service.signal.StochRsiCalculator;
import in.voltedge.service.signal.TimeframeSignalCache;
import in.voltedge.service.signal.TimeframeSignalRefresher;
import in.voltedge.service.signal.VolumeConfirmationFilter;
import in.voltedge.transport.http.MonitoringHandlers;
import in.voltedge.transport.http.MonitoringServer;
import in.voltedge.util.Env;
import in.voltedge.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * VoltEdge trading engine entry point.
 *
 * Wires the scanner, timeframe validation, risk control and the position lifecycle around a
 * broker, then runs the engine loops until shutdown or a fatal halt.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final Duration RECONCILE_GRACE = Duration.ofSeconds(30);

    public static void main(String[] args) throws InterruptedException {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== VoltEdge Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        EngineConfig config = EngineConfig.load();
        Clock clock = Clock.systemUTC();
        log.info("✓ Config loaded: symbols={} dryRun={}", config.symbols(), config.execution().dryRun());

        // ═══════════════════════════════════════════════════════════════
        // Metrics & events
        // ═══════════════════════════════════════════════════════════════
        PrometheusEngineMetrics metrics = new PrometheusEngineMetrics();
        RecentEventBuffer recentEvents = new RecentEventBuffer(config.monitoring().recentEvents());
        EventService events = new EventService(List.of(new LoggingEventSink(), recentEvents), clock);
        log.info("✓ Prometheus metrics and event sinks initialized");

        // ═══════════════════════════════════════════════════════════════
        // Broker
        // ═══════════════════════════════════════════════════════════════
        ExecutionConfig execution = config.execution();
        Broker broker = new PaperBroker(BigDecimal.valueOf(execution.capital()),
            Env.getInt("VOLTEDGE_PAPER_SEED", 42), clock);
        RateBudget rateBudget = new RateBudget(config.risk().maxCallsPerWindow(),
            Duration.ofSeconds(config.risk().rateWindowSeconds()), clock, Sleeper.system());
        BrokerGateway gateway = new BrokerGateway(broker, rateBudget, execution.callTimeout(), metrics, events);
        OrderExecutor executor = new OrderExecutor(gateway, execution,
            ReconnectionPolicy.forBrokerCalls(execution), Sleeper.system(), clock, metrics);

        BigDecimal capital = resolveCapital(gateway, execution);
        log.info("✓ Broker {} connected, capital {}", gateway.getBrokerCode(), capital.toPlainString());

        // ═══════════════════════════════════════════════════════════════
        // Signals
        // ═══════════════════════════════════════════════════════════════
        SeriesStore store = new SeriesStore(config.scanner().bufferCapacity(), clock);
        Scanner scanner = new Scanner(store, config.scanner(), config::symbols, events, metrics, clock);
        TimeframeSignalCache timeframeCache = new TimeframeSignalCache();
        TimeframeSignalRefresher timeframeRefresher = new TimeframeSignalRefresher(gateway, executor,
            new StochRsiCalculator(config.stochRsi()), config.multiTimeframe(), config.stochRsi(),
            timeframeCache, clock);
        MultiTimeframeValidator validator = new MultiTimeframeValidator(config.multiTimeframe(), events);
        VolumeConfirmationFilter volumeFilter = new VolumeConfirmationFilter(config.volume(), events);
        MarketDataRefresher marketData = new MarketDataRefresher(gateway, executor, store,
            config.symbols(), config.loops().seedBars());

        // ═══════════════════════════════════════════════════════════════
        // Risk & positions
        // ═══════════════════════════════════════════════════════════════
        PositionBook book = new PositionBook();
        RiskController risk = new RiskController(config.risk(), capital, book, events, metrics, clock);
        ErrorBudget errorBudget = new ErrorBudget(execution.maxUnexpectedErrors());
        PositionLifecycleManager lifecycle = new PositionLifecycleManager(book, risk,
            new PositionSizer(execution, () -> capital),
            new ExitEvaluator(execution, config.trailingStops()),
            executor, store, scanner::volatility, execution, errorBudget, events, metrics, clock);
        EntryCoordinator entries = new EntryCoordinator(lifecycle, book, risk, store, volumeFilter, validator,
            timeframeCache, execution, config.volume(), config.multiTimeframe());
        PositionReconciler reconciler = new PositionReconciler(gateway, book, lifecycle, events,
            execution.dryRun(), RECONCILE_GRACE, clock);

        TradingEngine engine = new TradingEngine(config, marketData, scanner, new SignalMailbox(), entries,
            lifecycle, timeframeRefresher, reconciler, risk, gateway, errorBudget, events, clock);

        // ═══════════════════════════════════════════════════════════════
        // Monitoring
        // ═══════════════════════════════════════════════════════════════
        MonitoringServer monitoring = null;
        if (config.monitoring().enabled()) {
            monitoring = new MonitoringServer(config.monitoring().port(), metrics.getRegistry(),
                new MonitoringHandlers(engine::status, recentEvents));
            monitoring.start();
        }

        // ═══════════════════════════════════════════════════════════════
        // Run
        // ═══════════════════════════════════════════════════════════════
        MonitoringServer server = monitoring;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            engine.stop();
            if (server != null) {
                server.stop();
            }
        }, "voltedge-shutdown"));

        engine.start();
        log.info("✓ VoltEdge running");
        engine.awaitTermination();

        if (engine.isHalted()) {
            log.error("VoltEdge halted: {}", engine.status().haltReason());
            if (server != null) {
                server.stop();
            }
            System.exit(2);
        }
    }

    private static BigDecimal resolveCapital(BrokerGateway gateway, ExecutionConfig execution) {
        BrokerResult<Account> account = gateway.getAccount();
        if (account.isSuccess() && account.value().equity().signum() > 0) {
            return account.value().equity();
        }
        log.warn("Account unavailable ({}), using configured capital {}", account.reason(), execution.capital());
        return BigDecimal.valueOf(execution.capital());
    }
}
