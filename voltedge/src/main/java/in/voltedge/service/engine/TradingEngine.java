package in.voltedge.service.engine;

import in.voltedge.broker.BrokerGateway;
import in.voltedge.config.EngineConfig;
import in.voltedge.config.LoopConfig;
import in.voltedge.config.RiskConfig;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.trade.Position;
import in.voltedge.service.core.EventService;
import in.voltedge.service.execution.EntryCoordinator;
import in.voltedge.service.execution.PositionLifecycleManager;
import in.voltedge.service.execution.PositionReconciler;
import in.voltedge.service.market.MarketDataRefresher;
import in.voltedge.service.risk.RiskController;
import in.voltedge.service.signal.Scanner;
import in.voltedge.service.signal.TimeframeSignalRefresher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Trading Engine.
 *
 * Runs the periodic loops, each on its own single-thread scheduler:
 * <ul>
 *   <li>market-data: refresh samples, scan, publish ranked signals</li>
 *   <li>entry-search: act on the latest unconsumed signal batch</li>
 *   <li>exit-check: tighten stops and execute exits</li>
 *   <li>cache-refresh: recompute timeframe signals, reconcile with the broker</li>
 *   <li>daily-reset: clear the daily loss at the configured boundary</li>
 * </ul>
 * A loop body that throws is logged and counted against the error budget; the schedule continues.
 * {@link EngineHaltedException} stops every loop.
 */
public final class TradingEngine {
    private static final Logger log = LoggerFactory.getLogger(TradingEngine.class);

    private final EngineConfig config;
    private final MarketDataRefresher marketData;
    private final Scanner scanner;
    private final SignalMailbox mailbox;
    private final EntryCoordinator entries;
    private final PositionLifecycleManager lifecycle;
    private final TimeframeSignalRefresher timeframes;
    private final PositionReconciler reconciler;
    private final RiskController risk;
    private final BrokerGateway gateway;
    private final ErrorBudget errorBudget;
    private final EventService events;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean halted = new AtomicBoolean(false);
    private final AtomicLong lastConsumedGeneration = new AtomicLong(0);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final List<ScheduledExecutorService> schedulers = new CopyOnWriteArrayList<>();

    private volatile String haltReason;
    private volatile Instant startedAt;
    private ScheduledExecutorService resetScheduler;

    public TradingEngine(EngineConfig config, MarketDataRefresher marketData, Scanner scanner,
                         SignalMailbox mailbox, EntryCoordinator entries, PositionLifecycleManager lifecycle,
                         TimeframeSignalRefresher timeframes, PositionReconciler reconciler, RiskController risk,
                         BrokerGateway gateway, ErrorBudget errorBudget, EventService events, Clock clock) {
        this.config = config;
        this.marketData = marketData;
        this.scanner = scanner;
        this.mailbox = mailbox;
        this.entries = entries;
        this.lifecycle = lifecycle;
        this.timeframes = timeframes;
        this.reconciler = reconciler;
        this.risk = risk;
        this.gateway = gateway;
        this.errorBudget = errorBudget;
        this.events = events;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Engine already started");
        }
        startedAt = clock.instant();
        LoopConfig loops = config.loops();
        log.info("[TradingEngine] Starting: {} symbols, dryRun={}, broker={}",
            config.symbols().size(), config.execution().dryRun(), gateway.getBrokerCode());

        guarded("seed", () -> {
            marketData.seed(running::get);
            refreshTimeframes();
        }).run();

        schedule("market-data", loops.marketDataIntervalSeconds(), this::marketDataCycle);
        schedule("entry-search", loops.entrySearchIntervalSeconds(), this::entryCycle);
        schedule("exit-check", loops.exitCheckIntervalSeconds(), () -> lifecycle.evaluateExits(running::get));
        schedule("cache-refresh", loops.cacheRefreshIntervalSeconds(), this::cacheRefreshCycle);

        resetScheduler = newScheduler("daily-reset");
        scheduleDailyReset();
        log.info("[TradingEngine] Started {} loops", schedulers.size());
    }

    /**
     * Stop all loops, letting in-flight iterations finish up to the shutdown timeout.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            terminated.countDown();
            return;
        }
        log.info("[TradingEngine] Stopping...");
        long timeout = config.loops().shutdownTimeoutSeconds();
        for (ScheduledExecutorService scheduler : schedulers) {
            scheduler.shutdown();
        }
        for (ScheduledExecutorService scheduler : schedulers) {
            try {
                if (!scheduler.awaitTermination(timeout, TimeUnit.SECONDS)) {
                    log.warn("[TradingEngine] Loop did not finish within {}s, interrupting", timeout);
                    scheduler.shutdownNow();
                    // interrupted iterations still cancel their working orders
                    if (!scheduler.awaitTermination(timeout, TimeUnit.SECONDS)) {
                        log.error("[TradingEngine] Loop ignored interrupt for {}s, abandoning it", timeout);
                    }
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        List<Position> open = lifecycle.positions();
        if (!open.isEmpty()) {
            log.warn("[TradingEngine] Stopped with {} live positions: {}", open.size(),
                open.stream().map(p -> p.symbol() + ":" + p.state()).toList());
        }
        log.info("[TradingEngine] Stopped");
        terminated.countDown();
    }

    /**
     * Fatal stop. Safe to call from a loop thread: schedulers are shut down without waiting.
     */
    public void halt(EngineHaltedException cause) {
        if (!halted.compareAndSet(false, true)) {
            return;
        }
        haltReason = cause.getMessage();
        running.set(false);
        log.error("[TradingEngine] HALTED: {}. External restart required.", haltReason, cause);
        events.emit(EventType.ENGINE_HALTED, null, "engine",
            Map.of("source", cause.getSource(), "reason", haltReason));
        for (ScheduledExecutorService scheduler : schedulers) {
            scheduler.shutdown();
        }
        terminated.countDown();
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isHalted() {
        return halted.get();
    }

    public EngineStatus status() {
        SignalMailbox.Batch batch = mailbox.latest();
        return new EngineStatus(
            running.get(), halted.get(), haltReason, config.execution().dryRun(), startedAt,
            batch.generation() == 0 ? null : batch.publishedAt(), batch.signals().size(),
            lifecycle.positions(), risk.snapshot(), lifecycle.sessionStats(),
            gateway.rateUtilization(), errorBudget.getCount());
    }

    // ═══════════════════════════════════════════════════════════════
    // LOOPS
    // ═══════════════════════════════════════════════════════════════

    void marketDataCycle() {
        marketData.refresh(running::get);
        if (!running.get()) {
            return;
        }
        List<Signal> signals = scanner.scan();
        mailbox.publish(signals, clock.instant());
    }

    void entryCycle() {
        SignalMailbox.Batch batch = mailbox.latest();
        long previous = lastConsumedGeneration.getAndSet(batch.generation());
        if (batch.generation() == previous || batch.signals().isEmpty()) {
            return;
        }
        entries.run(batch.signals(), running::get);
    }

    void cacheRefreshCycle() {
        refreshTimeframes();
        if (running.get()) {
            reconciler.reconcile();
        }
    }

    private void refreshTimeframes() {
        if (!config.multiTimeframe().enabled()) {
            return;
        }
        Set<String> symbols = new LinkedHashSet<>();
        for (Signal s : mailbox.latest().signals()) {
            symbols.add(s.symbol());
        }
        for (Position p : lifecycle.positions()) {
            symbols.add(p.symbol());
        }
        if (symbols.isEmpty()) {
            symbols.addAll(config.symbols());
        }
        timeframes.refresh(new ArrayList<>(symbols), running::get);
    }

    private void scheduleDailyReset() {
        RiskConfig rc = config.risk();
        Instant now = clock.instant();
        Instant next = RiskController.nextBoundary(now, rc.resetTime(), rc.resetZone());
        long delayMillis = Math.max(0, Duration.between(now, next).toMillis());
        resetScheduler.schedule(guarded("daily-reset", () -> {
            risk.resetDaily();
            if (running.get()) {
                scheduleDailyReset();
            }
        }), delayMillis, TimeUnit.MILLISECONDS);
        log.info("[TradingEngine] Next daily reset at {}", next);
    }

    // ═══════════════════════════════════════════════════════════════
    // SCHEDULING
    // ═══════════════════════════════════════════════════════════════

    private void schedule(String name, int intervalSeconds, Runnable body) {
        ScheduledExecutorService scheduler = newScheduler(name);
        scheduler.scheduleWithFixedDelay(guarded(name, body), intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    private ScheduledExecutorService newScheduler(String name) {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "voltedge-" + name);
            t.setDaemon(true);
            return t;
        });
        schedulers.add(scheduler);
        return scheduler;
    }

    Runnable guarded(String name, Runnable body) {
        return () -> {
            if (!running.get()) {
                return;
            }
            try {
                body.run();
            } catch (EngineHaltedException e) {
                halt(e);
            } catch (RuntimeException e) {
                log.error("[TradingEngine] {} loop failed: {}", name, e.getMessage(), e);
                events.emit(EventType.LOOP_ERROR, null, name,
                    Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
                try {
                    errorBudget.recordUnexpected(name, String.valueOf(e.getMessage()));
                } catch (EngineHaltedException fatal) {
                    halt(fatal);
                }
            }
        };
    }
}
