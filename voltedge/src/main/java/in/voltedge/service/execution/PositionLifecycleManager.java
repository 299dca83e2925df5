package in.voltedge.service.execution;

import in.voltedge.broker.BrokerResult;
import in.voltedge.config.ExecutionConfig;
import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.order.Fill;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.trade.ExitReason;
import in.voltedge.domain.trade.Position;
import in.voltedge.domain.trade.PositionState;
import in.voltedge.domain.trade.Side;
import in.voltedge.domain.trade.TradeRecord;
import in.voltedge.infrastructure.metrics.EngineMetrics;
import in.voltedge.service.core.EventService;
import in.voltedge.service.engine.EngineHaltedException;
import in.voltedge.service.engine.ErrorBudget;
import in.voltedge.service.market.SeriesStore;
import in.voltedge.service.risk.RejectReason;
import in.voltedge.service.risk.RiskController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.ToDoubleFunction;

/**
 * Position Lifecycle Manager.
 *
 * Drives each position through NEW -> OPEN -> EXIT_REQUESTED -> CLOSED, or FAILED. All work on a
 * symbol happens under that symbol's lock, so an entry and an exit for the same symbol never
 * overlap. A caller that finds the lock held skips the symbol instead of waiting.
 */
public final class PositionLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(PositionLifecycleManager.class);

    private static final String COMPONENT = "lifecycle";

    private final PositionBook book;
    private final RiskController risk;
    private final PositionSizer sizer;
    private final ExitEvaluator exits;
    private final OrderExecutor executor;
    private final SeriesStore store;
    private final ToDoubleFunction<String> volatility;
    private final ExecutionConfig config;
    private final ErrorBudget errorBudget;
    private final EventService events;
    private final EngineMetrics metrics;
    private final Clock clock;

    private final SessionStats stats = new SessionStats();
    private final Queue<TradeRecord> tradeLog = new ConcurrentLinkedQueue<>();
    private final Map<String, ReentrantLock> symbolLocks = new ConcurrentHashMap<>();

    public PositionLifecycleManager(PositionBook book, RiskController risk, PositionSizer sizer,
                                    ExitEvaluator exits, OrderExecutor executor, SeriesStore store,
                                    ToDoubleFunction<String> volatility, ExecutionConfig config,
                                    ErrorBudget errorBudget, EventService events, EngineMetrics metrics,
                                    Clock clock) {
        this.book = book;
        this.risk = risk;
        this.sizer = sizer;
        this.exits = exits;
        this.executor = executor;
        this.store = store;
        this.volatility = volatility;
        this.config = config;
        this.errorBudget = errorBudget;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // ENTRY
    // ═══════════════════════════════════════════════════════════════

    /**
     * Size, admit and execute an entry for a scanner signal.
     */
    public EntryOutcome enter(Signal signal) {
        Side side = signal.action().entrySide();
        if (side == null) {
            throw new IllegalArgumentException("Cannot enter on a " + signal.action() + " signal");
        }
        String symbol = signal.symbol();
        ReentrantLock lock = lockFor(symbol);
        if (!lock.tryLock()) {
            risk.reject(symbol, RejectReason.SYMBOL_BUSY, signal.confidence());
            return EntryOutcome.rejected(RejectReason.SYMBOL_BUSY);
        }
        try {
            BigDecimal price = latestPrice(symbol).orElse(BigDecimal.valueOf(signal.price()));
            BigDecimal quantity = sizer.size(signal.confidence(), price);
            if (quantity.signum() <= 0) {
                risk.reject(symbol, RejectReason.ZERO_QUANTITY, signal.confidence());
                return EntryOutcome.rejected(RejectReason.ZERO_QUANTITY);
            }

            RiskController.Admission admission = risk.tryAdmitAndReserve(signal, quantity);
            if (!admission.admitted()) {
                return EntryOutcome.rejected(admission.reason());
            }
            Position reserved = admission.reservation();
            emitTransition(null, reserved);
            metrics.updateOpenPositions(book.size());

            BrokerResult<Fill> fill;
            try {
                fill = config.dryRun()
                    ? simulatedFill(symbol, side, quantity, price)
                    : executor.execute(symbol, side, quantity);
            } catch (UnsettledOrderException e) {
                if (e.getSettlement().isSuccess()) {
                    openFromFill(reserved, e.getSettlement().value());
                } else {
                    holdUnsettled(reserved, "entry", e.getOrderId(), e.getMessage());
                }
                throw e;
            } catch (EngineHaltedException e) {
                // submit outcome unknown; the reservation stays so the symbol is not re-entered
                holdUnsettled(reserved, "entry", null, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                failEntry(reserved, ErrorCategory.UNEXPECTED, e.getMessage(), false);
                throw e;
            }

            if (!fill.isSuccess()) {
                failEntry(reserved, fill.error(), fill.reason(), true);
                return EntryOutcome.failed(reserved, fill.error(), fill.reason());
            }
            return EntryOutcome.opened(openFromFill(reserved, fill.value()));
        } finally {
            lock.unlock();
        }
    }

    private Position openFromFill(Position reserved, Fill f) {
        Position opened = reserved.open(f.quantity(), f.price(), f.filledAt(), f.orderId());
        swap(reserved, opened);
        metrics.recordPositionOpened(reserved.symbol());
        log.info("[Lifecycle] OPEN {} {} {} @ {} target={} stop={}{}",
            reserved.symbol(), reserved.side(), opened.quantity().toPlainString(),
            opened.entryPrice().toPlainString(), opened.targetPrice().toPlainString(),
            opened.stopPrice().toPlainString(), config.dryRun() ? " (dry run)" : "");
        return opened;
    }

    /**
     * Broker state unknown after connection loss: the position keeps its current state in the book.
     */
    private void holdUnsettled(Position position, String phase, String orderId, String reason) {
        log.error("[Lifecycle] {} {} order {} unsettled, kept as {}: {}",
            position.symbol(), phase, orderId, position.state(), reason);
        Map<String, Object> payload = failurePayload(phase, ErrorCategory.CONNECTION_ERROR, reason,
            position.exitAttempts());
        payload.put("orderId", orderId);
        payload.put("state", position.state().name());
        events.emit(EventType.ORDER_FAILED, position.symbol(), COMPONENT, payload);
    }

    private void failEntry(Position reserved, ErrorCategory category, String reason, boolean countUnexpected) {
        Position failed = reserved.fail(clock.instant());
        book.remove(reserved);
        emitTransition(reserved, failed);
        reportFailure(failed, "entry", category, reason);
        if (countUnexpected && category == ErrorCategory.UNEXPECTED) {
            errorBudget.recordUnexpected("entry:" + reserved.symbol(), reason);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // EXITS
    // ═══════════════════════════════════════════════════════════════

    /**
     * One exit-check cycle over every live position.
     *
     * @param running checked between symbols; returning false ends the cycle early
     * @return number of positions closed in this cycle
     */
    public int evaluateExits(BooleanSupplier running) {
        int closed = 0;
        for (Position position : book.snapshot()) {
            if (!running.getAsBoolean()) {
                break;
            }
            if (position.state() != PositionState.OPEN && position.state() != PositionState.EXIT_REQUESTED) {
                continue;
            }
            ReentrantLock lock = lockFor(position.symbol());
            if (!lock.tryLock()) {
                log.debug("[Lifecycle] {} busy, exit check deferred", position.symbol());
                continue;
            }
            try {
                if (checkPosition(position.symbol())) {
                    closed++;
                }
            } finally {
                lock.unlock();
            }
        }
        return closed;
    }

    private boolean checkPosition(String symbol) {
        Optional<Position> current = book.get(symbol);
        Optional<BigDecimal> price = latestPrice(symbol);
        if (current.isEmpty() || price.isEmpty()) {
            return false;
        }
        Position position = current.get();
        Instant now = clock.instant();

        if (position.state() == PositionState.OPEN) {
            Optional<BigDecimal> stop = exits.tightenedStop(position, price.get());
            if (stop.isPresent()) {
                Position tightened = position.withStopPrice(stop.get(), now);
                if (book.replace(position, tightened)) {
                    events.emit(EventType.STOP_TIGHTENED, symbol, COMPONENT,
                        Map.of("stopPrice", position.stopPrice()), Map.of("stopPrice", tightened.stopPrice()));
                    log.info("[Lifecycle] {} stop tightened {} -> {}", symbol,
                        position.stopPrice().toPlainString(), tightened.stopPrice().toPlainString());
                    position = tightened;
                }
            }

            Optional<ExitReason> reason = exits.evaluate(position, price.get(),
                volatility.applyAsDouble(symbol), now);
            if (reason.isEmpty()) {
                return false;
            }
            Position requested = position.requestExit(reason.get(), now);
            if (!swap(position, requested)) {
                return false;
            }
            log.info("[Lifecycle] EXIT_REQUESTED {} reason={} price={} entry={}", symbol, reason.get(),
                price.get().toPlainString(), position.entryPrice().toPlainString());
            position = requested;
        }

        if (position.state() == PositionState.EXIT_REQUESTED) {
            return executeExit(position, price.get());
        }
        return false;
    }

    private boolean executeExit(Position position, BigDecimal price) {
        String symbol = position.symbol();
        Side exitSide = position.side().opposite();
        BrokerResult<Fill> result;
        try {
            result = config.dryRun()
                ? simulatedFill(symbol, exitSide, position.quantity(), price)
                : executor.execute(symbol, exitSide, position.quantity());
        } catch (UnsettledOrderException e) {
            if (e.getSettlement().isSuccess()) {
                applyExitFill(position, e.getSettlement().value());
            } else {
                holdUnsettled(position, "exit", e.getOrderId(), e.getMessage());
            }
            throw e;
        } catch (EngineHaltedException e) {
            holdUnsettled(position, "exit", null, e.getMessage());
            throw e;
        }

        if (!result.isSuccess()) {
            handleExitFailure(position, result.error(), result.reason());
            return false;
        }
        return applyExitFill(position, result.value());
    }

    /**
     * @return true when the fill closed the whole position
     */
    private boolean applyExitFill(Position position, Fill fill) {
        String symbol = position.symbol();
        Instant now = clock.instant();
        BigDecimal pnl = position.realizedPnl(fill.price(), fill.quantity());
        recordTrade(position, fill, pnl);

        BigDecimal remaining = position.quantity().subtract(fill.quantity());
        if (remaining.signum() > 0) {
            Position reduced = position.withQuantity(remaining, now);
            swap(position, reduced);
            log.warn("[Lifecycle] {} exit partially filled, {} remaining", symbol, remaining.toPlainString());
            return false;
        }

        Position closed = position.close(fill.orderId(), now);
        book.remove(position);
        emitTransition(position, closed);
        metrics.updateOpenPositions(book.size());
        return true;
    }

    private void handleExitFailure(Position position, ErrorCategory category, String reason) {
        Instant now = clock.instant();
        if (category == ErrorCategory.CANCELLED) {
            log.info("[Lifecycle] {} exit interrupted, will retry: {}", position.symbol(), reason);
            return;
        }
        if (category == ErrorCategory.UNEXPECTED) {
            errorBudget.recordUnexpected("exit:" + position.symbol(), reason);
        }

        boolean terminal = category == ErrorCategory.INSUFFICIENT_FUNDS || category == ErrorCategory.INVALID_REQUEST;
        Position attempted = position.withExitAttempt(now);
        if (!terminal && attempted.exitAttempts() < config.maxExitAttempts()) {
            book.replace(position, attempted);
            log.warn("[Lifecycle] {} exit attempt {}/{} failed ({}): {}", position.symbol(),
                attempted.exitAttempts(), config.maxExitAttempts(), category, reason);
            events.emit(EventType.ORDER_FAILED, position.symbol(), COMPONENT,
                failurePayload("exit", category, reason, attempted.exitAttempts()));
            return;
        }

        Position failed = attempted.fail(now);
        book.remove(position);
        emitTransition(position, failed);
        reportFailure(failed, "exit", category, reason);
    }

    private void recordTrade(Position position, Fill fill, BigDecimal pnl) {
        TradeRecord trade = new TradeRecord(position.symbol(), position.side(), fill.quantity(),
            position.entryPrice(), fill.price(), position.entryTime(), fill.filledAt(), pnl,
            position.exitReason(), config.dryRun());
        tradeLog.add(trade);
        risk.recordRealizedPnl(position.symbol(), pnl);
        SessionStats.Snapshot snapshot = stats.record(trade);
        metrics.recordPositionClosed(position.exitReason(), pnl);
        metrics.updateWinRate(snapshot.winRate());
        log.info("[Lifecycle] CLOSED {} {} reason={} pnl={} held={}s | session: {} trades, win rate {}%, pnl {}",
            position.symbol(), position.side(), position.exitReason(), pnl.toPlainString(),
            trade.holdingTime().toSeconds(), snapshot.totalTrades(),
            String.format("%.1f", snapshot.winRate() * 100), snapshot.totalPnl().toPlainString());
    }

    // ═══════════════════════════════════════════════════════════════
    // LOCKING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Run {@code action} under the symbol lock if it is free.
     *
     * @return false if the symbol was busy and the action did not run
     */
    public boolean tryWithSymbolLock(String symbol, Runnable action) {
        ReentrantLock lock = lockFor(symbol);
        if (!lock.tryLock()) {
            return false;
        }
        try {
            action.run();
            return true;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String symbol) {
        return symbolLocks.computeIfAbsent(symbol, s -> new ReentrantLock());
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    public List<TradeRecord> tradeLog() {
        return List.copyOf(tradeLog);
    }

    public SessionStats.Snapshot sessionStats() {
        return stats.snapshot();
    }

    public List<Position> positions() {
        return book.snapshot();
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private Optional<BigDecimal> latestPrice(String symbol) {
        return store.latest(symbol).map(s -> BigDecimal.valueOf(s.price()));
    }

    private BrokerResult<Fill> simulatedFill(String symbol, Side side, BigDecimal quantity, BigDecimal price) {
        return BrokerResult.success(new Fill("dry-" + UUID.randomUUID(), symbol, side, quantity, price,
            clock.instant(), false));
    }

    private boolean swap(Position expected, Position next) {
        if (!book.replace(expected, next)) {
            log.warn("[Lifecycle] {} changed concurrently, {} -> {} dropped",
                expected.symbol(), expected.state(), next.state());
            return false;
        }
        if (expected.state() != next.state()) {
            emitTransition(expected, next);
        }
        return true;
    }

    private void emitTransition(Position before, Position after) {
        events.emit(EventType.POSITION_STATE_CHANGED, after.symbol(), COMPONENT, before, after);
    }

    private void reportFailure(Position failed, String phase, ErrorCategory category, String reason) {
        log.warn("[Lifecycle] FAILED {} during {} ({}): {}", failed.symbol(), phase, category, reason);
        metrics.recordPositionFailed(category);
        metrics.updateOpenPositions(book.size());
        events.emit(EventType.ORDER_FAILED, failed.symbol(), COMPONENT,
            failurePayload(phase, category, reason, failed.exitAttempts()));
    }

    private static Map<String, Object> failurePayload(String phase, ErrorCategory category, String reason, int attempts) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phase", phase);
        payload.put("category", category.name());
        payload.put("reason", reason);
        payload.put("attempts", attempts);
        return payload;
    }
}
