package in.voltedge.service.execution;

import in.voltedge.broker.BrokerGateway;
import in.voltedge.broker.BrokerResult;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.order.BrokerPosition;
import in.voltedge.domain.trade.ExitReason;
import in.voltedge.domain.trade.Position;
import in.voltedge.domain.trade.PositionState;
import in.voltedge.service.core.EventService;
import in.voltedge.service.market.SymbolUniverse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compares OPEN positions with what the broker reports and repairs drift.
 *
 * <ul>
 *   <li>Broker has it, we don't: adopt as OPEN with default target and stop</li>
 *   <li>We have it, broker doesn't: close locally once it has been missing for the grace period</li>
 *   <li>Quantities differ: take the broker's quantity</li>
 * </ul>
 * Positions with an order in flight (NEW, EXIT_REQUESTED or symbol lock held) are left alone.
 */
public final class PositionReconciler {
    private static final Logger log = LoggerFactory.getLogger(PositionReconciler.class);

    static final double ADOPTED_TARGET_PROFIT = 0.005;
    static final double ADOPTED_STOP_LOSS = 0.003;

    private final BrokerGateway gateway;
    private final PositionBook book;
    private final PositionLifecycleManager manager;
    private final EventService events;
    private final boolean dryRun;
    private final Duration missingGrace;
    private final Clock clock;

    private final Map<String, Instant> missingSince = new ConcurrentHashMap<>();

    public record Drift(String kind, BigDecimal localQuantity, BigDecimal remoteQuantity, Position position) {}

    public record ReconciliationResult(int adopted, int removed, int corrected) {
        static final ReconciliationResult NONE = new ReconciliationResult(0, 0, 0);

        public boolean hasDrift() {
            return adopted + removed + corrected > 0;
        }
    }

    public PositionReconciler(BrokerGateway gateway, PositionBook book, PositionLifecycleManager manager,
                              EventService events, boolean dryRun, Duration missingGrace, Clock clock) {
        this.gateway = gateway;
        this.book = book;
        this.manager = manager;
        this.events = events;
        this.dryRun = dryRun;
        this.missingGrace = missingGrace;
        this.clock = clock;
    }

    public ReconciliationResult reconcile() {
        if (dryRun) {
            return ReconciliationResult.NONE;
        }
        BrokerResult<List<BrokerPosition>> remote = gateway.listPositions();
        if (!remote.isSuccess()) {
            log.warn("[Reconciler] Cannot list broker positions ({}): {}", remote.error(), remote.reason());
            return ReconciliationResult.NONE;
        }

        Map<String, BrokerPosition> bySymbol = new HashMap<>();
        for (BrokerPosition bp : remote.value()) {
            if (bp.quantity() != null && bp.quantity().signum() > 0) {
                bySymbol.put(SymbolUniverse.normalize(bp.symbol()), bp);
            }
        }

        int[] counts = new int[3];
        Instant now = clock.instant();

        for (BrokerPosition bp : bySymbol.values()) {
            String symbol = SymbolUniverse.normalize(bp.symbol());
            if (book.contains(symbol)) {
                continue;
            }
            manager.tryWithSymbolLock(symbol, () -> {
                Position adopted = Position.adopt(symbol, bp.side(), bp.quantity(), bp.averageEntryPrice(),
                    ADOPTED_TARGET_PROFIT, ADOPTED_STOP_LOSS, now);
                if (book.adopt(adopted)) {
                    counts[0]++;
                    drift(symbol, "MISSING_LOCAL", null, bp.quantity(), null, adopted);
                }
            });
        }

        for (Position local : book.inState(PositionState.OPEN)) {
            String symbol = local.symbol();
            BrokerPosition bp = bySymbol.get(symbol);
            if (bp != null) {
                missingSince.remove(symbol);
                if (bp.quantity().compareTo(local.quantity()) != 0) {
                    manager.tryWithSymbolLock(symbol, () -> {
                        Optional<Position> current = book.get(symbol);
                        if (current.isPresent() && current.get().state() == PositionState.OPEN) {
                            Position corrected = current.get().withQuantity(bp.quantity(), now);
                            if (book.replace(current.get(), corrected)) {
                                counts[2]++;
                                drift(symbol, "QUANTITY_MISMATCH", current.get().quantity(), bp.quantity(),
                                    current.get(), corrected);
                            }
                        }
                    });
                }
                continue;
            }

            Instant since = missingSince.computeIfAbsent(symbol, s -> now);
            if (Duration.between(since, now).compareTo(missingGrace) < 0) {
                continue;
            }
            manager.tryWithSymbolLock(symbol, () -> {
                Optional<Position> current = book.get(symbol);
                if (current.isPresent() && current.get().state() == PositionState.OPEN) {
                    Position closed = current.get().requestExit(ExitReason.RECONCILED, now).close(null, now);
                    if (book.remove(current.get())) {
                        counts[1]++;
                        missingSince.remove(symbol);
                        drift(symbol, "MISSING_REMOTE", current.get().quantity(), BigDecimal.ZERO,
                            current.get(), closed);
                    }
                }
            });
        }
        missingSince.keySet().retainAll(book.snapshot().stream().map(Position::symbol).toList());

        ReconciliationResult result = new ReconciliationResult(counts[0], counts[1], counts[2]);
        if (result.hasDrift()) {
            log.warn("[Reconciler] Drift repaired: adopted={} removed={} corrected={}",
                result.adopted(), result.removed(), result.corrected());
        }
        return result;
    }

    private void drift(String symbol, String kind, BigDecimal local, BigDecimal remote, Position before, Position after) {
        events.emit(EventType.RECONCILIATION_DRIFT, symbol, "reconciler", before,
            new Drift(kind, local, remote, after));
        log.warn("[Reconciler] {} {}: local={} broker={}", symbol, kind,
            local == null ? "-" : local.toPlainString(), remote == null ? "-" : remote.toPlainString());
    }
}
