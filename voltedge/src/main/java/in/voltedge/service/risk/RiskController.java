package in.voltedge.service.risk;

import in.voltedge.config.RiskConfig;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.trade.Position;
import in.voltedge.infrastructure.metrics.EngineMetrics;
import in.voltedge.service.core.EventService;
import in.voltedge.service.execution.PositionBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admission control and daily loss accounting.
 *
 * Admission and reservation happen under one lock, so two entries cannot both pass the
 * position-count or same-symbol check.
 */
public final class RiskController {
    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskConfig config;
    private final BigDecimal dailyLossLimit;
    private final PositionBook book;
    private final EventService events;
    private final EngineMetrics metrics;
    private final Clock clock;

    private BigDecimal currentDailyLoss = BigDecimal.ZERO;
    private Instant lastReset;

    public RiskController(RiskConfig config, BigDecimal capital, PositionBook book,
                          EventService events, EngineMetrics metrics, Clock clock) {
        this.config = config;
        this.dailyLossLimit = capital.multiply(BigDecimal.valueOf(config.dailyLossLimitFraction()))
            .setScale(2, RoundingMode.HALF_UP);
        this.book = book;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
        this.lastReset = clock.instant();
    }

    /**
     * Outcome of an admission attempt. {@code reservation} is set only when admitted.
     */
    public record Admission(boolean admitted, RejectReason reason, Position reservation) {
        static Admission rejected(RejectReason reason) {
            return new Admission(false, reason, null);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // ADMISSION
    // ═══════════════════════════════════════════════════════════════

    /**
     * Check every limit and, if all pass, reserve the symbol in the position book.
     */
    public Admission tryAdmitAndReserve(Signal signal, BigDecimal quantity) {
        Admission admission;
        synchronized (this) {
            admission = admit(signal, quantity);
        }
        if (!admission.admitted()) {
            reject(signal.symbol(), admission.reason(), signal.confidence());
        }
        return admission;
    }

    private Admission admit(Signal signal, BigDecimal quantity) {
        if (currentDailyLoss.compareTo(dailyLossLimit) >= 0) {
            return Admission.rejected(RejectReason.DAILY_LOSS_LIMIT);
        }
        if (book.size() >= config.maxConcurrentPositions()) {
            return Admission.rejected(RejectReason.MAX_POSITIONS);
        }
        Position reservation = Position.reserve(signal.symbol(), signal.action().entrySide(), quantity,
            signal.targetProfit(), signal.stopLoss(), clock.instant());
        if (!book.reserve(reservation)) {
            return Admission.rejected(RejectReason.POSITION_EXISTS);
        }
        return new Admission(true, null, reservation);
    }

    /**
     * Record an entry refused before admission (volume, timeframe or sizing gates).
     */
    public void reject(String symbol, RejectReason reason, double confidence) {
        log.info("[RiskController] Entry rejected for {}: {} (confidence {})",
            symbol, reason, String.format("%.2f", confidence));
        metrics.recordEntryRejected(reason.name());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason.name());
        payload.put("confidence", confidence);
        events.emit(EventType.ENTRY_REJECTED, symbol, "risk", payload);
    }

    // ═══════════════════════════════════════════════════════════════
    // LOSS ACCOUNTING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Losses add to the daily total; gains never reduce it.
     */
    public void recordRealizedPnl(String symbol, BigDecimal pnl) {
        if (pnl.signum() >= 0) {
            return;
        }
        BigDecimal total;
        synchronized (this) {
            currentDailyLoss = currentDailyLoss.add(pnl.abs());
            total = currentDailyLoss;
        }
        metrics.updateDailyLoss(total);
        if (total.compareTo(dailyLossLimit) >= 0) {
            log.warn("[RiskController] Daily loss limit reached: {} >= {} (last loss on {})",
                total.toPlainString(), dailyLossLimit.toPlainString(), symbol);
        }
    }

    /**
     * Reset the daily loss at the configured boundary.
     */
    public void resetDaily() {
        BigDecimal before;
        synchronized (this) {
            before = currentDailyLoss;
            currentDailyLoss = BigDecimal.ZERO;
            lastReset = clock.instant();
        }
        metrics.updateDailyLoss(BigDecimal.ZERO);
        log.info("[RiskController] Daily loss reset (was {})", before.toPlainString());
        events.emit(EventType.DAILY_LOSS_RESET, null, "risk",
            Map.of("currentDailyLoss", before), Map.of("currentDailyLoss", BigDecimal.ZERO));
    }

    public synchronized RiskState snapshot() {
        return new RiskState(currentDailyLoss, dailyLossLimit, book.size(),
            config.maxConcurrentPositions(), lastReset);
    }

    public BigDecimal getDailyLossLimit() {
        return dailyLossLimit;
    }

    /**
     * Next occurrence of {@code time} in {@code zone} strictly after {@code now}.
     */
    public static Instant nextBoundary(Instant now, LocalTime time, ZoneId zone) {
        ZonedDateTime local = now.atZone(zone);
        ZonedDateTime candidate = local.toLocalDate().atTime(time).atZone(zone);
        if (!candidate.toInstant().isAfter(now)) {
            candidate = local.toLocalDate().plusDays(1).atTime(time).atZone(zone);
        }
        return candidate.toInstant();
    }
}
