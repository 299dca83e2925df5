package in.voltedge.domain.trade;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Position owned by the lifecycle manager.
 *
 * Immutable: every transition returns a new instance, which the manager swaps into the live set.
 * {@code targetProfit} and {@code stopLoss} are the fractions carried over from the entry signal.
 */
public record Position(
    String symbol,
    Side side,
    BigDecimal quantity,
    BigDecimal entryPrice,
    Instant entryTime,
    BigDecimal targetPrice,
    BigDecimal stopPrice,
    String orderId,
    PositionState state,
    double targetProfit,
    double stopLoss,
    boolean trailingActive,
    ExitReason exitReason,
    int exitAttempts,
    Instant updatedAt
) {
    private static final int PRICE_SCALE = 8;

    /**
     * Reservation created at admission, before any order exists.
     */
    public static Position reserve(String symbol, Side side, BigDecimal quantity,
                                   double targetProfit, double stopLoss, Instant now) {
        return new Position(symbol, side, quantity, null, null, null, null, null,
            PositionState.NEW, targetProfit, stopLoss, false, null, 0, now);
    }

    /**
     * Position found at the broker that was not tracked locally.
     */
    public static Position adopt(String symbol, Side side, BigDecimal quantity, BigDecimal entryPrice,
                                 double targetProfit, double stopLoss, Instant now) {
        return new Position(symbol, side, quantity, entryPrice, now,
            targetPriceFor(side, entryPrice, targetProfit),
            stopPriceFor(side, entryPrice, stopLoss),
            null, PositionState.OPEN, targetProfit, stopLoss, false, null, 0, now);
    }

    // ═══════════════════════════════════════════════════════════════
    // TRANSITIONS
    // ═══════════════════════════════════════════════════════════════

    public Position open(BigDecimal filledQuantity, BigDecimal fillPrice, Instant fillTime, String entryOrderId) {
        requireTransition(PositionState.OPEN);
        return new Position(symbol, side, filledQuantity, fillPrice, fillTime,
            targetPriceFor(side, fillPrice, targetProfit),
            stopPriceFor(side, fillPrice, stopLoss),
            entryOrderId, PositionState.OPEN, targetProfit, stopLoss, false, null, 0, fillTime);
    }

    public Position requestExit(ExitReason reason, Instant now) {
        requireTransition(PositionState.EXIT_REQUESTED);
        return new Position(symbol, side, quantity, entryPrice, entryTime, targetPrice, stopPrice,
            orderId, PositionState.EXIT_REQUESTED, targetProfit, stopLoss, trailingActive, reason, 0, now);
    }

    public Position close(String exitOrderId, Instant now) {
        requireTransition(PositionState.CLOSED);
        return new Position(symbol, side, quantity, entryPrice, entryTime, targetPrice, stopPrice,
            exitOrderId, PositionState.CLOSED, targetProfit, stopLoss, trailingActive, exitReason, exitAttempts, now);
    }

    public Position fail(Instant now) {
        requireTransition(PositionState.FAILED);
        return new Position(symbol, side, quantity, entryPrice, entryTime, targetPrice, stopPrice,
            orderId, PositionState.FAILED, targetProfit, stopLoss, trailingActive, exitReason, exitAttempts, now);
    }

    /**
     * Records a failed exit attempt while staying in EXIT_REQUESTED.
     */
    public Position withExitAttempt(Instant now) {
        if (state != PositionState.EXIT_REQUESTED) {
            throw new IllegalStateException("Exit attempts only apply in EXIT_REQUESTED, was " + state);
        }
        return new Position(symbol, side, quantity, entryPrice, entryTime, targetPrice, stopPrice,
            orderId, state, targetProfit, stopLoss, trailingActive, exitReason, exitAttempts + 1, now);
    }

    public Position withStopPrice(BigDecimal newStop, Instant now) {
        return new Position(symbol, side, quantity, entryPrice, entryTime, targetPrice, newStop,
            orderId, state, targetProfit, stopLoss, true, exitReason, exitAttempts, now);
    }

    public Position withQuantity(BigDecimal newQuantity, Instant now) {
        return new Position(symbol, side, newQuantity, entryPrice, entryTime, targetPrice, stopPrice,
            orderId, state, targetProfit, stopLoss, trailingActive, exitReason, exitAttempts, now);
    }

    // ═══════════════════════════════════════════════════════════════
    // P&L
    // ═══════════════════════════════════════════════════════════════

    /**
     * Unrealized gain as a fraction of entry price, positive when the position is in profit.
     */
    public double unrealizedReturn(BigDecimal price) {
        if (entryPrice == null || entryPrice.signum() == 0) {
            return 0.0;
        }
        BigDecimal move = side == Side.BUY ? price.subtract(entryPrice) : entryPrice.subtract(price);
        return move.divide(entryPrice, 10, RoundingMode.HALF_UP).doubleValue();
    }

    public BigDecimal realizedPnl(BigDecimal exitPrice, BigDecimal exitQuantity) {
        BigDecimal move = side == Side.BUY ? exitPrice.subtract(entryPrice) : entryPrice.subtract(exitPrice);
        return move.multiply(exitQuantity);
    }

    private void requireTransition(PositionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Illegal position transition for %s: %s -> %s", symbol, state, next));
        }
    }

    static BigDecimal targetPriceFor(Side side, BigDecimal entry, double fraction) {
        BigDecimal f = BigDecimal.valueOf(fraction);
        BigDecimal factor = side == Side.BUY ? BigDecimal.ONE.add(f) : BigDecimal.ONE.subtract(f);
        return entry.multiply(factor).setScale(PRICE_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
    }

    static BigDecimal stopPriceFor(Side side, BigDecimal entry, double fraction) {
        BigDecimal f = BigDecimal.valueOf(fraction);
        BigDecimal factor = side == Side.BUY ? BigDecimal.ONE.subtract(f) : BigDecimal.ONE.add(f);
        return entry.multiply(factor).setScale(PRICE_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();
    }
}
