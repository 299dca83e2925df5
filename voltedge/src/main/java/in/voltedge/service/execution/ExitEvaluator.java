package in.voltedge.service.execution;

import in.voltedge.config.ExecutionConfig;
import in.voltedge.config.TrailingStopsConfig;
import in.voltedge.domain.trade.ExitReason;
import in.voltedge.domain.trade.Position;
import in.voltedge.domain.trade.Side;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Exit rules for an OPEN position, checked in priority order: profit target, stop (fixed or
 * trailing), holding time, volatility collapse while underwater.
 */
public final class ExitEvaluator {

    private final ExecutionConfig execution;
    private final TrailingStopsConfig trailing;

    public ExitEvaluator(ExecutionConfig execution, TrailingStopsConfig trailing) {
        this.execution = execution;
        this.trailing = trailing;
    }

    /**
     * Stop price after trailing, or empty when the stop stays where it is.
     * The result is always tighter than the current stop.
     */
    public Optional<BigDecimal> tightenedStop(Position position, BigDecimal price) {
        if (!trailing.enabled() || position.entryPrice() == null) {
            return Optional.empty();
        }
        if (position.unrealizedReturn(price) < trailing.activationFraction()) {
            return Optional.empty();
        }
        BigDecimal distance = BigDecimal.valueOf(trailing.trailingFraction());
        BigDecimal candidate = position.side() == Side.BUY
            ? price.multiply(BigDecimal.ONE.subtract(distance))
            : price.multiply(BigDecimal.ONE.add(distance));
        candidate = candidate.setScale(8, RoundingMode.HALF_UP).stripTrailingZeros();

        BigDecimal current = position.stopPrice();
        boolean tighter = position.side() == Side.BUY
            ? candidate.compareTo(current) > 0
            : candidate.compareTo(current) < 0;
        return tighter ? Optional.of(candidate) : Optional.empty();
    }

    /**
     * @param volatility current annualized volatility, NaN when it cannot be computed
     */
    public Optional<ExitReason> evaluate(Position position, BigDecimal price, double volatility, Instant now) {
        boolean buy = position.side() == Side.BUY;

        int vsTarget = price.compareTo(position.targetPrice());
        if (buy ? vsTarget >= 0 : vsTarget <= 0) {
            return Optional.of(ExitReason.PROFIT_TARGET);
        }

        int vsStop = price.compareTo(position.stopPrice());
        if (buy ? vsStop <= 0 : vsStop >= 0) {
            return Optional.of(position.trailingActive() ? ExitReason.TRAILING_STOP : ExitReason.STOP_LOSS);
        }

        Duration held = Duration.between(position.entryTime(), now);
        if (held.compareTo(execution.maxHoldingTime()) >= 0) {
            return Optional.of(ExitReason.TIME_LIMIT);
        }

        if (!Double.isNaN(volatility)
                && volatility < execution.volatilityFloor()
                && position.unrealizedReturn(price) < 0) {
            return Optional.of(ExitReason.VOLATILITY_COLLAPSE);
        }
        return Optional.empty();
    }
}
