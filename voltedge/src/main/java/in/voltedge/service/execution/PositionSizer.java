package in.voltedge.service.execution;

import in.voltedge.config.ExecutionConfig;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.function.Supplier;

/**
 * Converts a signal's confidence into an order quantity.
 */
public final class PositionSizer {

    private final ExecutionConfig config;
    private final Supplier<BigDecimal> capital;

    public PositionSizer(ExecutionConfig config, Supplier<BigDecimal> capital) {
        this.config = config;
        this.capital = capital;
    }

    /**
     * value = min(capital * maxPositionFraction, capital * confidence * confidenceSizingFactor),
     * quantity = value / price rounded down.
     *
     * @return quantity, zero when price is not positive or the value rounds to nothing
     */
    public BigDecimal size(double confidence, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal cap = capital.get();
        BigDecimal maxValue = cap.multiply(BigDecimal.valueOf(config.maxPositionFraction()));
        BigDecimal confidenceValue = cap.multiply(BigDecimal.valueOf(confidence))
            .multiply(BigDecimal.valueOf(config.confidenceSizingFactor()));
        BigDecimal value = maxValue.min(confidenceValue);
        return value.divide(price, config.quantityScale(), RoundingMode.DOWN);
    }
}
