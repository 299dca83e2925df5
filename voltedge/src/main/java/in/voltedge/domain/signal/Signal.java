package in.voltedge.domain.signal;

import java.time.Instant;

/**
 * Candidate trade emitted by the scanner.
 *
 * Never mutated after creation; filters either pass it through or drop it.
 * {@code targetProfit} and {@code stopLoss} are fractions of the entry price (0.005 = 0.5%).
 */
public record Signal(
    String symbol,
    SignalAction action,
    double confidence,
    double price,
    double volatility,
    double momentum,
    boolean volumeSurge,
    double targetProfit,
    double stopLoss,
    Instant timestamp
) {
    public Signal {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Signal symbol is required");
        }
        if (action == null) {
            throw new IllegalArgumentException("Signal action is required");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Signal confidence must be in [0,1]: " + confidence);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Signal timestamp is required");
        }
    }
}
