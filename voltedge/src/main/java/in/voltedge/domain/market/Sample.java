package in.voltedge.domain.market;

import java.time.Instant;

/**
 * One observed (price, volume) point for a symbol. Immutable once stored.
 */
public record Sample(
    String symbol,
    double price,
    double volume,
    Instant timestamp
) {
    public Sample {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Sample symbol is required");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("Sample timestamp is required");
        }
    }
}
