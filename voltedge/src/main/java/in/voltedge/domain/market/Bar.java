package in.voltedge.domain.market;

import java.time.Instant;

/**
 * OHLCV bar as returned by the broker for one timeframe.
 */
public record Bar(
    Instant timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {}
