package in.voltedge.domain.signal;

import in.voltedge.domain.market.Timeframe;

import java.time.Instant;

/**
 * Oscillator reading for one (symbol, timeframe) pair.
 *
 * @param signal -1 sell, 0 none, +1 buy
 * @param strength normalized distance past the oversold/overbought threshold, in [0,1]
 */
public record TimeframeSignal(
    Timeframe timeframe,
    int signal,
    double strength,
    double oscillatorK,
    double oscillatorD,
    Instant timestamp
) {
    public TimeframeSignal {
        if (signal < -1 || signal > 1) {
            throw new IllegalArgumentException("Timeframe signal must be -1, 0 or 1: " + signal);
        }
        if (strength < 0.0 || strength > 1.0) {
            throw new IllegalArgumentException("Timeframe strength must be in [0,1]: " + strength);
        }
    }

    public static TimeframeSignal none(Timeframe timeframe, double k, double d, Instant timestamp) {
        return new TimeframeSignal(timeframe, 0, 0.0, k, d, timestamp);
    }

    public static TimeframeSignal of(Timeframe timeframe, int signal, double strength) {
        return new TimeframeSignal(timeframe, signal, strength, Double.NaN, Double.NaN, Instant.now());
    }
}
