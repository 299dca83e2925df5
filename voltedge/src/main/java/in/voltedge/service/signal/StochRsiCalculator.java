package in.voltedge.service.signal;

import in.voltedge.config.StochRsiConfig;
import in.voltedge.domain.market.Bar;
import in.voltedge.domain.market.Timeframe;
import in.voltedge.domain.signal.TimeframeSignal;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Stochastic oscillator over RSI, producing one {@link TimeframeSignal} per timeframe.
 *
 * RSI uses Wilder smoothing: an adjusted exponential mean with alpha = 1/period, valid from the
 * period-th close. %K is the position of RSI inside its rolling high/low (50 on a flat range),
 * smoothed by a simple mean; %D is the mean of %K. Values that cannot be computed yet are NaN.
 */
public final class StochRsiCalculator {

    private final StochRsiConfig config;

    public StochRsiCalculator(StochRsiConfig config) {
        this.config = config;
    }

    /**
     * Full RSI / %K / %D series, aligned with {@code closes}.
     */
    public record Series(double[] rsi, double[] k, double[] d) {
        public double lastK() {
            return k.length == 0 ? Double.NaN : k[k.length - 1];
        }

        public double lastD() {
            return d.length == 0 ? Double.NaN : d[d.length - 1];
        }
    }

    public Series compute(double[] closes) {
        double[] rsi = rsi(closes, config.rsiPeriod());
        double[] rawK = stochastic(rsi, config.stochPeriod());
        double[] k = rollingMean(rawK, config.kSmoothing());
        double[] d = rollingMean(k, config.dSmoothing());
        return new Series(rsi, k, d);
    }

    /**
     * Latest crossover signal for a timeframe.
     *
     * Zero signal (not an error) when there is less history than max(rsiPeriod, stochPeriod)
     * or when %K/%D cannot be computed yet.
     */
    public TimeframeSignal signal(Timeframe timeframe, List<Bar> bars, Instant now) {
        double[] closes = new double[bars.size()];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = bars.get(i).close();
        }
        return signal(timeframe, closes, now);
    }

    public TimeframeSignal signal(Timeframe timeframe, double[] closes, Instant now) {
        if (closes.length < Math.max(config.rsiPeriod(), config.stochPeriod())) {
            return TimeframeSignal.none(timeframe, Double.NaN, Double.NaN, now);
        }
        Series s = compute(closes);
        int last = closes.length - 1;
        double k = s.k()[last];
        double d = s.d()[last];
        if (last < 1 || Double.isNaN(k) || Double.isNaN(d)) {
            return TimeframeSignal.none(timeframe, k, d, now);
        }
        double prevK = s.k()[last - 1];
        double prevD = s.d()[last - 1];

        // NaN comparisons are false, so a missing previous value never produces a crossover
        if (prevK <= prevD && k > d && k < config.oversold()) {
            double strength = clamp((config.oversold() - k) / config.oversold());
            return new TimeframeSignal(timeframe, 1, strength, k, d, now);
        }
        if (prevK >= prevD && k < d && k > config.overbought()) {
            double strength = clamp((k - config.overbought()) / (100.0 - config.overbought()));
            return new TimeframeSignal(timeframe, -1, strength, k, d, now);
        }
        return TimeframeSignal.none(timeframe, k, d, now);
    }

    // ═══════════════════════════════════════════════════════════════
    // SERIES MATH
    // ═══════════════════════════════════════════════════════════════

    static double[] rsi(double[] closes, int period) {
        int n = closes.length;
        double[] out = nanArray(n);
        if (n == 0) {
            return out;
        }
        double alpha = 1.0 / period;
        double decay = 1.0 - alpha;

        // Adjusted EWM: weighted sums with weights (1-alpha)^i, normalized by the weight total
        double gainNum = 0.0;
        double lossNum = 0.0;
        double den = 0.0;
        for (int i = 0; i < n; i++) {
            double delta = i == 0 ? 0.0 : closes[i] - closes[i - 1];
            double gain = delta > 0 ? delta : 0.0;
            double loss = delta < 0 ? -delta : 0.0;
            gainNum = gainNum * decay + gain;
            lossNum = lossNum * decay + loss;
            den = den * decay + 1.0;
            if (i + 1 < period) {
                continue;
            }
            double avgGain = gainNum / den;
            double avgLoss = lossNum / den;
            if (avgLoss == 0.0) {
                out[i] = avgGain == 0.0 ? 50.0 : 100.0;
            } else {
                double rs = avgGain / avgLoss;
                out[i] = 100.0 - 100.0 / (1.0 + rs);
            }
        }
        return out;
    }

    static double[] stochastic(double[] rsi, int length) {
        int n = rsi.length;
        double[] out = nanArray(n);
        for (int i = length - 1; i < n; i++) {
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            boolean complete = true;
            for (int j = i - length + 1; j <= i; j++) {
                if (Double.isNaN(rsi[j])) {
                    complete = false;
                    break;
                }
                lo = Math.min(lo, rsi[j]);
                hi = Math.max(hi, rsi[j]);
            }
            if (!complete) {
                continue;
            }
            double range = hi - lo;
            out[i] = range != 0.0 ? (rsi[i] - lo) / range * 100.0 : 50.0;
        }
        return out;
    }

    /**
     * Trailing mean over up to {@code window} values, ignoring NaN; NaN when the window has none.
     */
    static double[] rollingMean(double[] values, int window) {
        int n = values.length;
        double[] out = nanArray(n);
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            int count = 0;
            for (int j = Math.max(0, i - window + 1); j <= i; j++) {
                if (!Double.isNaN(values[j])) {
                    sum += values[j];
                    count++;
                }
            }
            if (count > 0) {
                out[i] = sum / count;
            }
        }
        return out;
    }

    private static double[] nanArray(int n) {
        double[] a = new double[n];
        Arrays.fill(a, Double.NaN);
        return a;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
