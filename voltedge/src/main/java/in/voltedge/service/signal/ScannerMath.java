package in.voltedge.service.signal;

/**
 * Rolling-window statistics used by the scanner.
 *
 * Pure functions over the tail of a price/volume array. Degenerate inputs return neutral values
 * instead of throwing.
 */
public final class ScannerMath {

    /**
     * Population stdev of log returns over the last {@code window} prices, scaled by
     * sqrt({@code annualizationPeriods}). Returns 0 for fewer than {@code window} prices or a flat series.
     */
    public static double volatility(double[] prices, int window, double annualizationPeriods) {
        if (prices.length < window || window < 2) {
            return 0.0;
        }
        int start = prices.length - window;
        int n = window - 1;
        double[] returns = new double[n];
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            returns[i] = Math.log(prices[start + i + 1]) - Math.log(prices[start + i]);
            sum += returns[i];
        }
        double mean = sum / n;
        double sq = 0.0;
        for (double r : returns) {
            double d = r - mean;
            sq += d * d;
        }
        double std = Math.sqrt(sq / n);
        if (std == 0.0 || Double.isNaN(std)) {
            return 0.0;
        }
        return std * Math.sqrt(annualizationPeriods);
    }

    /**
     * RSI-style ratio avgGain / (avgGain + avgLoss) over the last {@code period} deltas.
     *
     * 0.5 when there are not enough prices or nothing moved, 1.0 when there were only gains.
     */
    public static double momentum(double[] prices, int period) {
        if (prices.length < period + 1) {
            return 0.5;
        }
        int start = prices.length - period - 1;
        double gains = 0.0;
        double losses = 0.0;
        for (int i = start + 1; i < prices.length; i++) {
            double change = prices[i] - prices[i - 1];
            if (change > 0) {
                gains += change;
            } else if (change < 0) {
                losses -= change;
            }
        }
        double avgGain = gains / period;
        double avgLoss = losses / period;
        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 0.5 : 1.0;
        }
        double rs = avgGain / avgLoss;
        return rs / (1.0 + rs);
    }

    /**
     * Current volume above {@code multiplier} x mean of the {@code lookback} samples before it.
     */
    public static boolean volumeSurge(double[] volumes, int lookback, double multiplier) {
        if (volumes.length < lookback + 1) {
            return false;
        }
        double sum = 0.0;
        for (int i = volumes.length - lookback - 1; i < volumes.length - 1; i++) {
            sum += volumes[i];
        }
        double avg = sum / lookback;
        return volumes[volumes.length - 1] > avg * multiplier;
    }

    private ScannerMath() {}
}
