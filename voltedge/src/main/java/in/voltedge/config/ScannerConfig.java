package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rolling-window scanner settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScannerConfig(
    @JsonProperty("bufferCapacity")
    int bufferCapacity,             // Samples kept per symbol

    @JsonProperty("volatilityWindow")
    int volatilityWindow,           // Prices used for log-return stdev

    @JsonProperty("annualizationPeriods")
    double annualizationPeriods,    // Volatility scaled by sqrt of this

    @JsonProperty("momentumPeriod")
    int momentumPeriod,             // Deltas used for the RSI-style ratio

    @JsonProperty("surgeLookback")
    int surgeLookback,              // Preceding samples averaged for the surge check

    @JsonProperty("surgeMultiplier")
    double surgeMultiplier,         // Current volume must exceed mean x this

    @JsonProperty("highVolatilityThreshold")
    double highVolatilityThreshold,

    @JsonProperty("minVolatility")
    double minVolatility,           // Medium tier floor

    @JsonProperty("minConfidence")
    double minConfidence,           // Signals below are suppressed

    @JsonProperty("maxSignals")
    int maxSignals                  // Ranked signals kept per scan
) {
    public static ScannerConfig defaults() {
        return new ScannerConfig(1000, 20, 1440.0, 14, 10, 1.5, 0.05, 0.02, 0.4, 10);
    }

    public void validate() {
        if (bufferCapacity < volatilityWindow || volatilityWindow < 2) {
            throw new ConfigurationException("scanner.bufferCapacity must be >= volatilityWindow >= 2");
        }
        if (momentumPeriod < 1 || surgeLookback < 1) {
            throw new ConfigurationException("scanner.momentumPeriod and surgeLookback must be positive");
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new ConfigurationException("scanner.minConfidence must be in [0,1]");
        }
        if (maxSignals < 1) {
            throw new ConfigurationException("scanner.maxSignals must be positive");
        }
    }
}
