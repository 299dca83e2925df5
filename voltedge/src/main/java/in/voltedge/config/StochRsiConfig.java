package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Stochastic-over-RSI oscillator settings, shared by every timeframe.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StochRsiConfig(
    @JsonProperty("rsiPeriod") int rsiPeriod,
    @JsonProperty("stochPeriod") int stochPeriod,
    @JsonProperty("kSmoothing") int kSmoothing,
    @JsonProperty("dSmoothing") int dSmoothing,
    @JsonProperty("oversold") double oversold,
    @JsonProperty("overbought") double overbought,
    @JsonProperty("barLimit") int barLimit          // Bars fetched per timeframe refresh
) {
    public static StochRsiConfig defaults() {
        return new StochRsiConfig(14, 14, 3, 3, 20.0, 80.0, 100);
    }

    public void validate() {
        if (rsiPeriod < 2 || stochPeriod < 1 || kSmoothing < 1 || dSmoothing < 1) {
            throw new ConfigurationException("stochRsi periods must be positive (rsiPeriod >= 2)");
        }
        if (oversold <= 0 || overbought >= 100 || oversold >= overbought) {
            throw new ConfigurationException("stochRsi requires 0 < oversold < overbought < 100");
        }
        if (barLimit < rsiPeriod + stochPeriod) {
            throw new ConfigurationException("stochRsi.barLimit must cover rsiPeriod + stochPeriod");
        }
    }
}
