package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Trailing stop settings.
 *
 * Once unrealized gain exceeds the activation percent, the stop follows price at the trailing
 * distance. It only ever tightens.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrailingStopsConfig(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("activationPercent")
    double activationPercent,      // % profit before trailing activates (1.0 = 1%)

    @JsonProperty("trailingPercent")
    double trailingPercent         // % distance behind price (0.5 = 0.5%)
) {
    public static TrailingStopsConfig defaults() {
        return new TrailingStopsConfig(true, 1.0, 0.5);
    }

    public double activationFraction() {
        return activationPercent / 100.0;
    }

    public double trailingFraction() {
        return trailingPercent / 100.0;
    }

    public void validate() {
        if (activationPercent <= 0 || trailingPercent <= 0) {
            throw new ConfigurationException("trailingStops percents must be positive");
        }
    }
}
