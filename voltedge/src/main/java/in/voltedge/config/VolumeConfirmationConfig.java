package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VolumeConfirmationConfig(
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("thresholdMultiplier") double thresholdMultiplier,   // ratio needed to confirm
    @JsonProperty("period") int period,                                // rolling average window
    @JsonProperty("requireSpike") boolean requireSpike,
    @JsonProperty("spikeThreshold") double spikeThreshold,
    @JsonProperty("minPercentile") double minPercentile
) {
    public static VolumeConfirmationConfig defaults() {
        return new VolumeConfirmationConfig(true, 1.5, 20, true, 2.0, 0.3);
    }

    public void validate() {
        if (period < 2) {
            throw new ConfigurationException("volume.period must be >= 2");
        }
        if (thresholdMultiplier <= 0 || spikeThreshold <= 0) {
            throw new ConfigurationException("volume multipliers must be positive");
        }
    }
}
