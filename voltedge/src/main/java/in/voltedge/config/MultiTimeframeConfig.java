package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.voltedge.domain.market.Timeframe;

import java.util.ArrayList;
import java.util.List;

/**
 * Multi-timeframe validation settings.
 *
 * The resolution thresholds and confidences are tuning constants, not invariants.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MultiTimeframeConfig(
    @JsonProperty("enabled")
    boolean enabled,

    @JsonProperty("primary")
    Timeframe primary,

    @JsonProperty("confirmations")
    List<Timeframe> confirmations,

    @JsonProperty("timeframes")
    List<TimeframeSetting> timeframes,

    @JsonProperty("minConfirmationRatio")
    double minConfirmationRatio,        // 0.6 = 60% of confirmations must agree

    @JsonProperty("alignmentRequired")
    boolean alignmentRequired,

    @JsonProperty("consensusThreshold")
    double consensusThreshold,          // |weighted score| needed for a consensus sign

    @JsonProperty("weightedResolutionThreshold")
    double weightedResolutionThreshold,

    @JsonProperty("priorityStrengthThreshold")
    double priorityStrengthThreshold,

    @JsonProperty("primaryOverrideConfidence")
    double primaryOverrideConfidence,

    @JsonProperty("weightedConfidenceCap")
    double weightedConfidenceCap,

    @JsonProperty("priorityConfidence")
    double priorityConfidence,

    @JsonProperty("defaultWeight")
    double defaultWeight,               // Used for conflict weighting of unlisted timeframes

    @JsonProperty("defaultDecay")
    double defaultDecay
) {
    public MultiTimeframeConfig {
        confirmations = confirmations == null ? List.of() : List.copyOf(confirmations);
        timeframes = timeframes == null ? List.of() : List.copyOf(timeframes);
    }

    public static MultiTimeframeConfig defaults() {
        return new MultiTimeframeConfig(
            true,
            Timeframe.FIVE_MIN,
            List.of(Timeframe.FIFTEEN_MIN, Timeframe.ONE_HOUR),
            List.of(
                new TimeframeSetting(Timeframe.ONE_MIN, 0.10, 0.95),
                new TimeframeSetting(Timeframe.FIVE_MIN, 0.30, 0.85),
                new TimeframeSetting(Timeframe.FIFTEEN_MIN, 0.35, 0.75),
                new TimeframeSetting(Timeframe.ONE_HOUR, 0.25, 0.65)
            ),
            0.6, true, 0.1, 0.2, 0.3, 0.7, 0.9, 0.6, 0.1, 0.8
        );
    }

    public MultiTimeframeConfig withAlignmentRequired(boolean required) {
        return new MultiTimeframeConfig(enabled, primary, confirmations, timeframes, minConfirmationRatio,
            required, consensusThreshold, weightedResolutionThreshold, priorityStrengthThreshold,
            primaryOverrideConfidence, weightedConfidenceCap, priorityConfidence, defaultWeight, defaultDecay);
    }

    public double weightOf(Timeframe timeframe) {
        return setting(timeframe) != null ? setting(timeframe).weight() : 0.0;
    }

    public double conflictWeightOf(Timeframe timeframe) {
        return setting(timeframe) != null ? setting(timeframe).weight() : defaultWeight;
    }

    public double decayOf(Timeframe timeframe) {
        return setting(timeframe) != null ? setting(timeframe).decay() : defaultDecay;
    }

    /**
     * Primary first, then confirmations, in configured order.
     */
    public List<Timeframe> activeTimeframes() {
        List<Timeframe> all = new ArrayList<>();
        all.add(primary);
        for (Timeframe tf : confirmations) {
            if (!all.contains(tf)) {
                all.add(tf);
            }
        }
        return all;
    }

    private TimeframeSetting setting(Timeframe timeframe) {
        for (TimeframeSetting s : timeframes) {
            if (s.timeframe() == timeframe) {
                return s;
            }
        }
        return null;
    }

    public void validate() {
        if (primary == null) {
            throw new ConfigurationException("multiTimeframe.primary is required");
        }
        if (confirmations.contains(primary)) {
            throw new ConfigurationException("multiTimeframe.confirmations must not include the primary timeframe");
        }
        double total = timeframes.stream().mapToDouble(TimeframeSetting::weight).sum();
        if (Math.abs(total - 1.0) > 1e-6) {
            throw new ConfigurationException("multiTimeframe weights must sum to 1.0, got " + total);
        }
        for (TimeframeSetting s : timeframes) {
            if (s.decay() <= 0.0 || s.decay() > 1.0) {
                throw new ConfigurationException("multiTimeframe decay for " + s.timeframe() + " must be in (0,1]");
            }
        }
        if (minConfirmationRatio < 0.0 || minConfirmationRatio > 1.0) {
            throw new ConfigurationException("multiTimeframe.minConfirmationRatio must be in [0,1]");
        }
    }
}
