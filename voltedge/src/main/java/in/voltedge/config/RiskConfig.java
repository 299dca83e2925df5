package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Admission limits and the broker call budget.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskConfig(
    @JsonProperty("maxConcurrentPositions")
    int maxConcurrentPositions,

    @JsonProperty("dailyLossLimitFraction")
    double dailyLossLimitFraction,  // of capital, 0.02 = 2%

    @JsonProperty("maxCallsPerWindow")
    int maxCallsPerWindow,          // Hard ceiling below the broker's 200/min

    @JsonProperty("rateWindowSeconds")
    int rateWindowSeconds,

    @JsonProperty("dailyResetTime")
    String dailyResetTime,          // HH:mm in dailyResetZone

    @JsonProperty("dailyResetZone")
    String dailyResetZone
) {
    public static RiskConfig defaults() {
        return new RiskConfig(10, 0.02, 195, 60, "00:00", "UTC");
    }

    public RiskConfig withMaxCallsPerWindow(int calls) {
        return new RiskConfig(maxConcurrentPositions, dailyLossLimitFraction, calls,
            rateWindowSeconds, dailyResetTime, dailyResetZone);
    }

    public LocalTime resetTime() {
        return LocalTime.parse(dailyResetTime);
    }

    public ZoneId resetZone() {
        return ZoneId.of(dailyResetZone);
    }

    public void validate() {
        if (maxConcurrentPositions < 1) {
            throw new ConfigurationException("risk.maxConcurrentPositions must be positive");
        }
        if (dailyLossLimitFraction <= 0.0 || dailyLossLimitFraction > 1.0) {
            throw new ConfigurationException("risk.dailyLossLimitFraction must be in (0,1]");
        }
        if (maxCallsPerWindow < 1 || rateWindowSeconds < 1) {
            throw new ConfigurationException("risk rate budget must be positive");
        }
        try {
            resetTime();
            resetZone();
        } catch (RuntimeException e) {
            throw new ConfigurationException("risk daily reset time/zone invalid: " + e.getMessage(), e);
        }
    }
}
