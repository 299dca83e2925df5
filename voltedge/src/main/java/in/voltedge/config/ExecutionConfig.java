package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Sizing, order handling, retry and exit settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecutionConfig(
    @JsonProperty("dryRun")
    boolean dryRun,                     // Fill locally, send nothing

    @JsonProperty("capital")
    double capital,                     // Used when the account cannot be read

    @JsonProperty("maxPositionFraction")
    double maxPositionFraction,

    @JsonProperty("confidenceSizingFactor")
    double confidenceSizingFactor,

    @JsonProperty("quantityScale")
    int quantityScale,

    @JsonProperty("entryConfidenceThreshold")
    double entryConfidenceThreshold,

    @JsonProperty("maxEntriesPerCycle")
    int maxEntriesPerCycle,

    @JsonProperty("fillTimeoutMillis")
    long fillTimeoutMillis,

    @JsonProperty("fillPollMillis")
    long fillPollMillis,

    @JsonProperty("callTimeoutMillis")
    long callTimeoutMillis,

    @JsonProperty("rateLimitBackoffMillis")
    long rateLimitBackoffMillis,

    @JsonProperty("maxRateLimitRetries")
    int maxRateLimitRetries,

    @JsonProperty("reconnectInitialDelayMillis")
    long reconnectInitialDelayMillis,

    @JsonProperty("reconnectMaxDelayMillis")
    long reconnectMaxDelayMillis,

    @JsonProperty("maxReconnectAttempts")
    int maxReconnectAttempts,

    @JsonProperty("maxExitAttempts")
    int maxExitAttempts,

    @JsonProperty("maxHoldingSeconds")
    long maxHoldingSeconds,

    @JsonProperty("volatilityFloor")
    double volatilityFloor,             // Early cut when underwater below this

    @JsonProperty("maxUnexpectedErrors")
    int maxUnexpectedErrors             // Global error budget
) {
    public static ExecutionConfig defaults() {
        return new ExecutionConfig(
            false, 10_000.0, 0.05, 0.1, 6, 0.7, 5,
            10_000, 500, 15_000,
            5_000, 3,
            1_000, 60_000, 5,
            3, 900, 0.01, 10
        );
    }

    public ExecutionConfig withDryRun(boolean dry) {
        return new ExecutionConfig(dry, capital, maxPositionFraction, confidenceSizingFactor, quantityScale,
            entryConfidenceThreshold, maxEntriesPerCycle, fillTimeoutMillis, fillPollMillis, callTimeoutMillis,
            rateLimitBackoffMillis, maxRateLimitRetries, reconnectInitialDelayMillis, reconnectMaxDelayMillis,
            maxReconnectAttempts, maxExitAttempts, maxHoldingSeconds, volatilityFloor, maxUnexpectedErrors);
    }

    public ExecutionConfig withCapital(double newCapital) {
        return new ExecutionConfig(dryRun, newCapital, maxPositionFraction, confidenceSizingFactor, quantityScale,
            entryConfidenceThreshold, maxEntriesPerCycle, fillTimeoutMillis, fillPollMillis, callTimeoutMillis,
            rateLimitBackoffMillis, maxRateLimitRetries, reconnectInitialDelayMillis, reconnectMaxDelayMillis,
            maxReconnectAttempts, maxExitAttempts, maxHoldingSeconds, volatilityFloor, maxUnexpectedErrors);
    }

    public ExecutionConfig withFillTiming(long timeoutMillis, long pollMillis) {
        return new ExecutionConfig(dryRun, capital, maxPositionFraction, confidenceSizingFactor, quantityScale,
            entryConfidenceThreshold, maxEntriesPerCycle, timeoutMillis, pollMillis, callTimeoutMillis,
            rateLimitBackoffMillis, maxRateLimitRetries, reconnectInitialDelayMillis, reconnectMaxDelayMillis,
            maxReconnectAttempts, maxExitAttempts, maxHoldingSeconds, volatilityFloor, maxUnexpectedErrors);
    }

    public Duration fillTimeout() {
        return Duration.ofMillis(fillTimeoutMillis);
    }

    public Duration fillPollInterval() {
        return Duration.ofMillis(fillPollMillis);
    }

    public Duration callTimeout() {
        return Duration.ofMillis(callTimeoutMillis);
    }

    public Duration rateLimitBackoff() {
        return Duration.ofMillis(rateLimitBackoffMillis);
    }

    public Duration maxHoldingTime() {
        return Duration.ofSeconds(maxHoldingSeconds);
    }

    public void validate() {
        if (capital <= 0) {
            throw new ConfigurationException("execution.capital must be positive");
        }
        if (maxPositionFraction <= 0 || maxPositionFraction > 1) {
            throw new ConfigurationException("execution.maxPositionFraction must be in (0,1]");
        }
        if (fillPollMillis <= 0 || fillTimeoutMillis < fillPollMillis) {
            throw new ConfigurationException("execution fill timeout must be >= poll interval > 0");
        }
        if (maxReconnectAttempts < 1 || maxExitAttempts < 1 || maxUnexpectedErrors < 1) {
            throw new ConfigurationException("execution attempt budgets must be positive");
        }
        if (reconnectInitialDelayMillis <= 0 || reconnectInitialDelayMillis > reconnectMaxDelayMillis) {
            throw new ConfigurationException("execution reconnect delays must satisfy 0 < initial <= max");
        }
    }
}
