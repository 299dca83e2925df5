package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Periodic loop intervals, in seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoopConfig(
    @JsonProperty("marketDataIntervalSeconds") int marketDataIntervalSeconds,
    @JsonProperty("entrySearchIntervalSeconds") int entrySearchIntervalSeconds,
    @JsonProperty("exitCheckIntervalSeconds") int exitCheckIntervalSeconds,
    @JsonProperty("cacheRefreshIntervalSeconds") int cacheRefreshIntervalSeconds,
    @JsonProperty("seedBars") int seedBars,
    @JsonProperty("shutdownTimeoutSeconds") int shutdownTimeoutSeconds
) {
    public static LoopConfig defaults() {
        return new LoopConfig(5, 10, 2, 60, 100, 15);
    }

    public void validate() {
        if (marketDataIntervalSeconds < 1 || entrySearchIntervalSeconds < 1
                || exitCheckIntervalSeconds < 1 || cacheRefreshIntervalSeconds < 1) {
            throw new ConfigurationException("loop intervals must be at least one second");
        }
    }
}
