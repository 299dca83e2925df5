package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MonitoringConfig(
    @JsonProperty("enabled") boolean enabled,
    @JsonProperty("port") int port,
    @JsonProperty("recentEvents") int recentEvents
) {
    public static MonitoringConfig defaults() {
        return new MonitoringConfig(true, 9091, 200);
    }

    public MonitoringConfig withPort(int newPort) {
        return new MonitoringConfig(enabled, newPort, recentEvents);
    }
}
