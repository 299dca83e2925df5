package in.voltedge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import in.voltedge.domain.market.Timeframe;

/**
 * Weight and staleness decay for one timeframe.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeframeSetting(
    @JsonProperty("timeframe") Timeframe timeframe,
    @JsonProperty("weight") double weight,
    @JsonProperty("decay") double decay
) {}
