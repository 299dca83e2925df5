package in.voltedge.domain.signal;

import java.util.List;

/**
 * Result of the volume confirmation filter.
 *
 * {@code confirmed} is the gate. {@code score} is diagnostic only.
 */
public record VolumeConfirmation(
    boolean confirmed,
    double score,
    double volumeRatio,
    double percentile,
    boolean volumeSpike,
    VolumeTrend trend,
    List<String> reasons
) {
    public VolumeConfirmation {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }
}
