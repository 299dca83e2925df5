package in.voltedge.domain.signal;

public enum VolumeTrend {
    INCREASING,
    STABLE,
    DECREASING
}
