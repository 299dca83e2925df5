package in.voltedge.domain.signal;

/**
 * How a multi-timeframe conflict was (or was not) resolved.
 */
public enum ResolutionMethod {
    NO_CONFLICT,              // Timeframes agree, consensus used as-is
    PRIMARY_OVERRIDE,         // Primary timeframe had a signal
    WEIGHTED_CONSENSUS,       // |weighted score| cleared the consensus threshold
    HIGHER_TIMEFRAME_PRIORITY,// Strongest higher timeframe won
    NO_RESOLUTION             // Nothing cleared its threshold
}
