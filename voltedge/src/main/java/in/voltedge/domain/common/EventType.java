package in.voltedge.domain.common;

/**
 * Structured engine events.
 */
public enum EventType {
    // Signal pipeline
    SCAN_COMPLETED,
    CONSENSUS_COMPUTED,
    VOLUME_CHECKED,

    // Risk
    ENTRY_REJECTED,
    DAILY_LOSS_RESET,
    RATE_LIMIT_WAIT,

    // Position lifecycle
    POSITION_STATE_CHANGED,
    STOP_TIGHTENED,
    ORDER_FAILED,
    RECONCILIATION_DRIFT,

    // Engine
    LOOP_ERROR,
    ENGINE_HALTED
}
