package in.voltedge.domain.common;

/**
 * Failure taxonomy shared by the broker gateway and the lifecycle manager.
 */
public enum ErrorCategory {
    INSUFFICIENT_DATA(false),   // Not enough samples or bars, skip this cycle
    RATE_LIMITED(true),         // Broker throttled us, back off and retry
    INSUFFICIENT_FUNDS(false),  // Buying power too low, never retried
    INVALID_REQUEST(false),     // Malformed or rejected order, never retried
    CONNECTION_ERROR(true),     // Transport failure, exponential reconnect
    ORDER_TIMEOUT(false),       // Not filled in the wait window, cancelled
    CANCELLED(false),           // Interrupted by shutdown, state cleaned up by the caller
    UNEXPECTED(false);          // Anything else, counted against the error budget

    private final boolean retryable;

    ErrorCategory(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
