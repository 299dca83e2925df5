package in.voltedge.broker;

import in.voltedge.domain.common.ErrorCategory;

import java.util.function.Function;

/**
 * Outcome of a broker call: a value, or an error category with a reason.
 */
public record BrokerResult<T>(T value, ErrorCategory error, String reason) {

    public static <T> BrokerResult<T> success(T value) {
        return new BrokerResult<>(value, null, null);
    }

    public static <T> BrokerResult<T> failure(ErrorCategory error, String reason) {
        if (error == null) {
            throw new IllegalArgumentException("Failure requires an error category");
        }
        return new BrokerResult<>(null, error, reason);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <U> BrokerResult<U> map(Function<T, U> fn) {
        return isSuccess() ? success(fn.apply(value)) : failure(error, reason);
    }

    /**
     * Re-type a failure.
     */
    public <U> BrokerResult<U> asFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("Not a failure");
        }
        return failure(error, reason);
    }
}
