package in.voltedge.broker;

import in.voltedge.domain.common.ErrorCategory;

/**
 * Categorized broker failure.
 */
public class BrokerException extends RuntimeException {

    private final ErrorCategory category;
    private final String operation;
    private final int httpStatus;

    public BrokerException(ErrorCategory category, String operation, String message) {
        this(category, operation, 0, message, null);
    }

    public BrokerException(ErrorCategory category, String operation, int httpStatus, String message, Throwable cause) {
        super(String.format("[%s] %s failed: %s", category, operation, message), cause);
        this.category = category;
        this.operation = operation;
        this.httpStatus = httpStatus;
    }

    /**
     * Map an HTTP status from a REST broker to a category.
     */
    public static BrokerException fromHttpStatus(String operation, int status, String message) {
        ErrorCategory category;
        if (status == 429) {
            category = ErrorCategory.RATE_LIMITED;
        } else if (status == 403) {
            category = ErrorCategory.INSUFFICIENT_FUNDS;
        } else if (status == 400 || status == 404 || status == 422) {
            category = ErrorCategory.INVALID_REQUEST;
        } else if (status >= 500) {
            category = ErrorCategory.CONNECTION_ERROR;
        } else {
            category = ErrorCategory.UNEXPECTED;
        }
        return new BrokerException(category, operation, status, "HTTP " + status + ": " + message, null);
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public String getOperation() {
        return operation;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
