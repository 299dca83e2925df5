package in.voltedge.service.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Global count of unexpected errors. Exceeding the budget is fatal; successes do not refund it.
 */
public final class ErrorBudget {
    private static final Logger log = LoggerFactory.getLogger(ErrorBudget.class);

    private final int maxErrors;
    private final AtomicInteger errors = new AtomicInteger();

    public ErrorBudget(int maxErrors) {
        this.maxErrors = maxErrors;
    }

    /**
     * @throws EngineHaltedException once the count reaches the budget
     */
    public void recordUnexpected(String source, String detail) {
        int count = errors.incrementAndGet();
        log.error("[ErrorBudget] Unexpected error #{}/{} in {}: {}", count, maxErrors, source, detail);
        if (count >= maxErrors) {
            throw new EngineHaltedException(source,
                "unexpected error budget exhausted (" + count + "/" + maxErrors + "), last: " + detail);
        }
    }

    public int getCount() {
        return errors.get();
    }

    public int getMaxErrors() {
        return maxErrors;
    }
}
