package in.voltedge.service.risk;

import in.voltedge.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window broker call budget.
 *
 * At most {@code maxCalls} acquisitions inside any rolling {@code window}. A caller at capacity
 * sleeps until the oldest timestamp ages out; calls are never dropped.
 */
public final class RateBudget {
    private static final Logger log = LoggerFactory.getLogger(RateBudget.class);

    private final int maxCalls;
    private final Duration window;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> calls = new ArrayDeque<>();

    public RateBudget(int maxCalls, Duration window) {
        this(maxCalls, window, Clock.systemUTC(), Sleeper.system());
    }

    public RateBudget(int maxCalls, Duration window, Clock clock, Sleeper sleeper) {
        if (maxCalls < 1) {
            throw new IllegalArgumentException("maxCalls must be positive");
        }
        this.maxCalls = maxCalls;
        this.window = window;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Take a slot, blocking while the window is full.
     *
     * @return total time spent waiting
     */
    public Duration acquire() throws InterruptedException {
        Duration waited = Duration.ZERO;
        while (true) {
            Duration wait;
            synchronized (this) {
                Instant now = clock.instant();
                evict(now);
                if (calls.size() < maxCalls) {
                    calls.addLast(now);
                    return waited;
                }
                wait = Duration.between(now, calls.peekFirst().plus(window));
            }
            if (wait.isZero() || wait.isNegative()) {
                wait = Duration.ofMillis(1);
            }
            log.debug("[RateBudget] At capacity ({}/{}), waiting {}ms", maxCalls, maxCalls, wait.toMillis());
            sleeper.sleep(wait);
            waited = waited.plus(wait);
        }
    }

    /**
     * Take a slot only if one is free now.
     */
    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        evict(now);
        if (calls.size() < maxCalls) {
            calls.addLast(now);
            return true;
        }
        return false;
    }

    public synchronized int inWindow() {
        evict(clock.instant());
        return calls.size();
    }

    public synchronized double utilization() {
        return (double) inWindow() / maxCalls;
    }

    public int getMaxCalls() {
        return maxCalls;
    }

    private void evict(Instant now) {
        Instant cutoff = now.minus(window);
        while (!calls.isEmpty() && !calls.peekFirst().isAfter(cutoff)) {
            calls.removeFirst();
        }
    }
}
