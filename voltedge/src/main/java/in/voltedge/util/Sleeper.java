package in.voltedge.util;

import java.time.Duration;

/**
 * Blocking wait, injectable so tests can advance a fake clock instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(Math.max(0L, duration.toMillis()));
    }
}
