package in.voltedge.service.engine;

import in.voltedge.domain.signal.Signal;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hand-off of ranked signals from the market-data loop to the entry loop.
 * Each publish replaces the previous batch.
 */
public final class SignalMailbox {

    public record Batch(long generation, List<Signal> signals, Instant publishedAt) {}

    private final AtomicReference<Batch> latest = new AtomicReference<>(new Batch(0, List.of(), Instant.EPOCH));

    public Batch publish(List<Signal> signals, Instant now) {
        return latest.updateAndGet(prev -> new Batch(prev.generation() + 1, List.copyOf(signals), now));
    }

    public Batch latest() {
        return latest.get();
    }
}
