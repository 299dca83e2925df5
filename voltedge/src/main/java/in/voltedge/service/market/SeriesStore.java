package in.voltedge.service.market;

import in.voltedge.domain.market.Bar;
import in.voltedge.domain.market.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded per-symbol rolling buffers of (price, volume) samples.
 *
 * Each symbol has a fixed-capacity ring: append and evict are O(1), the oldest sample is dropped
 * once the buffer is full. Reads return chronological copies, so callers never hold the lock.
 */
public final class SeriesStore {
    private static final Logger log = LoggerFactory.getLogger(SeriesStore.class);

    private final int capacity;
    private final Clock clock;
    private final ConcurrentHashMap<String, Ring> rings = new ConcurrentHashMap<>();

    public SeriesStore(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public SeriesStore(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // WRITES
    // ═══════════════════════════════════════════════════════════════

    public Sample record(String symbol, double price, double volume) {
        return record(new Sample(symbol, price, volume, clock.instant()));
    }

    public Sample record(Sample sample) {
        if (!(sample.price() > 0.0) || Double.isInfinite(sample.price())) {
            throw new IllegalArgumentException("Price must be positive and finite for "
                + sample.symbol() + ": " + sample.price());
        }
        if (sample.volume() < 0.0 || Double.isNaN(sample.volume())) {
            throw new IllegalArgumentException("Volume must be non-negative for "
                + sample.symbol() + ": " + sample.volume());
        }
        ring(sample.symbol()).append(sample);
        return sample;
    }

    /**
     * Seed a symbol from historical bars (close price, bar volume), oldest first.
     *
     * @return number of samples stored
     */
    public int bulkLoad(String symbol, List<Bar> bars) {
        Ring ring = ring(symbol);
        int loaded = 0;
        for (Bar bar : bars) {
            if (bar.close() > 0.0) {
                ring.append(new Sample(symbol, bar.close(), Math.max(0.0, bar.volume()), bar.timestamp()));
                loaded++;
            }
        }
        log.info("[SeriesStore] Seeded {} with {} samples (buffer size {})", symbol, loaded, ring.size());
        return loaded;
    }

    // ═══════════════════════════════════════════════════════════════
    // READS
    // ═══════════════════════════════════════════════════════════════

    /**
     * Last {@code n} samples in chronological order, fewer if the buffer holds fewer.
     */
    public List<Sample> window(String symbol, int n) {
        Ring ring = rings.get(symbol);
        if (ring == null || n <= 0) {
            return List.of();
        }
        return ring.last(n);
    }

    public double[] prices(String symbol, int n) {
        List<Sample> w = window(symbol, n);
        double[] out = new double[w.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = w.get(i).price();
        }
        return out;
    }

    public double[] volumes(String symbol, int n) {
        List<Sample> w = window(symbol, n);
        double[] out = new double[w.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = w.get(i).volume();
        }
        return out;
    }

    public Optional<Sample> latest(String symbol) {
        List<Sample> last = window(symbol, 1);
        return last.isEmpty() ? Optional.empty() : Optional.of(last.get(0));
    }

    public int size(String symbol) {
        Ring ring = rings.get(symbol);
        return ring == null ? 0 : ring.size();
    }

    public Set<String> symbols() {
        return Collections.unmodifiableSet(rings.keySet());
    }

    public int capacity() {
        return capacity;
    }

    private Ring ring(String symbol) {
        return rings.computeIfAbsent(symbol, s -> new Ring(capacity));
    }

    /**
     * Fixed array ring guarded by a read/write lock.
     */
    private static final class Ring {
        private final Sample[] slots;
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private int head = 0;   // next write position
        private int size = 0;
        private Instant lastTimestamp;

        Ring(int capacity) {
            this.slots = new Sample[capacity];
        }

        void append(Sample sample) {
            lock.writeLock().lock();
            try {
                if (lastTimestamp != null && sample.timestamp().isBefore(lastTimestamp)) {
                    // Keep the buffer chronological even if a late sample arrives
                    sample = new Sample(sample.symbol(), sample.price(), sample.volume(), lastTimestamp);
                }
                slots[head] = sample;
                head = (head + 1) % slots.length;
                if (size < slots.length) {
                    size++;
                }
                lastTimestamp = sample.timestamp();
            } finally {
                lock.writeLock().unlock();
            }
        }

        List<Sample> last(int n) {
            lock.readLock().lock();
            try {
                int count = Math.min(n, size);
                List<Sample> out = new ArrayList<>(count);
                int start = (head - count + slots.length) % slots.length;
                for (int i = 0; i < count; i++) {
                    out.add(slots[(start + i) % slots.length]);
                }
                return out;
            } finally {
                lock.readLock().unlock();
            }
        }

        int size() {
            lock.readLock().lock();
            try {
                return size;
            } finally {
                lock.readLock().unlock();
            }
        }
    }
}
