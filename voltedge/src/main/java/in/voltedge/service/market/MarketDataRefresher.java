package in.voltedge.service.market;

import in.voltedge.broker.BrokerGateway;
import in.voltedge.broker.BrokerResult;
import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.market.Bar;
import in.voltedge.domain.market.Sample;
import in.voltedge.domain.market.Timeframe;
import in.voltedge.service.execution.OrderExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Feeds the series store from one-minute bars: a bulk seed at startup, then the latest bar per
 * refresh. A bar is appended only when it is newer than the last stored sample.
 */
public final class MarketDataRefresher {
    private static final Logger log = LoggerFactory.getLogger(MarketDataRefresher.class);

    private final BrokerGateway gateway;
    private final OrderExecutor executor;
    private final SeriesStore store;
    private final List<String> symbols;
    private final int seedBars;

    public MarketDataRefresher(BrokerGateway gateway, OrderExecutor executor, SeriesStore store,
                               List<String> symbols, int seedBars) {
        this.gateway = gateway;
        this.executor = executor;
        this.store = store;
        this.symbols = List.copyOf(symbols);
        this.seedBars = seedBars;
    }

    /**
     * @return number of symbols seeded
     */
    public int seed(BooleanSupplier running) {
        int seeded = 0;
        for (String symbol : symbols) {
            if (!running.getAsBoolean()) {
                break;
            }
            Optional<List<Bar>> bars = fetch(symbol, seedBars);
            if (bars.isPresent() && store.bulkLoad(symbol, bars.get()) > 0) {
                seeded++;
            }
        }
        log.info("[MarketDataRefresher] Seeded {}/{} symbols with up to {} bars", seeded, symbols.size(), seedBars);
        return seeded;
    }

    /**
     * @return number of symbols that received a new sample
     */
    public int refresh(BooleanSupplier running) {
        int updated = 0;
        for (String symbol : symbols) {
            if (!running.getAsBoolean()) {
                break;
            }
            Optional<List<Bar>> bars = fetch(symbol, 1);
            if (bars.isEmpty() || bars.get().isEmpty()) {
                continue;
            }
            Bar bar = bars.get().get(bars.get().size() - 1);
            Optional<Sample> last = store.latest(symbol);
            if (last.isPresent() && !bar.timestamp().isAfter(last.get().timestamp())) {
                continue;
            }
            try {
                store.record(new Sample(symbol, bar.close(), bar.volume(), bar.timestamp()));
                updated++;
            } catch (IllegalArgumentException e) {
                log.warn("[MarketDataRefresher] Dropped bad bar for {}: {}", symbol, e.getMessage());
            }
        }
        return updated;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    private Optional<List<Bar>> fetch(String symbol, int limit) {
        BrokerResult<List<Bar>> result = executor.withRetry("get_recent_bars",
            () -> gateway.getRecentBars(symbol, Timeframe.ONE_MIN, limit));
        if (!result.isSuccess()) {
            if (result.error() != ErrorCategory.CANCELLED) {
                log.warn("[MarketDataRefresher] {} bars unavailable ({}): {}", symbol, result.error(), result.reason());
            }
            return Optional.empty();
        }
        return Optional.of(result.value());
    }
}
