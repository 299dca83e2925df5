package in.voltedge.service.signal;

import in.voltedge.broker.BrokerGateway;
import in.voltedge.broker.BrokerResult;
import in.voltedge.config.MultiTimeframeConfig;
import in.voltedge.config.StochRsiConfig;
import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.market.Bar;
import in.voltedge.domain.market.Timeframe;
import in.voltedge.domain.signal.TimeframeSignal;
import in.voltedge.service.execution.OrderExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Recomputes StochRSI signals for every active timeframe of the given symbols and stores them in
 * the cache. A timeframe whose bars cannot be fetched is left out for this refresh.
 */
public final class TimeframeSignalRefresher {
    private static final Logger log = LoggerFactory.getLogger(TimeframeSignalRefresher.class);

    private final BrokerGateway gateway;
    private final OrderExecutor executor;
    private final StochRsiCalculator calculator;
    private final MultiTimeframeConfig mtf;
    private final StochRsiConfig stochRsi;
    private final TimeframeSignalCache cache;
    private final Clock clock;

    public TimeframeSignalRefresher(BrokerGateway gateway, OrderExecutor executor, StochRsiCalculator calculator,
                                    MultiTimeframeConfig mtf, StochRsiConfig stochRsi,
                                    TimeframeSignalCache cache, Clock clock) {
        this.gateway = gateway;
        this.executor = executor;
        this.calculator = calculator;
        this.mtf = mtf;
        this.stochRsi = stochRsi;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * @return number of symbols with at least one fresh timeframe signal
     */
    public int refresh(Collection<String> symbols, BooleanSupplier running) {
        int refreshed = 0;
        for (String symbol : symbols) {
            if (!running.getAsBoolean()) {
                break;
            }
            Map<Timeframe, TimeframeSignal> signals = new EnumMap<>(Timeframe.class);
            for (Timeframe tf : mtf.activeTimeframes()) {
                BrokerResult<List<Bar>> bars = executor.withRetry("get_recent_bars",
                    () -> gateway.getRecentBars(symbol, tf, stochRsi.barLimit()));
                if (!bars.isSuccess()) {
                    if (bars.error() == ErrorCategory.CANCELLED) {
                        return refreshed;
                    }
                    log.warn("[TimeframeSignalRefresher] {} {} bars unavailable ({}): {}",
                        symbol, tf, bars.error(), bars.reason());
                    continue;
                }
                signals.put(tf, calculator.signal(tf, bars.value(), clock.instant()));
            }
            cache.put(symbol, signals);
            if (!signals.isEmpty()) {
                refreshed++;
            }
        }
        log.debug("[TimeframeSignalRefresher] Refreshed {}/{} symbols", refreshed, symbols.size());
        return refreshed;
    }
}
