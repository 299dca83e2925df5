package in.voltedge.service.signal;

import in.voltedge.config.ScannerConfig;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.signal.SignalAction;
import in.voltedge.infrastructure.metrics.EngineMetrics;
import in.voltedge.service.core.EventService;
import in.voltedge.service.market.SeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Volatility / momentum / volume-surge scanner.
 *
 * Tiers:
 * - High volatility: momentum beyond 0.7 / 0.3, confidence scales with volatility, +0.3 on surge
 * - Medium volatility: momentum beyond 0.8 / 0.2 and a volume surge, confidence 0.7
 * - Surge only: momentum beyond 0.6 / 0.4, confidence 0.6, tight target and stop
 *
 * Signals under the minimum confidence are dropped, the rest ranked by confidence.
 */
public final class Scanner {
    private static final Logger log = LoggerFactory.getLogger(Scanner.class);

    private static final double HIGH_MOMENTUM = 0.7;
    private static final double LOW_MOMENTUM = 0.3;
    private static final double MEDIUM_HIGH_MOMENTUM = 0.8;
    private static final double MEDIUM_LOW_MOMENTUM = 0.2;
    private static final double SURGE_HIGH_MOMENTUM = 0.6;
    private static final double SURGE_LOW_MOMENTUM = 0.4;

    private static final double MAX_CONFIDENCE = 0.9;
    private static final double VOLATILITY_CONFIDENCE_SCALE = 10.0;
    private static final double SURGE_BONUS = 0.3;
    private static final double MEDIUM_CONFIDENCE = 0.7;
    private static final double SURGE_CONFIDENCE = 0.6;

    private static final double DEFAULT_TARGET = 0.005;
    private static final double DEFAULT_STOP = 0.003;
    private static final double HIGH_VOL_TARGET = 0.008;
    private static final double HIGH_VOL_STOP = 0.005;
    private static final double SURGE_TARGET = 0.004;
    private static final double SURGE_STOP = 0.002;

    private final SeriesStore store;
    private final ScannerConfig config;
    private final Supplier<? extends Iterable<String>> symbols;
    private final EventService events;
    private final EngineMetrics metrics;
    private final Clock clock;

    public Scanner(SeriesStore store, ScannerConfig config, Supplier<? extends Iterable<String>> symbols,
                   EventService events, EngineMetrics metrics, Clock clock) {
        this.store = store;
        this.config = config;
        this.symbols = symbols;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Scan every tracked symbol. Symbols with too few samples or failing math are skipped.
     *
     * @return signals ranked by confidence, at most {@code maxSignals}
     */
    public List<Signal> scan() {
        List<Signal> signals = new ArrayList<>();
        int scanned = 0;

        for (String symbol : symbols.get()) {
            try {
                Optional<Signal> signal = evaluate(symbol);
                scanned++;
                signal.ifPresent(signals::add);
            } catch (RuntimeException e) {
                log.warn("[Scanner] Skipping {} this cycle: {}", symbol, e.getMessage());
            }
        }

        signals.sort(Comparator.comparingDouble(Signal::confidence).reversed());
        List<Signal> ranked = signals.size() > config.maxSignals()
            ? List.copyOf(signals.subList(0, config.maxSignals()))
            : List.copyOf(signals);

        metrics.recordScan(scanned, ranked.size());
        events.emit(EventType.SCAN_COMPLETED, null, "scanner",
            Map.of("scanned", scanned, "signals", ranked.size()));
        if (!ranked.isEmpty()) {
            log.debug("[Scanner] {} signals, best {} {} @ {}", ranked.size(),
                ranked.get(0).symbol(), ranked.get(0).action(), ranked.get(0).confidence());
        }
        return ranked;
    }

    /**
     * Evaluate one symbol. Empty when there is not enough data or nothing clears the thresholds.
     */
    public Optional<Signal> evaluate(String symbol) {
        if (store.size(symbol) < config.volatilityWindow()) {
            return Optional.empty();
        }

        int lookback = Math.max(config.volatilityWindow(),
            Math.max(config.momentumPeriod() + 1, config.surgeLookback() + 1));
        double[] prices = store.prices(symbol, lookback);
        double[] volumes = store.volumes(symbol, lookback);

        double volatility = volatility(prices);
        if (volatility < config.minVolatility()) {
            return Optional.empty();
        }
        double momentum = ScannerMath.momentum(prices, config.momentumPeriod());
        boolean surge = ScannerMath.volumeSurge(volumes, config.surgeLookback(), config.surgeMultiplier());

        return classify(symbol, prices[prices.length - 1], volatility, momentum, surge);
    }

    /**
     * Current volatility for a held symbol, NaN until the window is filled.
     */
    public double volatility(String symbol) {
        if (store.size(symbol) < config.volatilityWindow()) {
            return Double.NaN;
        }
        return volatility(store.prices(symbol, config.volatilityWindow()));
    }

    private double volatility(double[] prices) {
        return ScannerMath.volatility(prices, config.volatilityWindow(), config.annualizationPeriods());
    }

    Optional<Signal> classify(String symbol, double price, double volatility, double momentum, boolean surge) {
        SignalAction action = SignalAction.HOLD;
        double confidence = 0.0;
        double target = DEFAULT_TARGET;
        double stop = DEFAULT_STOP;

        if (volatility > config.highVolatilityThreshold()) {
            target = HIGH_VOL_TARGET;
            stop = HIGH_VOL_STOP;
            if (momentum > HIGH_MOMENTUM || momentum < LOW_MOMENTUM) {
                action = momentum > HIGH_MOMENTUM ? SignalAction.BUY : SignalAction.SELL;
                confidence = Math.min(MAX_CONFIDENCE,
                    volatility * VOLATILITY_CONFIDENCE_SCALE + (surge ? SURGE_BONUS : 0.0));
            }
        } else if (volatility > config.minVolatility() && surge) {
            if (momentum > MEDIUM_HIGH_MOMENTUM) {
                action = SignalAction.BUY;
                confidence = MEDIUM_CONFIDENCE;
            } else if (momentum < MEDIUM_LOW_MOMENTUM) {
                action = SignalAction.SELL;
                confidence = MEDIUM_CONFIDENCE;
            }
        }

        if (surge && action == SignalAction.HOLD) {
            if (momentum > SURGE_HIGH_MOMENTUM || momentum < SURGE_LOW_MOMENTUM) {
                action = momentum > SURGE_HIGH_MOMENTUM ? SignalAction.BUY : SignalAction.SELL;
                confidence = SURGE_CONFIDENCE;
                target = SURGE_TARGET;
                stop = SURGE_STOP;
            }
        }

        if (action == SignalAction.HOLD || confidence < config.minConfidence()) {
            return Optional.empty();
        }
        return Optional.of(new Signal(symbol, action, confidence, price, volatility, momentum, surge,
            target, stop, clock.instant()));
    }
}
