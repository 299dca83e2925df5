package in.voltedge.service.signal;

import in.voltedge.domain.market.Timeframe;
import in.voltedge.domain.signal.TimeframeSignal;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest timeframe signals per symbol, replaced wholesale on each refresh.
 */
public final class TimeframeSignalCache {

    private final Map<String, Map<Timeframe, TimeframeSignal>> bySymbol = new ConcurrentHashMap<>();

    public void put(String symbol, Map<Timeframe, TimeframeSignal> signals) {
        if (signals.isEmpty()) {
            bySymbol.remove(symbol);
            return;
        }
        bySymbol.put(symbol, Map.copyOf(new EnumMap<>(signals)));
    }

    /**
     * @return the cached signals, empty when the symbol has never been refreshed
     */
    public Map<Timeframe, TimeframeSignal> get(String symbol) {
        return bySymbol.getOrDefault(symbol, Map.of());
    }

    public int size() {
        return bySymbol.size();
    }
}
