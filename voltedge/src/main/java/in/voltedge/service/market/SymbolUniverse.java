package in.voltedge.service.market;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Symbol normalization and list merging.
 *
 * Broker pair notation ("BTC/USD") and plain tickers ("btcusd") map to the same key ("BTCUSD").
 */
public final class SymbolUniverse {

    public static String normalize(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Symbol is required");
        }
        String normalized = symbol.trim()
            .replace("/", "")
            .replace("-", "")
            .toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Symbol is blank: '" + symbol + "'");
        }
        return normalized;
    }

    /**
     * Defaults followed by overrides, normalized, de-duplicated, first occurrence wins.
     */
    public static List<String> merge(Collection<String> defaults, Collection<String> overrides) {
        Set<String> merged = new LinkedHashSet<>();
        for (String s : defaults) {
            merged.add(normalize(s));
        }
        for (String s : overrides) {
            merged.add(normalize(s));
        }
        return new ArrayList<>(merged);
    }

    private SymbolUniverse() {}
}
