package in.voltedge.service.execution;

import in.voltedge.domain.trade.Position;
import in.voltedge.domain.trade.PositionState;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live position set, at most one position per symbol.
 *
 * Every mutation is a compare-and-set against the instance the caller last saw, so a stale
 * writer never overwrites a newer state.
 */
public final class PositionBook {

    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    /**
     * Insert a reservation unless the symbol is already held.
     *
     * @return true if the reservation was stored
     */
    public boolean reserve(Position reservation) {
        return positions.putIfAbsent(reservation.symbol(), reservation) == null;
    }

    /**
     * Insert a position discovered at the broker, unless one is already tracked.
     */
    public boolean adopt(Position position) {
        return positions.putIfAbsent(position.symbol(), position) == null;
    }

    public Optional<Position> get(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public boolean contains(String symbol) {
        return positions.containsKey(symbol);
    }

    public boolean replace(Position expected, Position next) {
        return positions.replace(expected.symbol(), expected, next);
    }

    public boolean remove(Position expected) {
        return positions.remove(expected.symbol(), expected);
    }

    public int size() {
        return positions.size();
    }

    public List<Position> snapshot() {
        return List.copyOf(positions.values());
    }

    public List<Position> inState(PositionState state) {
        return positions.values().stream()
            .filter(p -> p.state() == state)
            .toList();
    }
}
