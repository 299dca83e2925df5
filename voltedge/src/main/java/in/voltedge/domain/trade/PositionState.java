package in.voltedge.domain.trade;

import java.util.EnumSet;
import java.util.Set;

/**
 * Position lifecycle.
 *
 * NEW -> OPEN -> EXIT_REQUESTED -> CLOSED, with FAILED reachable from NEW and EXIT_REQUESTED.
 */
public enum PositionState {
    NEW,            // Admitted, entry order in flight
    OPEN,           // Entry filled, exits evaluated every cycle
    EXIT_REQUESTED, // Exit condition hit, exit order in flight or awaiting retry
    CLOSED,         // Exit filled, P&L realized
    FAILED;         // Entry or exit could not be completed

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }

    public boolean canTransitionTo(PositionState next) {
        return allowedNext().contains(next);
    }

    private Set<PositionState> allowedNext() {
        return switch (this) {
            case NEW -> EnumSet.of(OPEN, FAILED);
            case OPEN -> EnumSet.of(EXIT_REQUESTED);
            case EXIT_REQUESTED -> EnumSet.of(CLOSED, FAILED);
            case CLOSED, FAILED -> EnumSet.noneOf(PositionState.class);
        };
    }
}
