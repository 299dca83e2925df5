package in.voltedge.domain.signal;

import in.voltedge.domain.trade.Side;

/**
 * Direction proposed by the scanner.
 */
public enum SignalAction {
    BUY,
    SELL,
    HOLD;

    /**
     * Order side that opens a position for this action, or null for HOLD.
     */
    public Side entrySide() {
        return switch (this) {
            case BUY -> Side.BUY;
            case SELL -> Side.SELL;
            case HOLD -> null;
        };
    }

    /**
     * +1 for BUY, -1 for SELL, 0 for HOLD. Matches the sign convention of timeframe signals.
     */
    public int direction() {
        return switch (this) {
            case BUY -> 1;
            case SELL -> -1;
            case HOLD -> 0;
        };
    }
}
