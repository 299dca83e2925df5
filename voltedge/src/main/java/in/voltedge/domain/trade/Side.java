package in.voltedge.domain.trade;

/**
 * Order / position direction.
 */
public enum Side {
    BUY,
    SELL;

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }
}
