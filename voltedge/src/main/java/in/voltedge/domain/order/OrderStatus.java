package in.voltedge.domain.order;

/**
 * Order status as reported by the broker.
 */
public enum OrderStatus {
    PENDING,    // Accepted, not yet working
    PLACED,     // Working at the venue
    PARTIAL,    // Partially filled
    FILLED,     // Completely filled
    REJECTED,   // Rejected by broker
    CANCELLED;  // Cancelled by us or the venue

    public boolean isTerminal() {
        return this == FILLED || this == REJECTED || this == CANCELLED;
    }
}
