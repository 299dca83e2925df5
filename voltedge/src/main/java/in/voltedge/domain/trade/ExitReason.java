package in.voltedge.domain.trade;

/**
 * Exit reasons, in the priority order they are checked.
 */
public enum ExitReason {
    PROFIT_TARGET,       // Price reached target
    STOP_LOSS,           // Price breached the initial stop
    TRAILING_STOP,       // Price breached a stop that had been tightened
    TIME_LIMIT,          // Max holding duration exceeded
    VOLATILITY_COLLAPSE, // Volatility under the floor while underwater
    RECONCILED           // Broker no longer holds the position
}
