package in.voltedge.service.execution;

import in.voltedge.broker.BrokerResult;
import in.voltedge.domain.order.Fill;
import in.voltedge.service.engine.EngineHaltedException;

/**
 * Connection retries ran out while an order was working at the broker.
 * Carries the outcome of the last cancel-and-check, so the caller can keep its
 * book in line with whatever the broker may still hold.
 */
public class UnsettledOrderException extends EngineHaltedException {

    private final String orderId;
    private final BrokerResult<Fill> settlement;

    public UnsettledOrderException(String orderId, BrokerResult<Fill> settlement, EngineHaltedException cause) {
        super(cause.getSource(), "order " + orderId + " left working after connection loss"
            + (settlement.isSuccess() ? " (filled on final check)" : ": " + settlement.reason()), cause);
        this.orderId = orderId;
        this.settlement = settlement;
    }

    public String getOrderId() {
        return orderId;
    }

    /**
     * @return the late fill when the final check found one, otherwise the failure
     */
    public BrokerResult<Fill> getSettlement() {
        return settlement;
    }
}
