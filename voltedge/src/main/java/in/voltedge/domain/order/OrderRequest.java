package in.voltedge.domain.order;

import in.voltedge.domain.trade.Side;

import java.math.BigDecimal;

/**
 * Order submitted through the broker gateway.
 *
 * {@code clientOrderId} is generated by the engine so a retried submission can be recognized.
 */
public record OrderRequest(
    String clientOrderId,
    String symbol,
    Side side,
    BigDecimal quantity,
    OrderType type,
    BigDecimal limitPrice
) {
    public OrderRequest {
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Order quantity must be positive: " + quantity);
        }
        if (type == OrderType.LIMIT && limitPrice == null) {
            throw new IllegalArgumentException("Limit order requires a limit price");
        }
    }

    public static OrderRequest market(String clientOrderId, String symbol, Side side, BigDecimal quantity) {
        return new OrderRequest(clientOrderId, symbol, side, quantity, OrderType.MARKET, null);
    }
}
