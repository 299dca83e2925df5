package in.voltedge.domain.order;

import in.voltedge.domain.trade.Side;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Confirmed execution of an order, possibly partial.
 */
public record Fill(
    String orderId,
    String symbol,
    Side side,
    BigDecimal quantity,
    BigDecimal price,
    Instant filledAt,
    boolean partial
) {}
