package in.voltedge.domain.order;

import in.voltedge.domain.trade.Side;

import java.math.BigDecimal;

/**
 * Position as the broker sees it.
 */
public record BrokerPosition(String symbol, Side side, BigDecimal quantity, BigDecimal averageEntryPrice) {}
