package in.voltedge.broker;

import in.voltedge.domain.market.Bar;
import in.voltedge.domain.market.Timeframe;
import in.voltedge.domain.order.Account;
import in.voltedge.domain.order.BrokerPosition;
import in.voltedge.domain.order.OrderHandle;
import in.voltedge.domain.order.OrderRequest;
import in.voltedge.domain.order.OrderState;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Broker capability used by the engine.
 *
 * Implementations fail the returned future with a {@link BrokerException} carrying an
 * {@link in.voltedge.domain.common.ErrorCategory}. The engine never calls a Broker directly;
 * every call goes through {@link BrokerGateway}, which enforces the rate budget.
 */
public interface Broker {

    /**
     * Broker code (PAPER, ALPACA, ...).
     */
    String getBrokerCode();

    /**
     * Submit an order. Implementations should treat a repeated {@code clientOrderId} as the same order.
     */
    CompletableFuture<OrderHandle> submitOrder(OrderRequest request);

    CompletableFuture<OrderState> getOrderStatus(String orderId);

    CompletableFuture<Void> cancelOrder(String orderId);

    /**
     * Most recent bars, oldest first.
     */
    CompletableFuture<List<Bar>> getRecentBars(String symbol, Timeframe timeframe, int limit);

    CompletableFuture<Account> getAccount();

    CompletableFuture<List<BrokerPosition>> listPositions();
}
