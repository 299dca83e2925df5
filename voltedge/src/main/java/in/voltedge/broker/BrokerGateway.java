package in.voltedge.broker;

import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.market.Bar;
import in.voltedge.domain.market.Timeframe;
import in.voltedge.domain.order.Account;
import in.voltedge.domain.order.BrokerPosition;
import in.voltedge.domain.order.OrderHandle;
import in.voltedge.domain.order.OrderRequest;
import in.voltedge.domain.order.OrderState;
import in.voltedge.infrastructure.metrics.EngineMetrics;
import in.voltedge.service.core.EventService;
import in.voltedge.service.risk.RateBudget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Single entry point for broker calls.
 *
 * Every call takes a slot from the {@link RateBudget}, is bounded by the call timeout, and comes
 * back as a {@link BrokerResult} with the failure categorized. No retries here; retry policy
 * belongs to the caller.
 */
public final class BrokerGateway {
    private static final Logger log = LoggerFactory.getLogger(BrokerGateway.class);

    private final Broker broker;
    private final RateBudget budget;
    private final Duration callTimeout;
    private final EngineMetrics metrics;
    private final EventService events;

    public BrokerGateway(Broker broker, RateBudget budget, Duration callTimeout,
                         EngineMetrics metrics, EventService events) {
        this.broker = broker;
        this.budget = budget;
        this.callTimeout = callTimeout;
        this.metrics = metrics;
        this.events = events;
    }

    public BrokerResult<OrderHandle> submitOrder(OrderRequest request) {
        return call("submit_order", request.symbol(), () -> broker.submitOrder(request));
    }

    public BrokerResult<OrderState> getOrderStatus(String orderId) {
        return call("get_order_status", null, () -> broker.getOrderStatus(orderId));
    }

    public BrokerResult<Void> cancelOrder(String orderId) {
        return call("cancel_order", null, () -> broker.cancelOrder(orderId));
    }

    public BrokerResult<List<Bar>> getRecentBars(String symbol, Timeframe timeframe, int limit) {
        return call("get_recent_bars", symbol, () -> broker.getRecentBars(symbol, timeframe, limit));
    }

    public BrokerResult<Account> getAccount() {
        return call("get_account", null, broker::getAccount);
    }

    public BrokerResult<List<BrokerPosition>> listPositions() {
        return call("list_positions", null, broker::listPositions);
    }

    public String getBrokerCode() {
        return broker.getBrokerCode();
    }

    public double rateUtilization() {
        return budget.utilization();
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private <T> BrokerResult<T> call(String operation, String symbol, Supplier<CompletableFuture<T>> invocation) {
        Duration waited;
        try {
            waited = budget.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BrokerResult.failure(ErrorCategory.CANCELLED, operation + " interrupted while waiting for rate budget");
        }
        if (!waited.isZero()) {
            metrics.recordRateLimitWait(waited);
            events.emit(EventType.RATE_LIMIT_WAIT, symbol, "rate-budget",
                Map.of("operation", operation, "waitedMillis", waited.toMillis()));
        }
        metrics.updateRateUtilization(budget.utilization());

        long start = System.nanoTime();
        BrokerResult<T> result = invoke(operation, invocation);
        Duration latency = Duration.ofNanos(System.nanoTime() - start);
        metrics.recordBrokerCall(operation, result.error(), latency);

        if (!result.isSuccess()) {
            log.warn("[BrokerGateway] {} {} failed ({}): {}", broker.getBrokerCode(), operation,
                result.error(), result.reason());
        }
        return result;
    }

    private <T> BrokerResult<T> invoke(String operation, Supplier<CompletableFuture<T>> invocation) {
        CompletableFuture<T> future = null;
        try {
            future = invocation.get();
            return BrokerResult.success(future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return BrokerResult.failure(ErrorCategory.CONNECTION_ERROR,
                operation + " timed out after " + callTimeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            return BrokerResult.failure(ErrorCategory.CANCELLED, operation + " interrupted");
        } catch (ExecutionException | CompletionException e) {
            return categorize(operation, e.getCause() != null ? e.getCause() : e);
        } catch (RuntimeException e) {
            return categorize(operation, e);
        }
    }

    static <T> BrokerResult<T> categorize(String operation, Throwable cause) {
        if (cause instanceof BrokerException be) {
            return BrokerResult.failure(be.getCategory(), be.getMessage());
        }
        if (cause instanceof IOException) {
            return BrokerResult.failure(ErrorCategory.CONNECTION_ERROR, operation + ": " + cause.getMessage());
        }
        return BrokerResult.failure(ErrorCategory.UNEXPECTED,
            operation + ": " + cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }
}
