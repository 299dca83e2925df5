package in.voltedge.service.execution;

import in.voltedge.broker.BrokerGateway;
import in.voltedge.broker.BrokerResult;
import in.voltedge.config.ExecutionConfig;
import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.order.Fill;
import in.voltedge.domain.order.OrderHandle;
import in.voltedge.domain.order.OrderRequest;
import in.voltedge.domain.order.OrderState;
import in.voltedge.domain.order.OrderStatus;
import in.voltedge.domain.trade.Side;
import in.voltedge.infrastructure.broker.common.ReconnectionPolicy;
import in.voltedge.infrastructure.metrics.EngineMetrics;
import in.voltedge.service.engine.EngineHaltedException;
import in.voltedge.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Places market orders and waits for their fills.
 *
 * Retry policy per category:
 * <ul>
 *   <li>RATE_LIMITED: fixed backoff, bounded count</li>
 *   <li>CONNECTION_ERROR: exponential reconnect policy; exhaustion halts the engine</li>
 *   <li>anything else: returned to the caller as-is</li>
 * </ul>
 * A resubmitted order reuses its client order id, so the broker can drop duplicates.
 */
public final class OrderExecutor {
    private static final Logger log = LoggerFactory.getLogger(OrderExecutor.class);

    private final BrokerGateway gateway;
    private final ExecutionConfig config;
    private final ReconnectionPolicy reconnect;
    private final Sleeper sleeper;
    private final Clock clock;
    private final EngineMetrics metrics;

    public OrderExecutor(BrokerGateway gateway, ExecutionConfig config, ReconnectionPolicy reconnect,
                         Sleeper sleeper, Clock clock, EngineMetrics metrics) {
        this.gateway = gateway;
        this.config = config;
        this.reconnect = reconnect;
        this.sleeper = sleeper;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Submit a market order and block until it fills, fails or times out.
     *
     * @return the fill (possibly partial) or the failure category
     */
    public BrokerResult<Fill> execute(String symbol, Side side, BigDecimal quantity) {
        String clientOrderId = symbol + "-" + side.name().toLowerCase() + "-" + UUID.randomUUID();
        OrderRequest request = OrderRequest.market(clientOrderId, symbol, side, quantity);

        BrokerResult<OrderHandle> submitted = withRetry("submit_order", () -> gateway.submitOrder(request));
        if (!submitted.isSuccess()) {
            return submitted.asFailure();
        }
        String orderId = submitted.value().orderId();
        log.info("[OrderExecutor] {} {} {} submitted: orderId={} clientOrderId={}",
            side, quantity.toPlainString(), symbol, orderId, clientOrderId);
        return awaitFill(request, orderId);
    }

    /**
     * Run a gateway call with category-driven retries.
     */
    public <T> BrokerResult<T> withRetry(String operation, Supplier<BrokerResult<T>> call) {
        int rateLimitRetries = 0;
        while (true) {
            BrokerResult<T> result = call.get();
            if (result.isSuccess()) {
                reconnect.recordSuccess();
                return result;
            }

            ErrorCategory error = result.error();
            if (error == ErrorCategory.RATE_LIMITED) {
                if (rateLimitRetries >= config.maxRateLimitRetries()) {
                    log.warn("[OrderExecutor] {} still rate limited after {} retries", operation, rateLimitRetries);
                    return result;
                }
                rateLimitRetries++;
                metrics.recordRetry(operation, error, rateLimitRetries);
                if (!pause(config.rateLimitBackoff())) {
                    return BrokerResult.failure(ErrorCategory.CANCELLED, operation + " interrupted during backoff");
                }
            } else if (error == ErrorCategory.CONNECTION_ERROR) {
                Duration delay = reconnect.recordFailure();
                if (reconnect.isExhausted()) {
                    throw new EngineHaltedException("OrderExecutor",
                        operation + " failed after " + reconnect.getConsecutiveFailures()
                            + " connection attempts: " + result.reason());
                }
                metrics.recordRetry(operation, error, reconnect.getConsecutiveFailures());
                log.warn("[OrderExecutor] {} connection error (attempt {}/{}), retrying in {}ms: {}",
                    operation, reconnect.getConsecutiveFailures(), reconnect.getMaxAttempts(),
                    delay.toMillis(), result.reason());
                if (!pause(delay)) {
                    return BrokerResult.failure(ErrorCategory.CANCELLED, operation + " interrupted during reconnect");
                }
            } else {
                return result;
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // FILL WAIT
    // ═══════════════════════════════════════════════════════════════

    private BrokerResult<Fill> awaitFill(OrderRequest request, String orderId) {
        Instant deadline = clock.instant().plus(config.fillTimeout());
        while (true) {
            BrokerResult<OrderState> status;
            try {
                status = withRetry("get_order_status", () -> gateway.getOrderStatus(orderId));
            } catch (EngineHaltedException e) {
                log.error("[OrderExecutor] Lost connection while {} was working, cancelling before halt", orderId);
                throw new UnsettledOrderException(orderId,
                    cancelAndSettle(request, orderId, ErrorCategory.CONNECTION_ERROR), e);
            }
            if (status.error() == ErrorCategory.CANCELLED) {
                return cancelAndSettle(request, orderId, ErrorCategory.CANCELLED);
            }
            if (status.isSuccess()) {
                BrokerResult<Fill> settled = settle(request, status.value());
                if (settled != null) {
                    return settled;
                }
            } else {
                log.warn("[OrderExecutor] Status check for {} failed ({}): {}",
                    orderId, status.error(), status.reason());
            }

            if (!clock.instant().isBefore(deadline)) {
                log.warn("[OrderExecutor] Order {} not filled within {}ms, cancelling",
                    orderId, config.fillTimeoutMillis());
                return cancelAndSettle(request, orderId, ErrorCategory.ORDER_TIMEOUT);
            }
            if (!pause(config.fillPollInterval())) {
                return cancelAndSettle(request, orderId, ErrorCategory.CANCELLED);
            }
        }
    }

    /**
     * @return the final result for a terminal status, or null while the order is still working
     */
    private BrokerResult<Fill> settle(OrderRequest request, OrderState state) {
        OrderStatus status = state.status();
        if (status == OrderStatus.FILLED) {
            return BrokerResult.success(toFill(request, state, false));
        }
        if (status == OrderStatus.REJECTED) {
            return BrokerResult.failure(ErrorCategory.INVALID_REQUEST,
                "order " + state.orderId() + " rejected: " + state.message());
        }
        if (status == OrderStatus.CANCELLED) {
            if (state.hasFill()) {
                return BrokerResult.success(toFill(request, state, true));
            }
            return BrokerResult.failure(ErrorCategory.ORDER_TIMEOUT,
                "order " + state.orderId() + " cancelled by venue: " + state.message());
        }
        return null;
    }

    /**
     * Cancel a working order, then check once more so a late fill is kept.
     */
    private BrokerResult<Fill> cancelAndSettle(OrderRequest request, String orderId, ErrorCategory failure) {
        boolean interrupted = Thread.interrupted();
        try {
            BrokerResult<Void> cancelled = gateway.cancelOrder(orderId);
            if (!cancelled.isSuccess()) {
                log.warn("[OrderExecutor] Cancel of {} failed ({}): {}", orderId, cancelled.error(), cancelled.reason());
            }
            BrokerResult<OrderState> last = gateway.getOrderStatus(orderId);
            if (last.isSuccess() && last.value().hasFill()) {
                boolean partial = last.value().status() != OrderStatus.FILLED;
                log.info("[OrderExecutor] Order {} filled {} after cancel request",
                    orderId, last.value().filledQuantity().toPlainString());
                return BrokerResult.success(toFill(request, last.value(), partial));
            }
            if (!last.isSuccess()) {
                return BrokerResult.failure(failure,
                    "order " + orderId + " state unknown after cancel (" + last.error() + "): " + last.reason());
            }
            return BrokerResult.failure(failure, "order " + orderId + " cancelled without fill");
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private Fill toFill(OrderRequest request, OrderState state, boolean partial) {
        BigDecimal qty = state.filledQuantity() != null && state.filledQuantity().signum() > 0
            ? state.filledQuantity()
            : request.quantity();
        return new Fill(state.orderId(), request.symbol(), request.side(), qty,
            state.averageFillPrice(), clock.instant(), partial || qty.compareTo(request.quantity()) < 0);
    }

    private boolean pause(Duration delay) {
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
