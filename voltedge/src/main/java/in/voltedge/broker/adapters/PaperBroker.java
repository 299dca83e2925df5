package in.voltedge.broker.adapters;

import in.voltedge.broker.Broker;
import in.voltedge.broker.BrokerException;
import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.market.Bar;
import in.voltedge.domain.market.Timeframe;
import in.voltedge.domain.order.Account;
import in.voltedge.domain.order.BrokerPosition;
import in.voltedge.domain.order.OrderHandle;
import in.voltedge.domain.order.OrderRequest;
import in.voltedge.domain.order.OrderState;
import in.voltedge.domain.order.OrderStatus;
import in.voltedge.domain.trade.Side;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulated broker.
 *
 * Prices follow a seeded random walk per symbol, one step per minute, so two instances with the
 * same seed and clock produce the same bars. Market orders fill immediately at the last close
 * against a simulated cash account; short positions are allowed.
 */
public final class PaperBroker implements Broker {
    private static final Logger log = LoggerFactory.getLogger(PaperBroker.class);

    private static final int HISTORY_MINUTES = 6_000;
    private static final double STEP_VOLATILITY = 0.002;
    private static final double BASE_VOLUME = 10_000.0;
    private static final double SURGE_PROBABILITY = 0.05;

    private final long seed;
    private final Clock clock;
    private final Instant origin;

    private final Map<String, List<Bar>> minuteBars = new ConcurrentHashMap<>();
    private final Map<String, OrderState> orders = new ConcurrentHashMap<>();
    private final Map<String, OrderHandle> byClientId = new ConcurrentHashMap<>();
    private final Map<String, Holding> holdings = new ConcurrentHashMap<>();
    private BigDecimal cash;

    private record Holding(BigDecimal quantity, BigDecimal averagePrice) {}

    public PaperBroker(BigDecimal startingCash, long seed, Clock clock) {
        this.cash = startingCash;
        this.seed = seed;
        this.clock = clock;
        this.origin = clock.instant().truncatedTo(ChronoUnit.MINUTES).minus(Duration.ofMinutes(HISTORY_MINUTES));
        log.info("[PAPER] Simulated broker ready: cash={} seed={}", startingCash.toPlainString(), seed);
    }

    @Override
    public String getBrokerCode() {
        return "PAPER";
    }

    // ═══════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<OrderHandle> submitOrder(OrderRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            OrderHandle existing = byClientId.get(request.clientOrderId());
            if (existing != null) {
                log.info("[PAPER] Duplicate clientOrderId {}, returning {}", request.clientOrderId(), existing.orderId());
                return existing;
            }
            List<Bar> bars = barsUpToNow(request.symbol());
            BigDecimal price = BigDecimal.valueOf(bars.get(bars.size() - 1).close());
            String orderId = "PAPER-" + UUID.randomUUID();
            fill(request, price);

            OrderHandle handle = new OrderHandle(orderId, request.clientOrderId(), clock.instant());
            byClientId.put(request.clientOrderId(), handle);
            orders.put(orderId, new OrderState(orderId, OrderStatus.FILLED, request.quantity(), price, "Filled"));
            log.info("[PAPER] {} {} {} filled @ {} ({})", request.side(), request.quantity().toPlainString(),
                request.symbol(), price.toPlainString(), orderId);
            return handle;
        });
    }

    @Override
    public CompletableFuture<OrderState> getOrderStatus(String orderId) {
        return CompletableFuture.supplyAsync(() -> {
            OrderState state = orders.get(orderId);
            if (state == null) {
                throw new BrokerException(ErrorCategory.INVALID_REQUEST, "get_order_status", "Order not found: " + orderId);
            }
            return state;
        });
    }

    @Override
    public CompletableFuture<Void> cancelOrder(String orderId) {
        return CompletableFuture.supplyAsync(() -> {
            OrderState state = orders.get(orderId);
            if (state == null) {
                throw new BrokerException(ErrorCategory.INVALID_REQUEST, "cancel_order", "Order not found: " + orderId);
            }
            if (!state.status().isTerminal()) {
                orders.put(orderId, new OrderState(orderId, OrderStatus.CANCELLED, state.filledQuantity(),
                    state.averageFillPrice(), "Cancelled"));
            }
            return null;
        });
    }

    private synchronized void fill(OrderRequest request, BigDecimal price) {
        BigDecimal signedQty = request.side() == Side.BUY ? request.quantity() : request.quantity().negate();
        BigDecimal cost = signedQty.multiply(price);
        if (request.side() == Side.BUY && cost.compareTo(cash) > 0) {
            throw new BrokerException(ErrorCategory.INSUFFICIENT_FUNDS, "submit_order",
                "cost " + cost.toPlainString() + " exceeds cash " + cash.toPlainString());
        }
        cash = cash.subtract(cost);

        Holding h = holdings.getOrDefault(request.symbol(), new Holding(BigDecimal.ZERO, BigDecimal.ZERO));
        BigDecimal newQty = h.quantity().add(signedQty);
        BigDecimal avg;
        if (newQty.signum() == 0) {
            holdings.remove(request.symbol());
            return;
        } else if (h.quantity().signum() == 0 || h.quantity().signum() != newQty.signum()) {
            avg = price;
        } else if (h.quantity().signum() == signedQty.signum()) {
            avg = h.quantity().multiply(h.averagePrice()).add(signedQty.multiply(price))
                .divide(newQty, 8, RoundingMode.HALF_UP);
        } else {
            avg = h.averagePrice();
        }
        holdings.put(request.symbol(), new Holding(newQty, avg));
    }

    // ═══════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<List<Bar>> getRecentBars(String symbol, Timeframe timeframe, int limit) {
        return CompletableFuture.supplyAsync(() -> {
            if (limit < 1) {
                throw new BrokerException(ErrorCategory.INVALID_REQUEST, "get_recent_bars", "limit must be positive");
            }
            List<Bar> minutes = barsUpToNow(symbol);
            List<Bar> aggregated = timeframe == Timeframe.ONE_MIN ? minutes : aggregate(minutes, timeframe.getMinutes());
            int from = Math.max(0, aggregated.size() - limit);
            return List.copyOf(aggregated.subList(from, aggregated.size()));
        });
    }

    static List<Bar> aggregate(List<Bar> minutes, int size) {
        List<Bar> out = new ArrayList<>();
        for (int start = minutes.size() % size; start + size <= minutes.size(); start += size) {
            Bar first = minutes.get(start);
            double high = first.high();
            double low = first.low();
            double volume = 0.0;
            for (int i = start; i < start + size; i++) {
                Bar b = minutes.get(i);
                high = Math.max(high, b.high());
                low = Math.min(low, b.low());
                volume += b.volume();
            }
            Bar last = minutes.get(start + size - 1);
            out.add(new Bar(first.timestamp(), first.open(), high, low, last.close(), volume));
        }
        return out;
    }

    /**
     * Extends the symbol's minute series up to the current minute.
     */
    private List<Bar> barsUpToNow(String symbol) {
        List<Bar> bars = minuteBars.computeIfAbsent(symbol, s -> new ArrayList<>());
        synchronized (bars) {
            Instant now = clock.instant().truncatedTo(ChronoUnit.MINUTES);
            long target = Duration.between(origin, now).toMinutes() + 1;
            Random random = new Random(seed ^ ((long) symbol.hashCode() << 32) ^ bars.size());
            double close = bars.isEmpty() ? startingPrice(symbol) : bars.get(bars.size() - 1).close();
            while (bars.size() < target) {
                double open = close;
                close = open * Math.exp(random.nextGaussian() * STEP_VOLATILITY);
                double wick = Math.abs(random.nextGaussian()) * STEP_VOLATILITY / 2;
                double high = Math.max(open, close) * (1 + wick);
                double low = Math.min(open, close) * (1 - wick);
                double volume = BASE_VOLUME * (0.5 + random.nextDouble());
                if (random.nextDouble() < SURGE_PROBABILITY) {
                    volume *= 2.5 + random.nextDouble();
                }
                bars.add(new Bar(origin.plus(Duration.ofMinutes(bars.size())), open, high, low, close, volume));
            }
            return List.copyOf(bars);
        }
    }

    private double startingPrice(String symbol) {
        return 10.0 + Math.floorMod(symbol.hashCode() ^ seed, 990L);
    }

    // ═══════════════════════════════════════════════════════════════
    // ACCOUNT
    // ═══════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<Account> getAccount() {
        return CompletableFuture.supplyAsync(() -> {
            BigDecimal holdingsValue = BigDecimal.ZERO;
            for (Map.Entry<String, Holding> e : holdings.entrySet()) {
                List<Bar> bars = barsUpToNow(e.getKey());
                holdingsValue = holdingsValue.add(
                    e.getValue().quantity().multiply(BigDecimal.valueOf(bars.get(bars.size() - 1).close())));
            }
            synchronized (this) {
                return new Account(cash, cash.max(BigDecimal.ZERO), cash.add(holdingsValue));
            }
        });
    }

    @Override
    public CompletableFuture<List<BrokerPosition>> listPositions() {
        return CompletableFuture.supplyAsync(() -> holdings.entrySet().stream()
            .map(e -> new BrokerPosition(e.getKey(),
                e.getValue().quantity().signum() > 0 ? Side.BUY : Side.SELL,
                e.getValue().quantity().abs(), e.getValue().averagePrice()))
            .toList());
    }
}
