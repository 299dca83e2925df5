package in.voltedge.broker.adapters;

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
import in.voltedge.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PaperBroker.
 *
 * Tests:
 * - Deterministic bars per seed
 * - Higher timeframe aggregation
 * - Immediate fills, idempotent client order ids
 * - Cash checks and short positions
 */
class PaperBrokerTest {

    private MutableClock clock;
    private PaperBroker broker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:30Z");
        broker = new PaperBroker(new BigDecimal("100000"), 42, clock);
    }

    private static BrokerException cause(CompletionException e) {
        assertInstanceOf(BrokerException.class, e.getCause());
        return (BrokerException) e.getCause();
    }

    @Test
    void testBarsAreDeterministicPerSeed() {
        List<Bar> a = broker.getRecentBars("BTCUSD", Timeframe.ONE_MIN, 100).join();
        List<Bar> b = new PaperBroker(new BigDecimal("100000"), 42, clock)
            .getRecentBars("BTCUSD", Timeframe.ONE_MIN, 100).join();
        List<Bar> other = new PaperBroker(new BigDecimal("100000"), 7, clock)
            .getRecentBars("BTCUSD", Timeframe.ONE_MIN, 100).join();

        assertEquals(100, a.size());
        assertEquals(a, b);
        assertNotEquals(a, other);
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), a.get(99).timestamp());
        for (Bar bar : a) {
            assertTrue(bar.close() > 0);
            assertTrue(bar.high() >= Math.max(bar.open(), bar.close()));
            assertTrue(bar.low() <= Math.min(bar.open(), bar.close()));
        }
    }

    @Test
    void testSeriesExtendsWithClock() {
        Bar before = last(broker.getRecentBars("ETHUSD", Timeframe.ONE_MIN, 1).join());
        clock.advance(Duration.ofMinutes(5));
        Bar after = last(broker.getRecentBars("ETHUSD", Timeframe.ONE_MIN, 1).join());

        assertEquals(before.timestamp().plus(Duration.ofMinutes(5)), after.timestamp());
    }

    @Test
    void testHigherTimeframeBars() {
        List<Bar> fiveMin = broker.getRecentBars("SOLUSD", Timeframe.FIVE_MIN, 10).join();

        assertEquals(10, fiveMin.size());
        assertEquals(Duration.ofMinutes(5), Duration.between(fiveMin.get(0).timestamp(), fiveMin.get(1).timestamp()));
    }

    @Test
    void testAggregateDropsIncompleteLeadingBucket() {
        Instant t = Instant.parse("2024-03-01T00:00:00Z");
        List<Bar> minutes = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            minutes.add(new Bar(t.plusSeconds(60L * i), 10 + i, 11 + i, 9 + i, 10.5 + i, 100));
        }

        List<Bar> bars = PaperBroker.aggregate(minutes, 5);

        assertEquals(2, bars.size());
        Bar first = bars.get(0);
        assertEquals(t.plusSeconds(120), first.timestamp());
        assertEquals(12.0, first.open());
        assertEquals(17.0, first.high());
        assertEquals(11.0, first.low());
        assertEquals(16.5, first.close());
        assertEquals(500.0, first.volume());
    }

    @Test
    void testMarketOrderFillsAtLastClose() {
        double lastClose = last(broker.getRecentBars("BTCUSD", Timeframe.ONE_MIN, 1).join()).close();

        OrderHandle handle = broker.submitOrder(OrderRequest.market("c-1", "BTCUSD", Side.BUY, new BigDecimal("2")))
            .join();
        OrderState state = broker.getOrderStatus(handle.orderId()).join();

        assertEquals(OrderStatus.FILLED, state.status());
        assertEquals(0, BigDecimal.valueOf(lastClose).compareTo(state.averageFillPrice()));

        List<BrokerPosition> positions = broker.listPositions().join();
        assertEquals(1, positions.size());
        assertEquals(Side.BUY, positions.get(0).side());
        assertEquals(0, new BigDecimal("2").compareTo(positions.get(0).quantity()));

        Account account = broker.getAccount().join();
        BigDecimal cost = BigDecimal.valueOf(lastClose).multiply(new BigDecimal("2"));
        assertEquals(0, new BigDecimal("100000").subtract(cost).compareTo(account.cash()));
        assertEquals(0, new BigDecimal("100000").compareTo(account.equity()));
    }

    @Test
    void testDuplicateClientOrderIdIsIdempotent() {
        OrderRequest request = OrderRequest.market("c-dup", "ETHUSD", Side.BUY, BigDecimal.ONE);

        OrderHandle first = broker.submitOrder(request).join();
        OrderHandle second = broker.submitOrder(request).join();

        assertEquals(first.orderId(), second.orderId());
        assertEquals(0, BigDecimal.ONE.compareTo(broker.listPositions().join().get(0).quantity()));
    }

    @Test
    void testInsufficientFunds() {
        OrderRequest request = OrderRequest.market("c-big", "BTCUSD", Side.BUY, new BigDecimal("1000000"));

        CompletionException e = assertThrows(CompletionException.class, () -> broker.submitOrder(request).join());

        assertEquals(ErrorCategory.INSUFFICIENT_FUNDS, cause(e).getCategory());
        assertTrue(broker.listPositions().join().isEmpty());
    }

    @Test
    void testSellOpensShortAndBuyCloses() {
        broker.submitOrder(OrderRequest.market("c-s", "SOLUSD", Side.SELL, new BigDecimal("3"))).join();

        BrokerPosition shortPos = broker.listPositions().join().get(0);
        assertEquals(Side.SELL, shortPos.side());
        assertEquals(0, new BigDecimal("3").compareTo(shortPos.quantity()));

        broker.submitOrder(OrderRequest.market("c-b", "SOLUSD", Side.BUY, new BigDecimal("3"))).join();
        assertTrue(broker.listPositions().join().isEmpty());
    }

    @Test
    void testUnknownOrder() {
        CompletionException e = assertThrows(CompletionException.class,
            () -> broker.getOrderStatus("missing").join());
        assertEquals(ErrorCategory.INVALID_REQUEST, cause(e).getCategory());
    }

    private static Bar last(List<Bar> bars) {
        return bars.get(bars.size() - 1);
    }
}
