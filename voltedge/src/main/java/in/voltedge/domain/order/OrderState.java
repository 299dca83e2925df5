package in.voltedge.domain.order;

import java.math.BigDecimal;

/**
 * Point-in-time order status with fill progress.
 */
public record OrderState(
    String orderId,
    OrderStatus status,
    BigDecimal filledQuantity,
    BigDecimal averageFillPrice,
    String message
) {
    public boolean hasFill() {
        return filledQuantity != null && filledQuantity.signum() > 0 && averageFillPrice != null;
    }
}
