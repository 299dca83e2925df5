package in.voltedge.domain.order;

import java.time.Instant;

public record OrderHandle(String orderId, String clientOrderId, Instant submittedAt) {}
