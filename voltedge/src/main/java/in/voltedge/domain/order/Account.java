package in.voltedge.domain.order;

import java.math.BigDecimal;

public record Account(BigDecimal cash, BigDecimal buyingPower, BigDecimal equity) {}
