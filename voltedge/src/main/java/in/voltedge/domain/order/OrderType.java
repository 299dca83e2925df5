package in.voltedge.domain.order;

public enum OrderType {
    MARKET,
    LIMIT
}
