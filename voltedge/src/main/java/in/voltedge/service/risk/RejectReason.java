package in.voltedge.service.risk;

/**
 * Why an entry was not attempted.
 */
public enum RejectReason {
    DAILY_LOSS_LIMIT,       // Loss for the day reached the limit
    MAX_POSITIONS,          // Concurrent position cap reached
    POSITION_EXISTS,        // Symbol already held or in flight
    VOLUME_NOT_CONFIRMED,   // Volume filter did not confirm
    MTF_NO_DATA,            // No timeframe signals cached for the symbol
    MTF_DISAGREES,          // Consensus direction differs from the signal
    ZERO_QUANTITY,          // Sized to nothing
    SYMBOL_BUSY             // Another thread holds the symbol lock
}
