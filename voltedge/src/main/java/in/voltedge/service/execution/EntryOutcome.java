package in.voltedge.service.execution;

import in.voltedge.domain.common.ErrorCategory;
import in.voltedge.domain.trade.Position;
import in.voltedge.service.risk.RejectReason;

/**
 * Result of one entry attempt: opened, rejected before any order, or failed at the broker.
 */
public record EntryOutcome(
    boolean opened,
    Position position,
    RejectReason rejectReason,
    ErrorCategory error,
    String detail
) {
    public static EntryOutcome opened(Position position) {
        return new EntryOutcome(true, position, null, null, null);
    }

    public static EntryOutcome rejected(RejectReason reason) {
        return new EntryOutcome(false, null, reason, null, reason.name());
    }

    public static EntryOutcome failed(Position position, ErrorCategory error, String detail) {
        return new EntryOutcome(false, position, null, error, detail);
    }
}
