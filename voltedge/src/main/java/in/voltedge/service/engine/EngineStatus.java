package in.voltedge.service.engine;

import in.voltedge.domain.trade.Position;
import in.voltedge.service.execution.SessionStats;
import in.voltedge.service.risk.RiskState;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view served by the health endpoint.
 */
public record EngineStatus(
    boolean running,
    boolean halted,
    String haltReason,
    boolean dryRun,
    Instant startedAt,
    Instant lastScanAt,
    int lastSignalCount,
    List<Position> positions,
    RiskState risk,
    SessionStats.Snapshot session,
    double rateUtilization,
    int unexpectedErrors
) {}
