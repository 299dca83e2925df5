package in.voltedge.domain.common;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One observable change inside the engine.
 *
 * {@code before} and {@code after} are JSON snapshots of whatever changed; either may be null.
 */
public record EngineEvent(
    long seq,
    EventType type,
    String symbol,
    String component,
    JsonNode before,
    JsonNode after,
    Instant timestamp
) {}
