package in.voltedge.service.core;

import in.voltedge.domain.common.EngineEvent;

/**
 * Destination for engine events. Implementations must not block the caller for long.
 */
@FunctionalInterface
public interface EventSink {
    void accept(EngineEvent event);
}
