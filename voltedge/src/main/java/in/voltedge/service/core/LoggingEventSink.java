package in.voltedge.service.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import in.voltedge.domain.common.EngineEvent;
import in.voltedge.domain.common.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Writes each event as one JSON line. Failures and halts go to WARN, the rest to DEBUG.
 */
public final class LoggingEventSink implements EventSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    private static final Set<EventType> WARN_TYPES = EnumSet.of(
        EventType.ORDER_FAILED, EventType.RECONCILIATION_DRIFT, EventType.LOOP_ERROR, EventType.ENGINE_HALTED);

    @Override
    public void accept(EngineEvent event) {
        boolean warn = WARN_TYPES.contains(event.type());
        if (!warn && !log.isDebugEnabled()) {
            return;
        }
        String line;
        try {
            line = EventService.MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            line = event.toString();
        }
        if (warn) {
            log.warn("event {}", line);
        } else {
            log.debug("event {}", line);
        }
    }
}
