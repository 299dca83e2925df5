package in.voltedge.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.voltedge.domain.common.EngineEvent;
import in.voltedge.domain.common.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event Service.
 *
 * Turns before/after snapshots into JSON and fans them out to every registered sink.
 * The core depends only on this class, never on a transport.
 */
public final class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final List<EventSink> sinks;
    private final Clock clock;
    private final AtomicLong seq = new AtomicLong(0);

    public EventService(List<EventSink> sinks) {
        this(sinks, Clock.systemUTC());
    }

    public EventService(List<EventSink> sinks, Clock clock) {
        this.sinks = new CopyOnWriteArrayList<>(sinks);
        this.clock = clock;
    }

    public void addSink(EventSink sink) {
        sinks.add(sink);
    }

    // ═══════════════════════════════════════════════════════════════
    // EMIT
    // ═══════════════════════════════════════════════════════════════

    /**
     * Emit a change with before and after snapshots. Either snapshot may be null.
     */
    public EngineEvent emit(EventType type, String symbol, String component, Object before, Object after) {
        EngineEvent e = new EngineEvent(
            seq.incrementAndGet(), type, symbol, component,
            toJson(before), toJson(after), clock.instant()
        );
        publish(e);
        return e;
    }

    /**
     * Emit a fact with no previous state.
     */
    public EngineEvent emit(EventType type, String symbol, String component, Object payload) {
        return emit(type, symbol, component, null, payload);
    }

    public long currentSeq() {
        return seq.get();
    }

    // ═══════════════════════════════════════════════════════════════
    // INTERNAL
    // ═══════════════════════════════════════════════════════════════

    private void publish(EngineEvent e) {
        for (EventSink sink : sinks) {
            try {
                sink.accept(e);
            } catch (RuntimeException ex) {
                log.warn("[EventService] Sink {} failed on event seq={} type={}: {}",
                    sink.getClass().getSimpleName(), e.seq(), e.type(), ex.getMessage());
            }
        }
    }

    private static JsonNode toJson(Object pojo) {
        if (pojo == null) {
            return null;
        }
        return MAPPER.valueToTree(pojo);
    }
}
