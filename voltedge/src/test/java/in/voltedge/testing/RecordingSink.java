package in.voltedge.testing;

import in.voltedge.domain.common.EngineEvent;
import in.voltedge.domain.common.EventType;
import in.voltedge.service.core.EventSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Collects emitted events for assertions.
 */
public final class RecordingSink implements EventSink {

    private final List<EngineEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void accept(EngineEvent event) {
        events.add(event);
    }

    public List<EngineEvent> all() {
        return List.copyOf(events);
    }

    public List<EngineEvent> ofType(EventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }
}
