package in.voltedge.service.core;

import in.voltedge.domain.common.EngineEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the last N events in memory for the health endpoint and for tests.
 */
public final class RecentEventBuffer implements EventSink {

    private final int capacity;
    private final Deque<EngineEvent> events = new ArrayDeque<>();

    public RecentEventBuffer(int capacity) {
        this.capacity = capacity;
    }

    @Override
    public synchronized void accept(EngineEvent event) {
        if (events.size() == capacity) {
            events.removeFirst();
        }
        events.addLast(event);
    }

    public synchronized List<EngineEvent> snapshot() {
        return new ArrayList<>(events);
    }
}
