package io.agentloom.bus;

import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded newest-first log of delivered events, for status views.
 */
public final class RecentEvents {
    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<AgentEvent> events;

    public RecentEvents(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.events = new ArrayDeque<>(this.capacity);
    }

    public static RecentEvents attach(EventBus bus, int capacity) {
        RecentEvents recent = new RecentEvents(capacity);
        for (EventType type : EventType.values()) {
            bus.subscribe(type, recent::record);
        }
        return recent;
    }

    public synchronized void record(AgentEvent event) {
        events.addFirst(event);
        while (events.size() > capacity) {
            events.removeLast();
        }
    }

    public synchronized List<AgentEvent> newestFirst() {
        return List.copyOf(events);
    }

    public int capacity() {
        return capacity;
    }
}
