package io.agentloom.bus;

import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventHandler;
import io.agentloom.event.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-type handler lists shared by the bus implementations. Handlers run in
 * subscription order; a throwing handler is logged and does not stop the rest.
 */
final class HandlerRegistry {
    private static final Logger log = LoggerFactory.getLogger(HandlerRegistry.class);

    private final Map<EventType, List<EventHandler>> handlers = new EnumMap<>(EventType.class);

    synchronized void add(EventType type, EventHandler handler) {
        if (type == null) {
            throw new IllegalArgumentException("event type cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        handlers.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    }

    int dispatch(AgentEvent event) {
        List<EventHandler> targets;
        synchronized (this) {
            targets = handlers.get(event.type());
        }
        if (targets == null || targets.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (EventHandler handler : targets) {
            try {
                handler.handle(event);
                delivered++;
            } catch (RuntimeException e) {
                log.error("Handler for {} failed on event {} from {}",
                        event.type().wireName(), event.id(), event.emittedBy(), e);
            }
        }
        return delivered;
    }
}
