package io.agentloom.bus;

import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventHandler;
import io.agentloom.event.EventPayload;
import io.agentloom.event.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local bus: {@link #emit} runs every matching handler on the caller's thread
 * before returning.
 */
public final class InProcessEventBus implements EventBus {
    private static final Logger log = LoggerFactory.getLogger(InProcessEventBus.class);

    private final HandlerRegistry handlers = new HandlerRegistry();

    @Override
    public void subscribe(EventType type, EventHandler handler) {
        handlers.add(type, handler);
    }

    @Override
    public AgentEvent emit(EventType type, String emittedBy, EventPayload payload) {
        AgentEvent event = AgentEvent.create(type, emittedBy, payload);
        int delivered = handlers.dispatch(event);
        log.debug("Emitted {} by {} to {} handler(s)", type.wireName(), emittedBy, delivered);
        return event;
    }
}
