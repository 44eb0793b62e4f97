package io.agentloom.bus;

import io.agentloom.event.AgentEvent;
import io.agentloom.event.EventHandler;
import io.agentloom.event.EventPayload;
import io.agentloom.event.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cross-process bus. Events are published on {@code <prefix><type>} and every
 * node listens on {@code <prefix>*}. Inbound events are queued by the transport
 * thread and only handed to handlers from {@link #dispatchPending()}, so handlers
 * run on the scheduler thread.
 *
 * <p>A node receives its own broadcasts back through the pattern subscription and
 * dispatches them like any remote event.
 */
public final class BrokerEventBus implements EventBus {
    private static final Logger log = LoggerFactory.getLogger(BrokerEventBus.class);

    public static final String DEFAULT_CHANNEL_PREFIX = "agentloom:";

    private final BrokerTransport transport;
    private final String channelPrefix;
    private final HandlerRegistry handlers = new HandlerRegistry();
    private final Queue<AgentEvent> inbound = new ConcurrentLinkedQueue<>();
    private final AtomicLong publishFailures = new AtomicLong(0L);
    private final AtomicLong decodeFailures = new AtomicLong(0L);

    public BrokerEventBus(BrokerTransport transport) {
        this(transport, DEFAULT_CHANNEL_PREFIX);
    }

    public BrokerEventBus(BrokerTransport transport, String channelPrefix) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        this.transport = transport;
        this.channelPrefix = channelPrefix == null || channelPrefix.isBlank()
                ? DEFAULT_CHANNEL_PREFIX
                : channelPrefix;
        try {
            transport.subscribePattern(this.channelPrefix + "*", this::onMessage);
        } catch (RuntimeException e) {
            log.error("Failed to subscribe to {}*; remote events will not be received", this.channelPrefix, e);
        }
    }

    public String channelFor(EventType type) {
        return channelPrefix + type.wireName();
    }

    @Override
    public void subscribe(EventType type, EventHandler handler) {
        handlers.add(type, handler);
    }

    @Override
    public AgentEvent emit(EventType type, String emittedBy, EventPayload payload) {
        AgentEvent event = AgentEvent.create(type, emittedBy, payload);
        String channel = channelFor(type);
        try {
            transport.publish(channel, AgentEventCodec.encode(event));
            log.debug("Published {} by {} to {}", type.wireName(), emittedBy, channel);
        } catch (RuntimeException e) {
            publishFailures.incrementAndGet();
            log.warn("Dropped {} event {}: publish to {} failed: {}", type.wireName(), event.id(), channel, e.getMessage());
        }
        return event;
    }

    @Override
    public int dispatchPending() {
        int dispatched = 0;
        AgentEvent event;
        while ((event = inbound.poll()) != null) {
            handlers.dispatch(event);
            dispatched++;
        }
        return dispatched;
    }

    public int pendingCount() {
        return inbound.size();
    }

    public long publishFailures() {
        return publishFailures.get();
    }

    public long decodeFailures() {
        return decodeFailures.get();
    }

    @Override
    public void close() {
        transport.close();
    }

    private void onMessage(String channel, String message) {
        try {
            inbound.add(AgentEventCodec.decode(message));
        } catch (IllegalArgumentException e) {
            decodeFailures.incrementAndGet();
            log.warn("Dropped unreadable message on {}: {}", channel, e.getMessage());
        }
    }
}
