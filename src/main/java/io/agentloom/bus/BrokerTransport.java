package io.agentloom.bus;

/**
 * Minimal pub/sub surface a networked bus needs from its broker.
 */
public interface BrokerTransport extends AutoCloseable {

    void publish(String channel, String message);

    /**
     * Starts delivering messages on every channel matching {@code pattern}.
     * The listener may be called from a transport-owned thread.
     */
    void subscribePattern(String pattern, MessageListener listener);

    @Override
    void close();

    @FunctionalInterface
    interface MessageListener {
        void onMessage(String channel, String message);
    }
}
