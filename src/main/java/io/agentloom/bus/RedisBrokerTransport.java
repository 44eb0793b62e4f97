package io.agentloom.bus;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Redis pub/sub transport. Publishing and subscribing use separate connections
 * because a subscribed Redis connection cannot issue regular commands.
 */
public final class RedisBrokerTransport implements BrokerTransport {
    private static final Logger log = LoggerFactory.getLogger(RedisBrokerTransport.class);
    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> publisher;
    private final StatefulRedisPubSubConnection<String, String> subscriber;

    private RedisBrokerTransport(
            RedisClient client,
            StatefulRedisConnection<String, String> publisher,
            StatefulRedisPubSubConnection<String, String> subscriber
    ) {
        this.client = client;
        this.publisher = publisher;
        this.subscriber = subscriber;
    }

    public static RedisBrokerTransport connect(String redisUrl) {
        if (redisUrl == null || redisUrl.isBlank()) {
            throw new IllegalArgumentException("redis url cannot be empty");
        }
        RedisURI uri = RedisURI.create(redisUrl.trim());
        uri.setTimeout(COMMAND_TIMEOUT);
        RedisClient client = RedisClient.create(uri);
        try {
            StatefulRedisConnection<String, String> publisher = client.connect();
            StatefulRedisPubSubConnection<String, String> subscriber = client.connectPubSub();
            log.info("Connected to Redis broker at {}:{}", uri.getHost(), uri.getPort());
            return new RedisBrokerTransport(client, publisher, subscriber);
        } catch (RuntimeException e) {
            client.shutdown();
            throw e;
        }
    }

    @Override
    public void publish(String channel, String message) {
        publisher.sync().publish(channel, message);
    }

    @Override
    public void subscribePattern(String pattern, MessageListener listener) {
        subscriber.addListener(new RedisPubSubAdapter<>() {
            @Override
            public void message(String subscribedPattern, String channel, String message) {
                listener.onMessage(channel, message);
            }
        });
        subscriber.sync().psubscribe(pattern);
        log.info("Subscribed to Redis pattern {}", pattern);
    }

    @Override
    public void close() {
        try {
            subscriber.close();
            publisher.close();
        } finally {
            client.shutdown();
        }
    }
}
