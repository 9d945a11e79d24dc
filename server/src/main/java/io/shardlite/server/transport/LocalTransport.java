// file: server/src/main/java/io/shardlite/server/transport/LocalTransport.java
package io.shardlite.server.transport;

import io.shardlite.core.exception.MessageEncodingException;
import io.shardlite.core.exception.TransportException;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * In-process {@link Transport}: every address lives in the same JVM.
 * <p>
 * Used for single-node deployments and tests. With a {@link MessageSerializer}
 * every message is round-tripped through its wire encoding, so serialization
 * problems show up without a network. Sends complete before send() returns.
 */
public final class LocalTransport implements Transport {
    private static final Logger log = Logger.getLogger(LocalTransport.class.getName());

    private final Map<String, MessageSink> sinks = new ConcurrentHashMap<>();
    private final Set<String> blocked = ConcurrentHashMap.newKeySet();
    private final MessageSerializer serializer;

    public LocalTransport() {
        this(null);
    }

    public LocalTransport(MessageSerializer serializer) {
        this.serializer = serializer;
    }

    @Override
    public void bind(String address, MessageSink sink) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(sink, "sink");
        if (sinks.putIfAbsent(address, sink) != null) {
            throw new IllegalStateException("address already bound: " + address);
        }
    }

    @Override
    public void unbind(String address) {
        sinks.remove(address);
    }

    /** Simulate an unreachable node: sends to any address on it fail until {@link #unblock}. */
    public void block(String nodeId) {
        blocked.add(nodeId);
    }

    public void unblock(String nodeId) {
        blocked.remove(nodeId);
    }

    @Override
    public CompletableFuture<Void> send(String from, String to, Object message) {
        if (blocked.contains(Transport.nodeOf(to))) {
            return CompletableFuture.failedFuture(
                    new TransportException(to, "node " + Transport.nodeOf(to) + " unreachable"));
        }
        MessageSink sink = sinks.get(to);
        if (sink == null) {
            return CompletableFuture.failedFuture(new TransportException(to, "no endpoint bound at " + to));
        }
        Object delivered = message;
        if (serializer != null) {
            try {
                MessageSerializer.Encoded e = serializer.encode(message);
                delivered = serializer.decode(e.type(), e.body());
            } catch (MessageEncodingException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        Object m = delivered;
        log.finest(() -> from + " -> " + to + ": " + m);
        sink.deliver(from, delivered);
        return CompletableFuture.completedFuture(null);
    }
}
