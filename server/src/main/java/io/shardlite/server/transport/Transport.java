// file: server/src/main/java/io/shardlite/server/transport/Transport.java
package io.shardlite.server.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Point-to-point, at-least-once-capable message transport between regions and
 * the coordinator.
 * <p>
 * Addresses:
 *  - a region is addressed by its region id (the node id);
 *  - the coordinator by {@code <nodeId>/coordinator}, see {@link #coordinatorAddress}.
 * <p>
 * Contract:
 *  - send() never blocks the caller on the network. The returned future
 *    completes once the receiver's sink has the message, or fails with
 *    {@link io.shardlite.core.exception.TransportException} (transient) or
 *    {@link io.shardlite.core.exception.MessageEncodingException} (permanent).
 *  - Order is preserved per (from, to) pair. A failed send fails the sends to
 *    the same node that were queued behind it, so no later message overtakes it.
 */
public interface Transport extends AutoCloseable {

    String COORDINATOR_SUFFIX = "/coordinator";

    static String coordinatorAddress(String nodeId) {
        return nodeId + COORDINATOR_SUFFIX;
    }

    /** The node part of an address: everything before the first '/'. */
    static String nodeOf(String address) {
        int slash = address.indexOf('/');
        return slash < 0 ? address : address.substring(0, slash);
    }

    void bind(String address, MessageSink sink);

    void unbind(String address);

    CompletableFuture<Void> send(String from, String to, Object message);

    @Override
    default void close() {
    }
}
