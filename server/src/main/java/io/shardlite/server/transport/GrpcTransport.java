// file: server/src/main/java/io/shardlite/server/transport/GrpcTransport.java
package io.shardlite.server.transport;

import com.google.protobuf.ByteString;
import io.grpc.BindableService;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.shardlite.core.exception.MessageEncodingException;
import io.shardlite.core.exception.TransportException;
import io.shardlite.server.transport.grpc.ShardingTransportGrpc;
import io.shardlite.server.transport.grpc.ShardingTransportProto;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * {@link Transport} between nodes over gRPC.
 * <p>
 * Responsibilities:
 *  - Addresses on the local node are delivered in-process, without a round trip.
 *  - Addresses on other nodes go through one lazily created channel per node.
 *    Each node has a send lane: its calls run one at a time on the send
 *    executor, as blocking unary calls with a deadline, so callers never wait
 *    on the network and per-node order holds.
 *  - A failed call fails the calls queued behind it on the same lane.
 *    RPC failures become {@link TransportException}; a body the receiver
 *    rejects (INVALID_ARGUMENT) becomes {@link MessageEncodingException}.
 *  - Incoming calls are served by {@link GrpcTransportService}, which must be
 *    registered on this node's gRPC server (see {@link #service()}).
 */
public final class GrpcTransport implements Transport {
    private static final Logger log = Logger.getLogger(GrpcTransport.class.getName());

    private final String localNodeId;
    private final Map<String, String> nodeTargets;
    private final MessageSerializer serializer;
    private final Duration requestTimeout;
    private final Executor sendExecutor;
    private final Function<String, ManagedChannel> channelFactory;
    private final Map<String, MessageSink> localSinks = new ConcurrentHashMap<>();
    private final Map<String, ManagedChannel> channels = new ConcurrentHashMap<>();
    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
    private final GrpcTransportService service;

    /**
     * Production constructor.
     *
     * @param nodeTargets  nodeId -> "host:grpcPort" for every node of the cluster
     * @param sendExecutor runs the blocking calls; may block, so not a mailbox executor
     */
    public GrpcTransport(String localNodeId,
                         Map<String, String> nodeTargets,
                         MessageSerializer serializer,
                         Duration requestTimeout,
                         Executor sendExecutor) {
        this(localNodeId, nodeTargets, serializer, requestTimeout, sendExecutor,
                target -> ManagedChannelBuilder.forTarget(target)
                        .usePlaintext() // internal traffic; terminate TLS at edge if needed
                        .build());
    }

    /**
     * Test constructor allowing pre-built channels (e.g., in-process).
     */
    public GrpcTransport(String localNodeId,
                         Map<String, String> nodeTargets,
                         MessageSerializer serializer,
                         Duration requestTimeout,
                         Executor sendExecutor,
                         Function<String, ManagedChannel> channelFactory) {
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId");
        this.nodeTargets = Map.copyOf(nodeTargets);
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.sendExecutor = Objects.requireNonNull(sendExecutor, "sendExecutor");
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
        this.service = new GrpcTransportService(localSinks, serializer);
    }

    /** Service to add to this node's gRPC server. */
    public BindableService service() {
        return service;
    }

    @Override
    public void bind(String address, MessageSink sink) {
        if (!Transport.nodeOf(address).equals(localNodeId)) {
            throw new IllegalArgumentException("cannot bind " + address + " on node " + localNodeId);
        }
        if (localSinks.putIfAbsent(address, sink) != null) {
            throw new IllegalStateException("address already bound: " + address);
        }
    }

    @Override
    public void unbind(String address) {
        localSinks.remove(address);
    }

    @Override
    public CompletableFuture<Void> send(String from, String to, Object message) {
        String node = Transport.nodeOf(to);
        if (node.equals(localNodeId)) {
            MessageSink sink = localSinks.get(to);
            if (sink == null) {
                return CompletableFuture.failedFuture(new TransportException(to, "no endpoint bound at " + to));
            }
            sink.deliver(from, message);
            return CompletableFuture.completedFuture(null);
        }

        String target = nodeTargets.get(node);
        if (target == null) {
            return CompletableFuture.failedFuture(new TransportException(to, "unknown node " + node));
        }
        MessageSerializer.Encoded encoded;
        try {
            encoded = serializer.encode(message);
        } catch (MessageEncodingException e) {
            return CompletableFuture.failedFuture(e);
        }
        var envelope = ShardingTransportProto.TransportEnvelope.newBuilder()
                .setFrom(from)
                .setTo(to)
                .setType(encoded.type())
                .setBody(ByteString.copyFrom(encoded.body()))
                .build();
        Outgoing out = new Outgoing(to, envelope, new CompletableFuture<>());
        lanes.computeIfAbsent(node, n -> new Lane(n, target)).enqueue(out);
        return out.result();
    }

    @Override
    public void close() {
        for (ManagedChannel ch : channels.values()) {
            ch.shutdown();
            try {
                if (!ch.awaitTermination(2, TimeUnit.SECONDS)) {
                    ch.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ch.shutdownNow();
            }
        }
        channels.clear();
    }

    private record Outgoing(String to,
                            ShardingTransportProto.TransportEnvelope envelope,
                            CompletableFuture<Void> result) {
    }

    /** Serial queue of calls to one node. */
    private final class Lane {
        private final String node;
        private final String target;
        private final Deque<Outgoing> queue = new ArrayDeque<>();
        private boolean running;

        Lane(String node, String target) {
            this.node = node;
            this.target = target;
        }

        void enqueue(Outgoing out) {
            synchronized (this) {
                queue.add(out);
                if (running) {
                    return;
                }
                running = true;
            }
            try {
                sendExecutor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                synchronized (this) {
                    running = false;
                }
                failQueued(new TransportException(out.to(), "transport is shut down", e));
            }
        }

        private void drain() {
            while (true) {
                Outgoing next;
                synchronized (this) {
                    next = queue.poll();
                    if (next == null) {
                        running = false;
                        return;
                    }
                }
                try {
                    ShardingTransportGrpc.newBlockingStub(channels.computeIfAbsent(node, n -> channelFactory.apply(target)))
                            .withDeadlineAfter(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                            .deliver(next.envelope());
                    next.result().complete(null);
                } catch (StatusRuntimeException sre) {
                    Outgoing failed = next;
                    log.fine(() -> "send " + failed.envelope().getType() + " to " + failed.to()
                            + " failed: " + sre.getStatus());
                    failed.result().completeExceptionally(toException(failed, sre));
                    failQueued(new TransportException(failed.to(),
                            "delivery to node " + node + " abandoned after an earlier failure", sre));
                }
            }
        }

        private void failQueued(RuntimeException cause) {
            List<Outgoing> behind;
            synchronized (this) {
                behind = new ArrayList<>(queue);
                queue.clear();
            }
            for (Outgoing o : behind) {
                o.result().completeExceptionally(cause);
            }
        }

        private RuntimeException toException(Outgoing out, StatusRuntimeException sre) {
            if (sre.getStatus().getCode() == Status.Code.INVALID_ARGUMENT) {
                return new MessageEncodingException(out.envelope().getType(),
                        "node " + node + " rejected " + out.envelope().getType(), sre);
            }
            return new TransportException(out.to(), "gRPC delivery to " + out.to() + " (" + target + ") failed", sre);
        }
    }
}
