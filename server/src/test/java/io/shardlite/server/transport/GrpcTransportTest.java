// file: server/src/test/java/io/shardlite/server/transport/GrpcTransportTest.java
package io.shardlite.server.transport;

import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.shardlite.core.ShardingEnvelope;
import io.shardlite.core.exception.MessageEncodingException;
import io.shardlite.core.exception.TransportException;
import io.shardlite.core.protocol.ShardingProtocol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two nodes talking through in-process gRPC servers; the channel factory
 * treats each node's target as an in-process server name.
 */
class GrpcTransportTest {

    private record Delivery(String from, Object message) {
    }

    private final String nameA = InProcessServerBuilder.generateName();
    private final String nameB = InProcessServerBuilder.generateName();
    private final List<ManagedChannel> channels = new ArrayList<>();
    private final List<Delivery> atB = new ArrayList<>();
    private final List<Delivery> atA = new ArrayList<>();

    private GrpcTransport a;
    private GrpcTransport b;
    private Server serverA;
    private Server serverB;

    @BeforeEach
    void setUp() throws IOException {
        Map<String, String> targets = Map.of("a", nameA, "b", nameB);
        a = transport("a", targets);
        b = transport("b", targets);
        serverA = InProcessServerBuilder.forName(nameA).directExecutor().addService(a.service()).build().start();
        serverB = InProcessServerBuilder.forName(nameB).directExecutor().addService(b.service()).build().start();
        a.bind("a", (from, m) -> atA.add(new Delivery(from, m)));
        b.bind("b", (from, m) -> atB.add(new Delivery(from, m)));
    }

    private GrpcTransport transport(String nodeId, Map<String, String> targets) {
        return transport(nodeId, targets, Runnable::run);
    }

    private GrpcTransport transport(String nodeId, Map<String, String> targets, Executor sendExecutor) {
        return new GrpcTransport(nodeId, targets, new MessageSerializer(), Duration.ofSeconds(2), sendExecutor, target -> {
            ManagedChannel ch = InProcessChannelBuilder.forName(target).directExecutor().build();
            channels.add(ch);
            return ch;
        });
    }

    private static Throwable failure(CompletableFuture<Void> sent) {
        assertTrue(sent.isCompletedExceptionally(), "send should have failed");
        return assertThrows(ExecutionException.class, sent::get).getCause();
    }

    @AfterEach
    void tearDown() {
        a.close();
        b.close();
        channels.forEach(ManagedChannel::shutdownNow);
        serverA.shutdownNow();
        serverB.shutdownNow();
    }

    @Test
    void control_messages_cross_nodes_intact() {
        a.send("a/coordinator", "b", new ShardingProtocol.ShardHome("7", "a"));

        assertEquals(List.of(new Delivery("a/coordinator", new ShardingProtocol.ShardHome("7", "a"))), atB);
    }

    @Test
    void envelopes_keep_their_payload() {
        b.send("b", "a", new ShardingEnvelope("user-1", "hello"));

        assertEquals(1, atA.size());
        assertEquals(new ShardingEnvelope("user-1", "hello"), atA.get(0).message());
    }

    @Test
    void local_addresses_are_delivered_in_process_without_copying() {
        Object message = new ShardingEnvelope("user-1", "hello");
        a.send("a", "a", message);

        assertSame(message, atA.get(0).message());
        assertTrue(channels.isEmpty(), "no channel for local traffic");
    }

    @Test
    void one_channel_per_remote_node() {
        a.send("a", "b", new ShardingProtocol.HostShard("1"));
        a.send("a", "b", new ShardingProtocol.HostShard("2"));

        assertEquals(2, atB.size());
        assertEquals(1, channels.size());
    }

    @Test
    void unbound_remote_address_fails_the_send() {
        var e = failure(a.send("a", Transport.coordinatorAddress("b"), new ShardingProtocol.Register("a")));
        assertInstanceOf(TransportException.class, e);
        assertTrue(e.getMessage().contains("b/coordinator"));
    }

    @Test
    void unknown_node_fails_the_send() {
        assertInstanceOf(TransportException.class, failure(a.send("a", "zz", new ShardingProtocol.Register("a"))));
    }

    @Test
    void unreachable_node_fails_the_send() {
        serverB.shutdownNow();
        assertInstanceOf(TransportException.class, failure(a.send("a", "b", new ShardingProtocol.Register("a"))));
    }

    @Test
    void types_outside_the_allowed_packages_never_leave_the_node() {
        assertInstanceOf(MessageEncodingException.class, failure(a.send("a", "b", Duration.ofSeconds(1))));
        assertTrue(atB.isEmpty());
        assertTrue(channels.isEmpty());
    }

    @Test
    void sends_return_before_the_call_runs_and_keep_their_order() {
        List<Runnable> queued = new ArrayList<>();
        GrpcTransport c = transport("c", Map.of("b", nameB, "c", "unused"), queued::add);
        try {
            CompletableFuture<Void> first = c.send("c", "b", new ShardingProtocol.HostShard("1"));
            CompletableFuture<Void> second = c.send("c", "b", new ShardingProtocol.HostShard("2"));

            assertFalse(first.isDone());
            assertTrue(atB.isEmpty());
            assertEquals(1, queued.size(), "one lane per node");

            queued.remove(0).run();

            assertTrue(first.isDone() && second.isDone());
            assertEquals(List.of(new ShardingProtocol.HostShard("1"), new ShardingProtocol.HostShard("2")),
                    atB.stream().map(Delivery::message).toList());
        } finally {
            c.close();
        }
    }

    @Test
    void a_failed_call_fails_the_calls_queued_behind_it() {
        List<Runnable> queued = new ArrayList<>();
        GrpcTransport c = transport("c", Map.of("b", nameB, "c", "unused"), queued::add);
        try {
            CompletableFuture<Void> rejected = c.send("c", Transport.coordinatorAddress("b"), new ShardingProtocol.Register("c"));
            CompletableFuture<Void> behind = c.send("c", "b", new ShardingProtocol.HostShard("1"));

            queued.remove(0).run();

            assertInstanceOf(TransportException.class, failure(rejected));
            assertInstanceOf(TransportException.class, failure(behind));
            assertTrue(atB.isEmpty());
        } finally {
            c.close();
        }
    }

    @Test
    void binding_an_address_of_another_node_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> a.bind("b/coordinator", (from, m) -> { }));
    }
}
