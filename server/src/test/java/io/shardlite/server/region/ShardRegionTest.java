// file: server/src/test/java/io/shardlite/server/region/ShardRegionTest.java
package io.shardlite.server.region;

import io.shardlite.core.HashCodeMessageExtractor;
import io.shardlite.core.ShardingEnvelope;
import io.shardlite.core.StartEntity;
import io.shardlite.core.exception.DeliveryFailedException;
import io.shardlite.core.exception.MessageEncodingException;
import io.shardlite.core.exception.ShardingException;
import io.shardlite.core.exception.UnknownPartitionException;
import io.shardlite.core.protocol.ShardingProtocol;
import io.shardlite.server.config.ShardingSettings;
import io.shardlite.server.membership.StaticMembership;
import io.shardlite.server.runtime.Dispatchers;
import io.shardlite.server.testkit.ManualScheduler;
import io.shardlite.server.testkit.RecordingEntity;
import io.shardlite.server.testkit.TestDispatchers;
import io.shardlite.server.transport.LocalTransport;
import io.shardlite.server.transport.MessageSerializer;
import io.shardlite.server.transport.Transport;
import io.shardlite.storage.InMemoryRememberEntitiesStore;
import io.shardlite.storage.RememberEntitiesStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * One region against a scripted coordinator: the test sees every control
 * message the region sends and answers by hand.
 */
class ShardRegionTest {

    private static final String COORD = Transport.coordinatorAddress("c");

    private final ManualScheduler scheduler = new ManualScheduler();
    private final LocalTransport transport = new LocalTransport();
    private final StaticMembership membership = new StaticMembership(List.of("r1", "r2"));
    private final HashCodeMessageExtractor extractor = HashCodeMessageExtractor.forEnvelopes(10);
    private final RecordingEntity.Log log = new RecordingEntity.Log();
    private final List<Object> toCoordinator = new ArrayList<>();
    private final List<Object> toR2 = new ArrayList<>();
    private final List<Object> undeliveredMessages = new ArrayList<>();
    private final List<ShardingException> undeliveredReasons = new ArrayList<>();

    private final String shardA = extractor.shardIdForEntity("a");

    ShardRegionTest() {
        transport.bind(COORD, (from, m) -> toCoordinator.add(m));
    }

    private ShardRegion start(ShardingSettings settings) {
        return start(settings, transport, TestDispatchers.direct(scheduler), null);
    }

    private ShardRegion start(ShardingSettings settings,
                              LocalTransport via,
                              Dispatchers dispatchers,
                              RememberEntitiesStore store) {
        var region = new ShardRegion("r1", extractor, RecordingEntity.factory(log), settings, via, COORD,
                membership, store, null, dispatchers, (m, why) -> {
                    undeliveredMessages.add(m);
                    undeliveredReasons.add(why);
                });
        region.start();
        via.send(COORD, "r1", new ShardingProtocol.RegisterAck(COORD));
        toCoordinator.clear();
        return region;
    }

    private ShardRegion start() {
        return start(ShardingSettings.defaults().withPassivateIdleAfter(Duration.ZERO));
    }

    private void reply(Object message) {
        transport.send(COORD, "r1", message);
    }

    private static void runAll(List<Runnable> work) {
        while (!work.isEmpty()) {
            work.remove(0).run();
        }
    }

    private long count(Class<?> type) {
        return toCoordinator.stream().filter(type::isInstance).count();
    }

    @Test
    void registers_on_start_and_retries_until_acked() {
        var region = new ShardRegion("r1", extractor, RecordingEntity.factory(log), ShardingSettings.defaults(),
                transport, COORD, membership, null, null, TestDispatchers.direct(scheduler), null);
        region.start();
        assertEquals(List.of(new ShardingProtocol.Register("r1")), toCoordinator);

        scheduler.advance(ShardingSettings.defaults().retryInterval());
        assertEquals(2, count(ShardingProtocol.Register.class));

        reply(new ShardingProtocol.RegisterAck(COORD));
        scheduler.advance(ShardingSettings.defaults().retryInterval().multipliedBy(3));
        assertEquals(2, count(ShardingProtocol.Register.class));
    }

    @Test
    void proxy_registers_as_proxy() {
        ShardRegion.proxy("p1", extractor, ShardingSettings.defaults(), transport, COORD, membership,
                TestDispatchers.direct(scheduler), null).start();
        assertEquals(List.of(new ShardingProtocol.RegisterProxy("p1")), toCoordinator);
    }

    @Test
    void buffers_while_resolving_and_asks_once_per_shard() {
        start();
        transportTell("a", "1");
        transportTell("a", "2");
        transportTell("a", "3");

        assertEquals(List.of(new ShardingProtocol.GetShardHome(shardA, "r1")), toCoordinator);
        assertTrue(log.events().isEmpty());

        reply(new ShardingProtocol.ShardHome(shardA, "r1"));

        assertEquals(List.of("start@r1", "msg:1", "msg:2", "msg:3"), log.of("a"));
    }

    @Test
    void known_owner_is_used_without_asking_again() {
        ShardRegion region = start();
        region.tell(new ShardingEnvelope("a", "1"));
        reply(new ShardingProtocol.ShardHome(shardA, "r1"));
        region.tell(new ShardingEnvelope("a", "2"));

        assertEquals(1, count(ShardingProtocol.GetShardHome.class));
        assertEquals(List.of("start@r1", "msg:1", "msg:2"), log.of("a"));
    }

    @Test
    void forwards_original_message_to_remote_owner() {
        transport.bind("r2", (from, m) -> toR2.add(m));
        ShardRegion region = start();
        var envelope = new ShardingEnvelope("a", "hello");
        region.tell(envelope);
        reply(new ShardingProtocol.ShardHome(shardA, "r2"));

        assertEquals(List.of(envelope), toR2);
        assertTrue(log.events().isEmpty());
    }

    @Test
    void failed_forward_re_resolves_then_fails_after_max_attempts() {
        ShardRegion region = start(ShardingSettings.defaults().withMaxDeliveryAttempts(2));
        region.tell(new ShardingEnvelope("a", "hello"));

        reply(new ShardingProtocol.ShardHome(shardA, "r2")); // r2 not bound: forward fails
        assertEquals(2, count(ShardingProtocol.GetShardHome.class));
        assertTrue(undeliveredMessages.isEmpty());

        reply(new ShardingProtocol.ShardHome(shardA, "r2"));
        assertEquals(1, undeliveredMessages.size());
        assertInstanceOf(DeliveryFailedException.class, undeliveredReasons.get(0));
        assertEquals(shardA, ((DeliveryFailedException) undeliveredReasons.get(0)).shardId());
    }

    @Test
    void a_message_that_cannot_be_encoded_fails_alone_and_the_rest_are_forwarded() {
        var wire = new LocalTransport(new MessageSerializer());
        wire.bind(COORD, (from, m) -> toCoordinator.add(m));
        wire.bind("r2", (from, m) -> toR2.add(m));
        ShardRegion region = start(ShardingSettings.defaults().withPassivateIdleAfter(Duration.ZERO), wire,
                TestDispatchers.direct(scheduler), null);
        var unsendable = new ShardingEnvelope("a", Duration.ofSeconds(1));
        var second = new ShardingEnvelope("a", "second");
        var third = new ShardingEnvelope("a", "third");
        region.tell(unsendable);
        region.tell(second);
        region.tell(third);

        wire.send(COORD, "r1", new ShardingProtocol.ShardHome(shardA, "r2"));

        assertEquals(List.of(second, third), toR2);
        assertEquals(List.of(unsendable), undeliveredMessages);
        var reason = assertInstanceOf(DeliveryFailedException.class, undeliveredReasons.get(0));
        assertInstanceOf(MessageEncodingException.class, reason.getCause());
        assertEquals(1, count(ShardingProtocol.GetShardHome.class), "nothing to re-resolve for a bad message");
    }

    @Test
    void buffer_overflow_fails_the_newest_message() {
        ShardRegion region = start(ShardingSettings.defaults().withBufferSize(2));
        region.tell(new ShardingEnvelope("a", "1"));
        region.tell(new ShardingEnvelope("a", "2"));
        var third = new ShardingEnvelope("a", "3");
        region.tell(third);

        assertEquals(List.of(third), undeliveredMessages);
        assertInstanceOf(DeliveryFailedException.class, undeliveredReasons.get(0));

        reply(new ShardingProtocol.ShardHome(shardA, "r1"));
        assertEquals(List.of("start@r1", "msg:1", "msg:2"), log.of("a"));
    }

    @Test
    void unroutable_message_is_reported_as_unknown_partition() {
        ShardRegion region = start();
        region.tell(42);

        assertEquals(List.of(42), undeliveredMessages);
        assertInstanceOf(UnknownPartitionException.class, undeliveredReasons.get(0));
        assertTrue(toCoordinator.isEmpty());
    }

    @Test
    void buffered_messages_fail_when_no_home_is_found() {
        ShardRegion region = start(ShardingSettings.defaults().withMaxResolveAttempts(2));
        region.tell(new ShardingEnvelope("a", "1"));
        scheduler.advance(ShardingSettings.defaults().retryInterval());
        assertEquals(2, count(ShardingProtocol.GetShardHome.class));
        assertTrue(undeliveredMessages.isEmpty());

        scheduler.advance(ShardingSettings.defaults().retryInterval());

        assertEquals(1, undeliveredMessages.size());
        assertInstanceOf(DeliveryFailedException.class, undeliveredReasons.get(0));
        assertEquals(2, count(ShardingProtocol.GetShardHome.class));
    }

    @Test
    void host_shard_starts_it_and_acknowledges() {
        ShardRegion region = start();
        reply(new ShardingProtocol.HostShard(shardA));
        assertEquals(List.of(new ShardingProtocol.ShardStarted(shardA, "r1")), toCoordinator);

        region.tell(new ShardingEnvelope("a", "hello"));
        assertEquals(List.of("start@r1", "msg:hello"), log.of("a"));
        assertEquals(0, count(ShardingProtocol.GetShardHome.class));
    }

    @Test
    void start_entity_creates_the_entity_without_a_message() {
        ShardRegion region = start();
        reply(new ShardingProtocol.HostShard(shardA));
        region.tell(new StartEntity("a"));

        assertEquals(List.of("start@r1"), log.of("a"));
    }

    @Test
    void handoff_acks_begin_then_stops_the_shard() throws Exception {
        ShardRegion region = start();
        reply(new ShardingProtocol.HostShard(shardA));
        region.tell(new ShardingEnvelope("a", "hello"));
        toCoordinator.clear();

        reply(new ShardingProtocol.BeginHandOff(shardA));
        assertEquals(List.of(new ShardingProtocol.BeginHandOffAck(shardA, "r1")), toCoordinator);

        reply(new ShardingProtocol.HandOff(shardA));
        assertTrue(toCoordinator.contains(new ShardingProtocol.ShardStopped(shardA, "r1")));
        assertEquals(List.of("start@r1", "msg:hello", "stop"), log.of("a"));
        assertEquals(Map.of(), region.currentState().get().shards());
    }

    @Test
    void messages_after_begin_handoff_are_buffered_until_the_new_home_is_known() {
        transport.bind("r2", (from, m) -> toR2.add(m));
        ShardRegion region = start();
        reply(new ShardingProtocol.HostShard(shardA));
        reply(new ShardingProtocol.BeginHandOff(shardA));
        reply(new ShardingProtocol.HandOff(shardA));
        toCoordinator.clear();

        var late = new ShardingEnvelope("a", "late");
        region.tell(late);
        assertEquals(List.of(new ShardingProtocol.GetShardHome(shardA, "r1")), toCoordinator);

        reply(new ShardingProtocol.ShardHome(shardA, "r2"));
        assertEquals(List.of(late), toR2);
    }

    @Test
    void messages_held_while_the_shard_starts_are_forwarded_before_later_ones_after_handoff() {
        transport.bind("r2", (from, m) -> toR2.add(m));
        List<Runnable> io = new ArrayList<>();
        ShardRegion region = start(ShardingSettings.defaults().withPassivateIdleAfter(Duration.ZERO), transport,
                new Dispatchers(Runnable::run, io::add, scheduler), new InMemoryRememberEntitiesStore());
        reply(new ShardingProtocol.HostShard(shardA)); // remembered entities still loading
        var first = new ShardingEnvelope("a", "1");
        var second = new ShardingEnvelope("a", "2");
        region.tell(first);
        region.tell(second);

        reply(new ShardingProtocol.BeginHandOff(shardA));
        var third = new ShardingEnvelope("a", "3");
        region.tell(third);
        reply(new ShardingProtocol.HandOff(shardA));
        reply(new ShardingProtocol.ShardHome(shardA, "r2"));

        assertEquals(List.of(first, second, third), toR2);
        assertTrue(log.events().isEmpty());
    }

    @Test
    void messages_waiting_for_the_remember_write_are_forwarded_before_later_ones_after_handoff() {
        transport.bind("r2", (from, m) -> toR2.add(m));
        List<Runnable> io = new ArrayList<>();
        ShardRegion region = start(ShardingSettings.defaults().withPassivateIdleAfter(Duration.ZERO), transport,
                new Dispatchers(Runnable::run, io::add, scheduler), new InMemoryRememberEntitiesStore());
        reply(new ShardingProtocol.HostShard(shardA));
        runAll(io);
        var first = new ShardingEnvelope("a", "1");
        var second = new ShardingEnvelope("a", "2");
        region.tell(first);
        region.tell(second);
        assertEquals(1, io.size(), "entity start not yet remembered");

        reply(new ShardingProtocol.BeginHandOff(shardA));
        var third = new ShardingEnvelope("a", "3");
        region.tell(third);
        reply(new ShardingProtocol.HandOff(shardA));
        reply(new ShardingProtocol.ShardHome(shardA, "r2"));

        assertEquals(List.of(first, second, third), toR2);
        assertTrue(log.events().isEmpty());
    }

    @Test
    void handoff_of_unknown_shard_is_acknowledged_immediately() {
        start();
        reply(new ShardingProtocol.HandOff("nope"));
        assertEquals(List.of(new ShardingProtocol.ShardStopped("nope", "r1")), toCoordinator);
    }

    @Test
    void graceful_shutdown_hands_off_then_reports_region_stopped() throws Exception {
        ShardRegion region = start();
        reply(new ShardingProtocol.HostShard(shardA));
        region.tell(new ShardingEnvelope("a", "hello"));
        toCoordinator.clear();

        CompletableFuture<Void> done = region.gracefulShutdown();
        assertEquals(List.of(new ShardingProtocol.GracefulShutdownRequest("r1")), toCoordinator);
        assertFalse(done.isDone());

        reply(new ShardingProtocol.HandOff(shardA));

        assertTrue(done.isDone());
        assertEquals(List.of(
                new ShardingProtocol.GracefulShutdownRequest("r1"),
                new ShardingProtocol.ShardStopped(shardA, "r1"),
                new ShardingProtocol.RegionStopped("r1")), toCoordinator);
        assertTrue(transport.send(COORD, "r1", new ShardingProtocol.HostShard(shardA)).isCompletedExceptionally(),
                "address unbound");
    }

    @Test
    void graceful_shutdown_without_shards_completes_at_once() {
        ShardRegion region = start();
        assertTrue(region.gracefulShutdown().isDone());
        assertEquals(List.of(new ShardingProtocol.RegionStopped("r1")), toCoordinator);
    }

    @Test
    void removed_region_is_dropped_from_the_cache() {
        transport.bind("r2", (from, m) -> toR2.add(m));
        ShardRegion region = start();
        region.tell(new ShardingEnvelope("a", "1"));
        reply(new ShardingProtocol.ShardHome(shardA, "r2"));
        assertEquals(1, count(ShardingProtocol.GetShardHome.class));

        membership.regionRemoved("r2");
        region.tell(new ShardingEnvelope("a", "2"));

        assertEquals(2, count(ShardingProtocol.GetShardHome.class));
        assertEquals(1, toR2.size());
    }

    @Test
    void state_lists_hosted_shards_and_live_entities() throws Exception {
        ShardRegion region = start();
        reply(new ShardingProtocol.HostShard(shardA));
        region.tell(new ShardingEnvelope("a", "1"));

        RegionState state = region.currentState().get();
        assertEquals("r1", state.regionId());
        assertFalse(state.proxy());
        assertEquals(Map.of(shardA, Set.of("a")), state.shards());
    }

    @Test
    void reports_entity_counts_of_local_shards_every_rebalance_interval() {
        ShardRegion region = start();
        reply(new ShardingProtocol.HostShard(shardA));
        String sameShard = IntStream.range(0, 1000).mapToObj(i -> "e" + i)
                .filter(id -> shardA.equals(extractor.shardIdForEntity(id)))
                .findFirst().orElseThrow();
        region.tell(new ShardingEnvelope("a", "1"));
        region.tell(new ShardingEnvelope(sameShard, "1"));
        toCoordinator.clear();

        scheduler.advance(ShardingSettings.defaults().rebalanceInterval());

        assertEquals(List.of(new ShardingProtocol.ShardSizes("r1", Map.of(shardA, 2))), toCoordinator);
    }

    @Test
    void stopped_region_reports_new_messages_as_undelivered() {
        ShardRegion region = start();
        region.stop();
        region.tell(new ShardingEnvelope("a", "1"));

        assertEquals(1, undeliveredMessages.size());
        assertInstanceOf(DeliveryFailedException.class, undeliveredReasons.get(0));
    }

    private void transportTell(String entityId, String text) {
        // arrives like a message forwarded by another region
        transport.send("r2", "r1", new ShardingEnvelope(entityId, text));
    }
}
