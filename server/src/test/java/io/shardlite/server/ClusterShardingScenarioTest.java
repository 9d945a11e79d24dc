// file: server/src/test/java/io/shardlite/server/ClusterShardingScenarioTest.java
package io.shardlite.server;

import io.shardlite.core.HashCodeMessageExtractor;
import io.shardlite.core.ShardingEnvelope;
import io.shardlite.core.allocation.LeastShardAllocationStrategy;
import io.shardlite.core.state.CoordinatorEvent;
import io.shardlite.server.config.ShardingSettings;
import io.shardlite.server.coordinator.ShardCoordinator;
import io.shardlite.server.membership.StaticMembership;
import io.shardlite.server.region.RegionState;
import io.shardlite.server.region.ShardRegion;
import io.shardlite.server.runtime.Dispatchers;
import io.shardlite.server.testkit.ManualScheduler;
import io.shardlite.server.testkit.RecordingEntity;
import io.shardlite.server.testkit.TestDispatchers;
import io.shardlite.server.transport.LocalTransport;
import io.shardlite.server.transport.MessageSerializer;
import io.shardlite.server.transport.Transport;
import io.shardlite.storage.InMemoryEventJournal;
import io.shardlite.storage.InMemoryRememberEntitiesStore;
import io.shardlite.storage.InMemorySnapshotter;
import io.shardlite.storage.RememberEntitiesStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Coordinator and regions wired together over an in-process transport that
 * round-trips every message through its wire encoding.
 */
class ClusterShardingScenarioTest {

    private static final String COORD = Transport.coordinatorAddress("c");

    private final ManualScheduler scheduler = new ManualScheduler();
    private final LocalTransport transport = new LocalTransport(new MessageSerializer());
    private final StaticMembership membership = new StaticMembership(List.of("r1", "r2"));
    private final HashCodeMessageExtractor extractor = HashCodeMessageExtractor.forEnvelopes(10);
    private final RecordingEntity.Log log = new RecordingEntity.Log();
    private final InMemoryEventJournal<CoordinatorEvent> journal = new InMemoryEventJournal<>();
    private final List<Object> undelivered = new ArrayList<>();

    /** Work queued by region r1; it only runs when the test calls {@link #settle()}. */
    private final Queue<Runnable> r1Work = new ArrayDeque<>();

    private ShardingSettings settings = ShardingSettings.defaults().withPassivateIdleAfter(Duration.ZERO);

    private ShardCoordinator startCoordinator() {
        var c = new ShardCoordinator(COORD, settings,
                new LeastShardAllocationStrategy(settings.rebalanceThreshold(), settings.maxSimultaneousRebalance()),
                journal, new InMemorySnapshotter(), transport, membership, TestDispatchers.direct(scheduler),
                cause -> fail("coordinator died: " + cause));
        c.start();
        return c;
    }

    private ShardRegion startRegion(String regionId, Dispatchers dispatchers, RememberEntitiesStore store) {
        var region = new ShardRegion(regionId, extractor, RecordingEntity.factory(log), settings, transport, COORD,
                membership, store, null, dispatchers, (m, why) -> undelivered.add(m));
        region.start();
        return region;
    }

    private Dispatchers queued() {
        return new Dispatchers(r1Work::add, Runnable::run, scheduler);
    }

    private void settle() {
        Runnable next;
        while ((next = r1Work.poll()) != null) {
            next.run();
        }
    }

    /** First {@code n} entity ids that land in distinct shards, keyed by shard. */
    private Map<String, String> entitiesInDistinctShards(int n) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; out.size() < n; i++) {
            out.putIfAbsent(extractor.shardIdForEntity("e" + i), "e" + i);
        }
        return out;
    }

    private String sameShardAs(String entityId) {
        String shard = extractor.shardIdForEntity(entityId);
        for (int i = 0; ; i++) {
            String candidate = "x" + i;
            if (extractor.shardIdForEntity(candidate).equals(shard)) return candidate;
        }
    }

    private static <T> T await(CompletableFuture<T> f) {
        assertTrue(f.isDone(), "future should have completed");
        return f.join();
    }

    @Test
    void first_message_allocates_to_the_only_region_and_later_messages_reuse_the_entity() {
        ShardCoordinator c = startCoordinator();
        ShardRegion r1 = startRegion("r1", queued(), null);
        settle();

        r1.tell(new ShardingEnvelope("a", "hello"));
        settle();
        r1.tell(new ShardingEnvelope("a", "again"));
        settle();

        assertEquals(List.of("start@r1", "msg:hello", "msg:again"), log.of("a"));
        assertEquals("r1", c.currentState().ownerOf(extractor.shardIdForEntity("a")));
        assertTrue(undelivered.isEmpty());
    }

    @Test
    void rebalanced_shard_is_only_hosted_by_the_new_region_after_the_old_one_stopped_it() {
        ShardCoordinator c = startCoordinator();
        ShardRegion r1 = startRegion("r1", queued(), null);
        settle();
        Map<String, String> byShard = entitiesInDistinctShards(3);
        for (String entityId : byShard.values()) {
            r1.tell(new ShardingEnvelope(entityId, "hello"));
        }
        settle();
        assertEquals(3, c.currentState().shardsOf("r1").size());

        ShardRegion r2 = startRegion("r2", TestDispatchers.direct(scheduler), null);
        scheduler.advance(settings.rebalanceInterval());

        Set<String> moving = c.currentState().handOffInProgress();
        assertEquals(1, moving.size());
        String shard = moving.iterator().next();
        String entity = byShard.get(shard);

        // r1 has not processed BeginHandOff yet: r2's request waits at the coordinator
        r2.tell(new ShardingEnvelope(entity, "moved"));
        assertFalse(log.of(entity).contains("start@r2"));

        settle();

        assertEquals(List.of("start@r1", "msg:hello", "stop", "start@r2", "msg:moved"), log.of(entity));
        assertEquals("r2", c.currentState().ownerOf(shard));
        assertEquals(Set.of(), c.currentState().handOffInProgress());
        assertEquals(Set.of(shard), await(r2.currentState()).shards().keySet());
        assertTrue(undelivered.isEmpty());
    }

    @Test
    void remembered_entities_are_recreated_when_their_shard_moves() {
        settings = settings.withRememberEntities(true);
        RememberEntitiesStore shared = new InMemoryRememberEntitiesStore();
        ShardCoordinator c = startCoordinator();
        ShardRegion r1 = startRegion("r1", TestDispatchers.direct(scheduler), shared);
        String a = "a";
        String b = sameShardAs(a);
        String shard = extractor.shardIdForEntity(a);
        r1.tell(new ShardingEnvelope(a, "one"));
        r1.tell(new ShardingEnvelope(b, "two"));

        ShardRegion r2 = startRegion("r2", TestDispatchers.direct(scheduler), shared);
        await(r1.gracefulShutdown());

        // nobody sent them anything: the shard brought them back on start
        assertEquals(List.of("start@r1", "msg:one", "stop", "start@r2"), log.of(a));
        assertEquals(List.of("start@r1", "msg:two", "stop", "start@r2"), log.of(b));
        assertEquals("r2", c.currentState().ownerOf(shard));
        RegionState state = await(r2.currentState());
        assertEquals(Set.of(a, b), state.shards().get(shard));
        assertFalse(c.currentState().isRegistered("r1"));
    }
}
