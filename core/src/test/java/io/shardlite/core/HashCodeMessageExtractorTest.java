// file: core/src/test/java/io/shardlite/core/HashCodeMessageExtractorTest.java
package io.shardlite.core;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class HashCodeMessageExtractorTest {

    private record Greet(String user, String text) {
    }

    private final HashCodeMessageExtractor extractor = new HashCodeMessageExtractor(10) {
        @Override
        protected String entityIdOf(Object message) {
            return message instanceof Greet g ? g.user() : null;
        }
    };

    @Test
    void same_entity_always_maps_to_same_shard() {
        String a = extractor.shardIdForEntity("user-42");
        for (int i = 0; i < 5; i++) {
            assertEquals(a, HashCodeMessageExtractor.forEnvelopes(10).shardIdForEntity("user-42"));
        }
    }

    @Test
    void shard_ids_stay_within_range_and_spread() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            int shard = Integer.parseInt(extractor.shardIdForEntity("e-" + i));
            assertTrue(shard >= 0 && shard < 10, "shard " + shard);
            seen.add(Integer.toString(shard));
        }
        assertEquals(10, seen.size());
    }

    @Test
    void envelopes_are_unwrapped_and_custom_types_delegate() {
        var env = new ShardingEnvelope("u1", "hello");
        assertEquals("u1", extractor.entityId(env));
        assertEquals("hello", extractor.entityMessage(env));
        assertEquals(extractor.shardIdForEntity("u1"), extractor.shardId(env));

        var greet = new Greet("u2", "hi");
        assertEquals("u2", extractor.entityId(greet));
        assertSame(greet, extractor.entityMessage(greet));
    }

    @Test
    void unknown_messages_have_no_shard() {
        assertNull(extractor.entityId(42));
        assertNull(extractor.shardId(42));
    }

    @Test
    void resolve_classifies_deliveries_starts_and_unroutable_messages() {
        var delivery = ShardingMessage.resolve(extractor, new ShardingEnvelope("u1", "hello"));
        var d = assertInstanceOf(ShardingMessage.EntityDelivery.class, delivery);
        assertEquals("u1", d.entityId());
        assertEquals("hello", d.message());
        assertEquals(extractor.shardIdForEntity("u1"), d.shardId());

        var start = ShardingMessage.resolve(extractor, new StartEntity("u3"));
        assertInstanceOf(ShardingMessage.EntityStart.class, start);
        assertEquals(extractor.shardIdForEntity("u3"), start.shardId());

        var unroutable = ShardingMessage.resolve(extractor, "no id here");
        assertInstanceOf(ShardingMessage.Unroutable.class, unroutable);
        assertNull(unroutable.shardId());
        assertEquals("no id here", unroutable.original());

        assertInstanceOf(ShardingMessage.Unroutable.class,
                ShardingMessage.resolve(extractor, new Greet(" ", "blank id")));
    }

    @Test
    void number_of_shards_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> HashCodeMessageExtractor.forEnvelopes(0));
    }
}
