// file: core/src/test/java/io/shardlite/core/allocation/LeastShardAllocationStrategyTest.java
package io.shardlite.core.allocation;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LeastShardAllocationStrategyTest {

    private final LeastShardAllocationStrategy strategy = new LeastShardAllocationStrategy(1, 3);

    private static Map<String, String> allocation(String... shardRegionPairs) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i < shardRegionPairs.length; i += 2) {
            out.put(shardRegionPairs[i], shardRegionPairs[i + 1]);
        }
        return out;
    }

    @Test
    void allocates_to_least_loaded_candidate() {
        var current = allocation("1", "r1", "2", "r1", "3", "r2");
        assertEquals("r3", strategy.allocateShard(Set.of("r1", "r2", "r3"), current, "4"));
        assertEquals("r2", strategy.allocateShard(Set.of("r1", "r2"), current, "4"));
    }

    @Test
    void ties_break_on_region_id_so_the_choice_is_reproducible() {
        assertEquals("a", strategy.allocateShard(Set.of("c", "b", "a"), Map.of(), "1"));
        assertEquals("a", strategy.allocateShard(Set.of("c", "a", "b"), Map.of(), "1"));
    }

    @Test
    void shards_owned_by_non_candidates_do_not_count_as_load() {
        var current = allocation("1", "gone", "2", "gone", "3", "r2");
        assertEquals("r1", strategy.allocateShard(Set.of("r1", "r2"), current, "4"));
    }

    @Test
    void allocate_without_candidates_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> strategy.allocateShard(Set.of(), Map.of(), "1"));
    }

    @Test
    void rebalance_moves_from_most_to_least_loaded_until_within_threshold() {
        var current = allocation("1", "r1", "2", "r1", "3", "r1", "4", "r1");
        Set<String> moved = strategy.rebalance(Set.of("r1", "r2"), current, Map.of(), Set.of());
        // 4/0 -> 3/1 -> 2/2
        assertEquals(Set.of("1", "2"), moved);
    }

    @Test
    void difference_equal_to_threshold_does_not_move() {
        var current = allocation("1", "r1", "2", "r1", "3", "r2");
        assertTrue(strategy.rebalance(Set.of("r1", "r2"), current, Map.of(), Set.of()).isEmpty());
    }

    @Test
    void rebalance_respects_max_simultaneous_including_in_progress() {
        var limited = new LeastShardAllocationStrategy(1, 2);
        var current = new LinkedHashMap<String, String>();
        for (int i = 0; i < 10; i++) {
            current.put(Integer.toString(i), "r1");
        }
        assertEquals(2, limited.rebalance(Set.of("r1", "r2"), current, Map.of(), Set.of()).size());
        assertEquals(1, limited.rebalance(Set.of("r1", "r2"), current, Map.of(), Set.of("9")).size());
        assertTrue(limited.rebalance(Set.of("r1", "r2"), current, Map.of(), Set.of("8", "9")).isEmpty());
    }

    @Test
    void shards_in_handoff_are_neither_counted_nor_selected_again() {
        var current = allocation("1", "r1", "2", "r1", "3", "r1");
        Set<String> moved = strategy.rebalance(Set.of("r1", "r2"), current, Map.of(), Set.of("1"));
        // r1 counts 2 of its shards, r2 none: one more move evens it out
        assertEquals(Set.of("2"), moved);
    }

    @Test
    void smaller_shards_are_preferred_for_moves() {
        var current = allocation("a", "r1", "b", "r1", "c", "r1");
        Set<String> moved = strategy.rebalance(Set.of("r1", "r2"), current, Map.of("a", 50, "b", 5, "c", 20), Set.of());
        assertEquals(Set.of("b"), moved);
    }

    @Test
    void a_single_candidate_never_rebalances() {
        var current = allocation("1", "r1", "2", "r1", "3", "r1");
        assertTrue(strategy.rebalance(Set.of("r1"), current, Map.of(), Set.of()).isEmpty());
    }

    @Test
    void invalid_parameters_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new LeastShardAllocationStrategy(0, 1));
        assertThrows(IllegalArgumentException.class, () -> new LeastShardAllocationStrategy(1, 0));
    }
}
