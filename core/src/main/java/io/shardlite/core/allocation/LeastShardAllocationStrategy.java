// file: core/src/main/java/io/shardlite/core/allocation/LeastShardAllocationStrategy.java
package io.shardlite.core.allocation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Allocates to the least-loaded region and rebalances from the most-loaded one.
 * <p>
 * Allocation:
 *  - the candidate owning the fewest shards wins;
 *  - ties are broken by region id ordering, so the result is reproducible.
 * <p>
 * Rebalance:
 *  - repeatedly compares the most and least loaded candidates (load counts
 *    exclude shards already in handoff, they are leaving);
 *  - while the difference exceeds {@code rebalanceThreshold}, moves one shard
 *    from the most loaded to the least loaded (on paper only), preferring small
 *    shards and then lower shard ids;
 *  - stops once {@code maxSimultaneousRebalance} handoffs, counting those
 *    already in progress, would be running.
 * <p>
 * Because one move narrows the gap by two and the threshold is at least one,
 * consecutive rounds cannot bounce a shard back and forth.
 */
public final class LeastShardAllocationStrategy implements ShardAllocationStrategy {

    private final int rebalanceThreshold;
    private final int maxSimultaneousRebalance;

    public LeastShardAllocationStrategy(int rebalanceThreshold, int maxSimultaneousRebalance) {
        if (rebalanceThreshold < 1) throw new IllegalArgumentException("rebalanceThreshold must be >= 1");
        if (maxSimultaneousRebalance < 1) throw new IllegalArgumentException("maxSimultaneousRebalance must be >= 1");
        this.rebalanceThreshold = rebalanceThreshold;
        this.maxSimultaneousRebalance = maxSimultaneousRebalance;
    }

    @Override
    public String allocateShard(Set<String> candidates, Map<String, String> currentAllocation, String shardId) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("no candidate regions for shard " + shardId);
        }
        Map<String, Integer> load = loadPerCandidate(candidates, currentAllocation, Set.of());
        return extreme(load, Comparator.naturalOrder());
    }

    @Override
    public Set<String> rebalance(Set<String> candidates,
                                 Map<String, String> currentAllocation,
                                 Map<String, Integer> shardSizes,
                                 Set<String> rebalanceInProgress) {
        int budget = maxSimultaneousRebalance - rebalanceInProgress.size();
        if (budget <= 0 || candidates.size() < 2) {
            return Set.of();
        }

        Map<String, Integer> load = loadPerCandidate(candidates, currentAllocation, rebalanceInProgress);
        Map<String, List<String>> movable = movableShards(candidates, currentAllocation, shardSizes, rebalanceInProgress);

        Set<String> selected = new LinkedHashSet<>();
        while (selected.size() < budget) {
            String most = extreme(load, Comparator.reverseOrder());
            String least = extreme(load, Comparator.naturalOrder());
            if (load.get(most) - load.get(least) <= rebalanceThreshold) {
                break;
            }
            List<String> fromMost = movable.get(most);
            if (fromMost.isEmpty()) {
                break;
            }
            selected.add(fromMost.remove(0));
            load.merge(most, -1, Integer::sum);
            load.merge(least, 1, Integer::sum);
        }
        return selected;
    }

    public int rebalanceThreshold() {
        return rebalanceThreshold;
    }

    public int maxSimultaneousRebalance() {
        return maxSimultaneousRebalance;
    }

    // ---------- helpers ----------

    private static Map<String, Integer> loadPerCandidate(Set<String> candidates,
                                                         Map<String, String> allocation,
                                                         Set<String> excluded) {
        // TreeMap: iteration order is region id order, which the tie-breaks rely on.
        Map<String, Integer> load = new TreeMap<>();
        for (String c : candidates) {
            load.put(c, 0);
        }
        for (Map.Entry<String, String> e : allocation.entrySet()) {
            if (!excluded.contains(e.getKey()) && load.containsKey(e.getValue())) {
                load.merge(e.getValue(), 1, Integer::sum);
            }
        }
        return load;
    }

    private static Map<String, List<String>> movableShards(Set<String> candidates,
                                                           Map<String, String> allocation,
                                                           Map<String, Integer> sizes,
                                                           Set<String> inProgress) {
        Map<String, List<String>> out = new HashMap<>();
        for (String c : candidates) {
            out.put(c, new ArrayList<>());
        }
        for (Map.Entry<String, String> e : allocation.entrySet()) {
            List<String> owned = out.get(e.getValue());
            if (owned != null && !inProgress.contains(e.getKey())) {
                owned.add(e.getKey());
            }
        }
        Comparator<String> bySizeThenId = Comparator
                .<String>comparingInt(s -> sizes.getOrDefault(s, 0))
                .thenComparing(Comparator.naturalOrder());
        out.values().forEach(l -> l.sort(bySizeThenId));
        return out;
    }

    /** Region with the extreme load under {@code order}; ties go to the lowest region id. */
    private static String extreme(Map<String, Integer> load, Comparator<Integer> order) {
        String best = null;
        for (Map.Entry<String, Integer> e : load.entrySet()) {
            if (best == null || order.compare(e.getValue(), load.get(best)) < 0) {
                best = e.getKey();
            }
        }
        return best;
    }
}
