// file: server/src/main/java/io/shardlite/server/config/ShardingSettings.java
package io.shardlite.server.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Policy knobs of the sharding layer.
 * <p>
 * All durations must be positive except {@code passivateIdleAfter}, where zero
 * disables idle passivation. A shard's own handoff timeout must be shorter than
 * the coordinator's, so the owner gives up before the coordinator does.
 *
 * @param numberOfShards            shard count for the stock hash extractor
 * @param rebalanceInterval         period of the coordinator's rebalance tick
 * @param rebalanceThreshold        load difference that triggers a move
 * @param maxSimultaneousRebalance  handoffs allowed in flight per round
 * @param passivateIdleAfter        idle time before an entity is stopped
 * @param handOffTimeout            coordinator wait for BeginHandOffAck / ShardStopped
 * @param shardHandOffTimeout       shard wait for its entities to stop during handoff
 * @param retryInterval             resend period for Register, GetShardHome and HostShard
 * @param bufferSize                messages a region may buffer across all shards
 * @param maxResolveAttempts        GetShardHome sends before buffered messages fail
 * @param maxDeliveryAttempts       failed remote forwards before a message fails
 * @param rememberEntities          recreate entities when their shard starts
 * @param snapshotAfter             coordinator events between snapshots
 * @param coordinatorFailureBackoff delay before a failed coordinator is restarted
 * @param requestTimeout            deadline of one remote send
 */
public record ShardingSettings(
        int numberOfShards,
        Duration rebalanceInterval,
        int rebalanceThreshold,
        int maxSimultaneousRebalance,
        Duration passivateIdleAfter,
        Duration handOffTimeout,
        Duration shardHandOffTimeout,
        Duration retryInterval,
        int bufferSize,
        int maxResolveAttempts,
        int maxDeliveryAttempts,
        boolean rememberEntities,
        int snapshotAfter,
        Duration coordinatorFailureBackoff,
        Duration requestTimeout
) {

    public ShardingSettings {
        if (numberOfShards <= 0) throw new IllegalArgumentException("numberOfShards must be > 0");
        requirePositive(rebalanceInterval, "rebalanceInterval");
        if (rebalanceThreshold < 1) throw new IllegalArgumentException("rebalanceThreshold must be >= 1");
        if (maxSimultaneousRebalance < 1) throw new IllegalArgumentException("maxSimultaneousRebalance must be >= 1");
        Objects.requireNonNull(passivateIdleAfter, "passivateIdleAfter");
        if (passivateIdleAfter.isNegative()) throw new IllegalArgumentException("passivateIdleAfter must be >= 0");
        requirePositive(handOffTimeout, "handOffTimeout");
        requirePositive(shardHandOffTimeout, "shardHandOffTimeout");
        if (shardHandOffTimeout.compareTo(handOffTimeout) >= 0) {
            throw new IllegalArgumentException("shardHandOffTimeout must be < handOffTimeout");
        }
        requirePositive(retryInterval, "retryInterval");
        if (bufferSize <= 0) throw new IllegalArgumentException("bufferSize must be > 0");
        if (maxResolveAttempts <= 0) throw new IllegalArgumentException("maxResolveAttempts must be > 0");
        if (maxDeliveryAttempts <= 0) throw new IllegalArgumentException("maxDeliveryAttempts must be > 0");
        if (snapshotAfter <= 0) throw new IllegalArgumentException("snapshotAfter must be > 0");
        requirePositive(coordinatorFailureBackoff, "coordinatorFailureBackoff");
        requirePositive(requestTimeout, "requestTimeout");
    }

    public static ShardingSettings defaults() {
        return new ShardingSettings(
                100,
                Duration.ofSeconds(10),
                1,
                3,
                Duration.ofMinutes(2),
                Duration.ofSeconds(60),
                Duration.ofSeconds(10),
                Duration.ofSeconds(2),
                100_000,
                60,
                5,
                false,
                1000,
                Duration.ofSeconds(5),
                Duration.ofSeconds(2)
        );
    }

    public boolean passivationEnabled() {
        return !passivateIdleAfter.isZero();
    }

    public ShardingSettings withNumberOfShards(int v) {
        return new ShardingSettings(v, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withRebalanceInterval(Duration v) {
        return new ShardingSettings(numberOfShards, v, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withRebalanceThreshold(int v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, v, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withMaxSimultaneousRebalance(int v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, v,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withPassivateIdleAfter(Duration v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                v, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withHandOffTimeouts(Duration coordinator, Duration shard) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, coordinator, shard, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withRetryInterval(Duration v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, v, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withBufferSize(int v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, v,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withMaxResolveAttempts(int v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                v, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withMaxDeliveryAttempts(int v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, v, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withRememberEntities(boolean v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, v, snapshotAfter,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withSnapshotAfter(int v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, v,
                coordinatorFailureBackoff, requestTimeout);
    }

    public ShardingSettings withCoordinatorFailureBackoff(Duration v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                v, requestTimeout);
    }

    public ShardingSettings withRequestTimeout(Duration v) {
        return new ShardingSettings(numberOfShards, rebalanceInterval, rebalanceThreshold, maxSimultaneousRebalance,
                passivateIdleAfter, handOffTimeout, shardHandOffTimeout, retryInterval, bufferSize,
                maxResolveAttempts, maxDeliveryAttempts, rememberEntities, snapshotAfter,
                coordinatorFailureBackoff, v);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be > 0");
    }
}
