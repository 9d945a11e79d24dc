// file: core/src/main/java/io/shardlite/core/protocol/ShardingProtocol.java
package io.shardlite.core.protocol;

import java.util.Map;

/**
 * Control messages exchanged between regions and the coordinator.
 * <p>
 * Every message is idempotent at its receiver: the transport delivers at least
 * once, so duplicates of any of these must be harmless.
 * <p>
 * Region to coordinator:
 *   Register, RegisterProxy, GetShardHome, ShardStarted, BeginHandOffAck,
 *   ShardStopped, GracefulShutdownRequest, RegionStopped, ShardSizes
 * <p>
 * Coordinator to region:
 *   RegisterAck, ShardHome, HostShard, BeginHandOff, HandOff
 */
public final class ShardingProtocol {

    private ShardingProtocol() {
    }

    /** Marker for everything in this protocol, so routers can tell control traffic from entity traffic. */
    public interface Control {
    }

    /** A region that can host shards announces itself. */
    public record Register(String regionId) implements Control {
    }

    /** A routing-only region announces itself; it never receives allocations. */
    public record RegisterProxy(String regionId) implements Control {
    }

    public record RegisterAck(String coordinatorAddress) implements Control {
    }

    /** Who owns this shard? Safe to retry. */
    public record GetShardHome(String shardId, String requester) implements Control {
    }

    /** Answer to {@link GetShardHome}. */
    public record ShardHome(String shardId, String regionId) implements Control {
    }

    /** The receiving region now owns the shard and should start it. */
    public record HostShard(String shardId) implements Control {
    }

    public record ShardStarted(String shardId, String regionId) implements Control {
    }

    /** Phase one of handoff: forget the cached owner and buffer. */
    public record BeginHandOff(String shardId) implements Control {
    }

    public record BeginHandOffAck(String shardId, String regionId) implements Control {
    }

    /** Phase two of handoff, sent to the owner only: stop the shard. */
    public record HandOff(String shardId) implements Control {
    }

    /** The owner's shard has stopped all its entities. */
    public record ShardStopped(String shardId, String regionId) implements Control {
    }

    /** The region is leaving and asks for all of its shards to be handed off. */
    public record GracefulShutdownRequest(String regionId) implements Control {
    }

    /** The region finished its graceful shutdown and owns nothing. */
    public record RegionStopped(String regionId) implements Control {
    }

    /** Live entity count of each shard running on the region; input to rebalancing. */
    public record ShardSizes(String regionId, Map<String, Integer> sizes) implements Control {
        public ShardSizes {
            sizes = Map.copyOf(sizes);
        }
    }
}
