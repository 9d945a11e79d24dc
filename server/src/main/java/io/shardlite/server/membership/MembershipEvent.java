// file: server/src/main/java/io/shardlite/server/membership/MembershipEvent.java
package io.shardlite.server.membership;

import java.util.Objects;

/** Changes in the set of live regions, as reported by a {@link Membership}. */
public sealed interface MembershipEvent {

    String regionId();

    record RegionUp(String regionId) implements MembershipEvent {
        public RegionUp {
            Objects.requireNonNull(regionId, "regionId");
        }
    }

    /** Suspected down; may come back. Nothing is reallocated on this event alone. */
    record RegionUnreachable(String regionId) implements MembershipEvent {
        public RegionUnreachable {
            Objects.requireNonNull(regionId, "regionId");
        }
    }

    /** Gone for good; its shards are reallocated without handoff. */
    record RegionRemoved(String regionId) implements MembershipEvent {
        public RegionRemoved {
            Objects.requireNonNull(regionId, "regionId");
        }
    }
}
