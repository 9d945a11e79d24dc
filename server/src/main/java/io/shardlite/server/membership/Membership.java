// file: server/src/main/java/io/shardlite/server/membership/Membership.java
package io.shardlite.server.membership;

import java.util.Set;

/**
 * Cluster membership as seen by the sharding layer.
 */
public interface Membership {

    /** Region ids currently considered members (up or unreachable, not removed). */
    Set<String> currentMembers();

    void subscribe(MembershipListener listener);

    void unsubscribe(MembershipListener listener);
}
