// file: server/src/main/java/io/shardlite/server/membership/StaticMembership.java
package io.shardlite.server.membership;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * {@link Membership} driven by configuration and explicit calls (admin API,
 * tests) rather than failure detection.
 */
public final class StaticMembership implements Membership {
    private static final Logger log = Logger.getLogger(StaticMembership.class.getName());

    private final Set<String> members = new TreeSet<>();
    private final List<MembershipListener> listeners = new CopyOnWriteArrayList<>();

    public StaticMembership(Collection<String> initialMembers) {
        members.addAll(initialMembers);
    }

    @Override
    public synchronized Set<String> currentMembers() {
        return Set.copyOf(members);
    }

    @Override
    public void subscribe(MembershipListener listener) {
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(MembershipListener listener) {
        listeners.remove(listener);
    }

    public void regionUp(String regionId) {
        synchronized (this) {
            if (!members.add(regionId)) return;
        }
        log.info(() -> "region up: " + regionId);
        publish(new MembershipEvent.RegionUp(regionId));
    }

    public void regionUnreachable(String regionId) {
        log.warning(() -> "region unreachable: " + regionId);
        publish(new MembershipEvent.RegionUnreachable(regionId));
    }

    /**
     * @return false if the region was not a member
     */
    public boolean regionRemoved(String regionId) {
        synchronized (this) {
            if (!members.remove(regionId)) return false;
        }
        log.info(() -> "region removed: " + regionId);
        publish(new MembershipEvent.RegionRemoved(regionId));
        return true;
    }

    private void publish(MembershipEvent event) {
        for (MembershipListener l : listeners) {
            l.onEvent(event);
        }
    }
}
