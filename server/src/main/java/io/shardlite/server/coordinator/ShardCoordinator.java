// file: server/src/main/java/io/shardlite/server/coordinator/ShardCoordinator.java
package io.shardlite.server.coordinator;

import io.shardlite.core.allocation.ShardAllocationStrategy;
import io.shardlite.core.exception.AllocationConflictException;
import io.shardlite.core.exception.PersistenceFailureException;
import io.shardlite.core.protocol.ShardingProtocol;
import io.shardlite.core.state.CoordinatorEvent;
import io.shardlite.core.state.ShardAllocationState;
import io.shardlite.server.config.ShardingSettings;
import io.shardlite.server.membership.Membership;
import io.shardlite.server.membership.MembershipEvent;
import io.shardlite.server.membership.MembershipListener;
import io.shardlite.server.runtime.Cancellable;
import io.shardlite.server.runtime.Dispatchers;
import io.shardlite.server.runtime.Mailbox;
import io.shardlite.server.transport.Transport;
import io.shardlite.storage.EventJournal;
import io.shardlite.storage.JournalEntry;
import io.shardlite.storage.SnapshotPolicy;
import io.shardlite.storage.Snapshotter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The single authoritative allocator of shard ownership.
 * <p>
 * Lifecycle: WAITING_FOR_STATE -> ACTIVE -> STOPPED.
 * <p>
 * Contract:
 *  - Every decision is journaled before anyone hears of it: a region only ever
 *    sees an owner that is already durable. Appends run on the io executor;
 *    while one is in flight, incoming messages are stashed and handled in
 *    arrival order once it completes.
 *  - Every request is idempotent: a repeated GetShardHome gets the same answer,
 *    a repeated Register the same ack. Running two instances briefly during
 *    failover is therefore safe as long as they share the journal.
 *  - A failed journal or snapshot write, or an allocation conflict, stops this
 *    instance and is reported to the supervisor; a fresh instance recovers
 *    from the journal.
 * <p>
 * Handoff (rebalance, graceful shutdown):
 *  1. persist ShardHandOffStarted; send BeginHandOff to every region;
 *  2. once all acked (or handOffTimeout), send HandOff to the owner;
 *  3. on ShardStopped (or handOffTimeout) persist ShardHomeDeallocated and
 *     answer the GetShardHome requests parked meanwhile.
 * <p>
 * Rebalancing moves the smallest shards first, by the entity counts regions
 * report in {@link ShardingProtocol.ShardSizes}.
 */
public final class ShardCoordinator {
    private static final Logger log = Logger.getLogger(ShardCoordinator.class.getName());

    public enum Status { WAITING_FOR_STATE, ACTIVE, STOPPED }

    private final String address;
    private final ShardingSettings settings;
    private final ShardAllocationStrategy strategy;
    private final EventJournal<CoordinatorEvent> journal;
    private final Snapshotter snapshotter;
    private final SnapshotPolicy snapshotPolicy;
    private final Transport transport;
    private final Membership membership;
    private final Dispatchers dispatchers;
    private final Consumer<Throwable> onFatal;
    private final Mailbox<Object> mailbox;
    private final Mailbox<Runnable> io;
    private final MembershipListener membershipListener;

    private volatile Status status = Status.WAITING_FOR_STATE;
    private volatile ShardAllocationState state = ShardAllocationState.empty();
    private boolean persisting;
    private final Deque<Object> stash = new ArrayDeque<>();
    private final Map<String, Integer> shardSizes = new HashMap<>();
    private final Set<String> proxies = new HashSet<>();
    private final Set<String> shuttingDown = new HashSet<>();
    private final Map<String, HandOffProgress> handOffs = new LinkedHashMap<>();
    private final Map<String, Set<String>> parked = new HashMap<>();
    private final Map<String, Cancellable> unackedHostShard = new HashMap<>();
    private Cancellable rebalanceTimer = Cancellable.NONE;

    /**
     * @param address the transport address to bind, usually {@code <nodeId>/coordinator}
     * @param onFatal called once, from the coordinator's thread, when the instance dies
     */
    public ShardCoordinator(String address,
                            ShardingSettings settings,
                            ShardAllocationStrategy strategy,
                            EventJournal<CoordinatorEvent> journal,
                            Snapshotter snapshotter,
                            Transport transport,
                            Membership membership,
                            Dispatchers dispatchers,
                            Consumer<Throwable> onFatal) {
        this.address = Objects.requireNonNull(address, "address");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.snapshotter = Objects.requireNonNull(snapshotter, "snapshotter");
        this.snapshotPolicy = new SnapshotPolicy(settings.snapshotAfter());
        this.transport = Objects.requireNonNull(transport, "transport");
        this.membership = Objects.requireNonNull(membership, "membership");
        this.dispatchers = Objects.requireNonNull(dispatchers, "dispatchers");
        this.onFatal = Objects.requireNonNull(onFatal, "onFatal");
        this.mailbox = new Mailbox<>("coordinator", dispatchers.executor(), this::receive);
        this.io = new Mailbox<>("coordinator-io", dispatchers.ioExecutor(), Runnable::run);
        this.membershipListener = mailbox::tell;
    }

    /** Bind the address and recover state; requests are stashed until recovery completes. */
    public void start() {
        transport.bind(address, (from, message) -> mailbox.tell(message));
        membership.subscribe(membershipListener);
        io.tell(this::recover);
    }

    public void stop() {
        mailbox.tell(new Stop());
    }

    /** Immutable copy of the allocation table as of the last persisted event. */
    public ShardAllocationState currentState() {
        return state;
    }

    public Status status() {
        return status;
    }

    public String address() {
        return address;
    }

    // ---------- internal protocol ----------

    private record StateRecovered(ShardAllocationState state, long sequenceNr) {
    }

    private record RecoveryFailed(RuntimeException cause) {
    }

    private record Persisted(ShardAllocationState state, Runnable andThen) {
    }

    private record PersistFailed(RuntimeException cause) {
    }

    private record SendFailed(String to, Object message, Throwable cause) {
    }

    private record RebalanceTick() {
    }

    private record StartHandOff(String shardId) {
    }

    /** Allocate a shard whose owner left, unless someone else did meanwhile. */
    private record Reallocate(String shardId, Set<String> requesters) {
    }

    private record ReleaseInterrupted(String shardId) {
    }

    private record TerminateDeparted(String regionId) {
    }

    private record BeginAckTimeout(String shardId, long epoch) {
    }

    private record HandOffTimeout(String shardId, long epoch) {
    }

    private record HostShardRetry(String shardId, String regionId) {
    }

    private record Stop() {
    }

    private static final class HandOffProgress {
        final String owner;
        final long epoch;
        final Set<String> awaitingAcks;
        boolean handOffSent;
        Cancellable timer = Cancellable.NONE;

        HandOffProgress(String owner, long epoch, Set<String> awaitingAcks) {
            this.owner = owner;
            this.epoch = epoch;
            this.awaitingAcks = awaitingAcks;
        }
    }

    private long handOffEpoch;

    private void receive(Object msg) {
        try {
            if (msg instanceof Persisted p) {
                onPersisted(p);
            } else if (msg instanceof PersistFailed f) {
                fail(f.cause());
                return;
            } else {
                switch (status) {
                    case WAITING_FOR_STATE:
                        waitingForState(msg);
                        break;
                    case ACTIVE:
                        if (persisting && !(msg instanceof Stop)) {
                            stash.addLast(msg);
                        } else {
                            active(msg);
                        }
                        break;
                    default:
                        log.fine(() -> "stopped coordinator dropping " + msg.getClass().getSimpleName());
                }
            }
            unstash();
        } catch (PersistenceFailureException | AllocationConflictException e) {
            fail(e);
        }
    }

    private void unstash() {
        while (status == Status.ACTIVE && !persisting && !stash.isEmpty()) {
            active(stash.pollFirst());
        }
    }

    /** Queue internal work ahead of everything stashed, keeping its order. */
    private void defer(List<?> work) {
        for (int i = work.size() - 1; i >= 0; i--) {
            stash.addFirst(work.get(i));
        }
    }

    // ---------- WAITING_FOR_STATE ----------

    private void recover() {
        try {
            Snapshotter.LoadedSnapshot snap = snapshotter.loadLatest();
            ShardAllocationState s = snap == null ? ShardAllocationState.empty() : snap.state();
            long from = snap == null ? 1 : snap.sequenceNr() + 1;
            long seq = from - 1;
            for (JournalEntry<CoordinatorEvent> e : journal.replayFrom(from)) {
                s = s.updated(e.event());
                seq = e.sequenceNr();
            }
            mailbox.tell(new StateRecovered(s, seq));
        } catch (RuntimeException e) {
            mailbox.tell(new RecoveryFailed(e));
        }
    }

    private void waitingForState(Object msg) {
        if (msg instanceof StateRecovered r) {
            onRecovered(r.state(), r.sequenceNr());
        } else if (msg instanceof RecoveryFailed f) {
            fail(f.cause());
        } else if (msg instanceof Stop) {
            stopInternal();
        } else {
            stash.addLast(msg);
        }
    }

    private void onRecovered(ShardAllocationState recovered, long sequenceNr) {
        state = recovered;
        status = Status.ACTIVE;
        log.info(() -> "coordinator recovered " + recovered.shards().size() + " allocations over "
                + recovered.regions().size() + " regions (journal at " + sequenceNr + ")");

        // runs before the stashed requests
        List<Object> work = new ArrayList<>();
        for (String shardId : new TreeSet<>(recovered.handOffInProgress())) {
            work.add(new ReleaseInterrupted(shardId));
        }
        Set<String> members = membership.currentMembers();
        for (String regionId : new TreeSet<>(recovered.regions().keySet())) {
            if (!members.contains(regionId)) {
                work.add(new TerminateDeparted(regionId));
            }
        }
        defer(work);

        rebalanceTimer = dispatchers.scheduler().scheduleAtFixedRate(settings.rebalanceInterval(),
                settings.rebalanceInterval(), () -> mailbox.tell(new RebalanceTick()));
    }

    // ---------- ACTIVE ----------

    private void active(Object msg) {
        if (msg instanceof ShardingProtocol.GetShardHome m) {
            onGetShardHome(m.shardId(), m.requester());
        } else if (msg instanceof ShardingProtocol.Register m) {
            onRegister(m.regionId());
        } else if (msg instanceof ShardingProtocol.RegisterProxy m) {
            proxies.add(m.regionId());
            send(m.regionId(), new ShardingProtocol.RegisterAck(address));
        } else if (msg instanceof ShardingProtocol.ShardStarted m) {
            Cancellable c = unackedHostShard.remove(m.shardId());
            if (c != null) c.cancel();
        } else if (msg instanceof HostShardRetry m) {
            onHostShardRetry(m.shardId(), m.regionId());
        } else if (msg instanceof ShardingProtocol.BeginHandOffAck m) {
            onBeginHandOffAck(m.shardId(), m.regionId());
        } else if (msg instanceof BeginAckTimeout m) {
            HandOffProgress p = handOffs.get(m.shardId());
            if (p != null && p.epoch == m.epoch() && !p.handOffSent) {
                log.warning(() -> "BeginHandOffAck for shard " + m.shardId() + " missing from "
                        + p.awaitingAcks + ", continuing handoff");
                sendHandOff(m.shardId(), p);
            }
        } else if (msg instanceof ShardingProtocol.ShardStopped m) {
            HandOffProgress p = handOffs.get(m.shardId());
            if (p != null && p.owner.equals(m.regionId())) {
                completeHandOff(m.shardId());
            }
        } else if (msg instanceof HandOffTimeout m) {
            HandOffProgress p = handOffs.get(m.shardId());
            if (p != null && p.epoch == m.epoch()) {
                log.warning(() -> "handoff of shard " + m.shardId() + " from " + p.owner + " timed out after "
                        + settings.handOffTimeout() + ", deallocating anyway");
                completeHandOff(m.shardId());
            }
        } else if (msg instanceof RebalanceTick) {
            rebalance();
        } else if (msg instanceof StartHandOff m) {
            startHandOff(m.shardId());
        } else if (msg instanceof Reallocate m) {
            reallocate(m.shardId(), m.requesters());
        } else if (msg instanceof ReleaseInterrupted m) {
            if (state.isHandOffInProgress(m.shardId())) {
                log.info(() -> "releasing shard " + m.shardId() + " whose handoff was interrupted");
                persist(new CoordinatorEvent.ShardHomeDeallocated(m.shardId()), null);
            }
        } else if (msg instanceof TerminateDeparted m) {
            log.info(() -> "region " + m.regionId() + " left while no coordinator was active");
            regionTerminated(m.regionId());
        } else if (msg instanceof ShardingProtocol.ShardSizes m) {
            m.sizes().forEach((shardId, size) -> {
                if (m.regionId().equals(state.ownerOf(shardId))) {
                    shardSizes.put(shardId, size);
                }
            });
        } else if (msg instanceof SendFailed m) {
            onSendFailed(m);
        } else if (msg instanceof ShardingProtocol.GracefulShutdownRequest m) {
            onGracefulShutdown(m.regionId());
        } else if (msg instanceof ShardingProtocol.RegionStopped m) {
            log.info(() -> "region " + m.regionId() + " stopped");
            regionTerminated(m.regionId());
        } else if (msg instanceof MembershipEvent.RegionRemoved m) {
            regionTerminated(m.regionId());
        } else if (msg instanceof MembershipEvent) {
            log.fine(() -> "membership: " + msg);
        } else if (msg instanceof Stop) {
            stopInternal();
        } else {
            log.fine(() -> "coordinator ignoring " + msg);
        }
    }

    private void onRegister(String regionId) {
        if (state.isRegistered(regionId)) {
            send(regionId, new ShardingProtocol.RegisterAck(address));
            return;
        }
        persist(new CoordinatorEvent.RegionRegistered(regionId), () -> {
            log.info(() -> "region " + regionId + " registered");
            send(regionId, new ShardingProtocol.RegisterAck(address));
        });
    }

    private void onGetShardHome(String shardId, String requester) {
        if (handOffs.containsKey(shardId) || state.isHandOffInProgress(shardId)) {
            log.fine(() -> "parking GetShardHome(" + shardId + ") from " + requester + " during handoff");
            parked.computeIfAbsent(shardId, k -> new LinkedHashSet<>()).add(requester);
            return;
        }
        String owner = state.ownerOf(shardId);
        if (owner != null) {
            send(requester, new ShardingProtocol.ShardHome(shardId, owner));
            return;
        }
        allocate(shardId, Set.of(requester));
    }

    /** Allocate an unowned shard and tell the requesters; the owner gets HostShard if it did not ask. */
    private void allocate(String shardId, Set<String> requesters) {
        Set<String> candidates = candidates();
        if (candidates.isEmpty()) {
            log.fine(() -> "no region can host shard " + shardId + " yet");
            return;
        }
        String regionId = strategy.allocateShard(candidates, state.shards(), shardId);
        if (!candidates.contains(regionId)) {
            log.warning(() -> "strategy picked non-candidate " + regionId + " for shard " + shardId + ", ignoring");
            return;
        }
        persist(new CoordinatorEvent.ShardHomeAllocated(shardId, regionId), () -> {
            log.info(() -> "shard " + shardId + " allocated to " + regionId);
            for (String requester : requesters) {
                send(requester, new ShardingProtocol.ShardHome(shardId, regionId));
            }
            if (!requesters.contains(regionId)) {
                sendHostShard(shardId, regionId);
            }
        });
    }

    private void reallocate(String shardId, Set<String> requesters) {
        String owner = state.ownerOf(shardId);
        if (owner != null) {
            for (String requester : requesters) {
                send(requester, new ShardingProtocol.ShardHome(shardId, owner));
            }
        } else if (handOffs.containsKey(shardId) || state.isHandOffInProgress(shardId)) {
            parked.computeIfAbsent(shardId, k -> new LinkedHashSet<>()).addAll(requesters);
        } else {
            allocate(shardId, requesters);
        }
    }

    private void sendHostShard(String shardId, String regionId) {
        Cancellable previous = unackedHostShard.remove(shardId);
        if (previous != null) previous.cancel();
        send(regionId, new ShardingProtocol.HostShard(shardId));
        unackedHostShard.put(shardId, dispatchers.scheduler().schedule(settings.retryInterval(),
                () -> mailbox.tell(new HostShardRetry(shardId, regionId))));
    }

    private void onHostShardRetry(String shardId, String regionId) {
        if (unackedHostShard.containsKey(shardId) && regionId.equals(state.ownerOf(shardId))) {
            sendHostShard(shardId, regionId);
        } else {
            unackedHostShard.remove(shardId);
        }
    }

    private Set<String> candidates() {
        Set<String> out = new TreeSet<>(state.regions().keySet());
        out.removeAll(shuttingDown);
        return out;
    }

    // ---------- handoff ----------

    private void rebalance() {
        Set<String> inProgress = new HashSet<>(handOffs.keySet());
        inProgress.addAll(state.handOffInProgress());
        Set<String> toMove = strategy.rebalance(candidates(), state.shards(), Map.copyOf(shardSizes), inProgress);
        List<Object> work = new ArrayList<>();
        for (String shardId : toMove) {
            log.info(() -> "rebalancing shard " + shardId + " away from " + state.ownerOf(shardId));
            work.add(new StartHandOff(shardId));
        }
        defer(work);
    }

    private void startHandOff(String shardId) {
        if (handOffs.containsKey(shardId) || state.isHandOffInProgress(shardId)) return;
        String owner = state.ownerOf(shardId);
        if (owner == null) return;

        persist(new CoordinatorEvent.ShardHandOffStarted(shardId), () -> beginHandOff(shardId, owner));
    }

    private void beginHandOff(String shardId, String owner) {
        Set<String> everyone = new TreeSet<>(state.regions().keySet());
        everyone.addAll(proxies);
        // an unreachable region counts as acked, see onSendFailed
        Set<String> awaiting = new HashSet<>(everyone);
        for (String regionId : everyone) {
            send(regionId, new ShardingProtocol.BeginHandOff(shardId));
        }
        HandOffProgress p = new HandOffProgress(owner, ++handOffEpoch, awaiting);
        handOffs.put(shardId, p);
        if (awaiting.isEmpty()) {
            sendHandOff(shardId, p);
        } else {
            p.timer = dispatchers.scheduler().schedule(settings.handOffTimeout(),
                    () -> mailbox.tell(new BeginAckTimeout(shardId, p.epoch)));
        }
    }

    private void onBeginHandOffAck(String shardId, String regionId) {
        HandOffProgress p = handOffs.get(shardId);
        if (p == null || p.handOffSent) return;
        p.awaitingAcks.remove(regionId);
        if (p.awaitingAcks.isEmpty()) {
            sendHandOff(shardId, p);
        }
    }

    private void sendHandOff(String shardId, HandOffProgress p) {
        p.timer.cancel();
        p.handOffSent = true;
        send(p.owner, new ShardingProtocol.HandOff(shardId));
        p.timer = dispatchers.scheduler().schedule(settings.handOffTimeout(),
                () -> mailbox.tell(new HandOffTimeout(shardId, p.epoch)));
    }

    private void completeHandOff(String shardId) {
        HandOffProgress p = handOffs.remove(shardId);
        if (p != null) {
            p.timer.cancel();
        }
        shardSizes.remove(shardId);
        if (state.ownerOf(shardId) != null) {
            persist(new CoordinatorEvent.ShardHomeDeallocated(shardId), () -> {
                log.info(() -> "shard " + shardId + " deallocated");
                afterRelease(shardId);
            });
        } else {
            afterRelease(shardId);
        }
    }

    private void afterRelease(String shardId) {
        Set<String> requesters = parked.remove(shardId);
        if (requesters != null && !requesters.isEmpty()) {
            allocate(shardId, requesters);
        } else if (settings.rememberEntities()) {
            allocate(shardId, Set.of());
        }
    }

    private void onGracefulShutdown(String regionId) {
        if (!state.isRegistered(regionId)) {
            // nothing allocated there; let it finish
            return;
        }
        if (shuttingDown.add(regionId)) {
            log.info(() -> "region " + regionId + " is shutting down, handing off "
                    + state.shardsOf(regionId).size() + " shards");
        }
        // ignores maxSimultaneousRebalance: the region is leaving either way
        List<Object> work = new ArrayList<>();
        for (String shardId : state.shardsOf(regionId)) {
            work.add(new StartHandOff(shardId));
        }
        defer(work);
    }

    private void regionTerminated(String regionId) {
        proxies.remove(regionId);
        shuttingDown.remove(regionId);
        for (HandOffProgress p : handOffs.values()) {
            if (!p.handOffSent && p.awaitingAcks.remove(regionId) && p.awaitingAcks.isEmpty()) {
                // acks complete without the departed region
                String shardId = shardOf(p);
                if (shardId != null) sendHandOff(shardId, p);
            }
        }
        if (!state.isRegistered(regionId)) {
            return;
        }
        List<String> lost = new ArrayList<>(state.shardsOf(regionId));
        persist(new CoordinatorEvent.RegionTerminated(regionId), () -> {
            log.info(() -> "region " + regionId + " terminated, dropped shards " + lost);
            List<Object> work = new ArrayList<>();
            for (String shardId : lost) {
                HandOffProgress p = handOffs.remove(shardId);
                if (p != null) p.timer.cancel();
                Cancellable c = unackedHostShard.remove(shardId);
                if (c != null) c.cancel();
                shardSizes.remove(shardId);

                Set<String> requesters = parked.remove(shardId);
                if (requesters != null) {
                    requesters.remove(regionId);
                }
                if (requesters != null && !requesters.isEmpty()) {
                    work.add(new Reallocate(shardId, requesters));
                } else if (settings.rememberEntities()) {
                    work.add(new Reallocate(shardId, Set.of()));
                }
            }
            defer(work);
        });
    }

    private String shardOf(HandOffProgress p) {
        for (Map.Entry<String, HandOffProgress> e : handOffs.entrySet()) {
            if (e.getValue() == p) return e.getKey();
        }
        return null;
    }

    // ---------- persistence & transport ----------

    /**
     * Append on the io executor and hold every other message until it is durable.
     * The caller must return right after; {@code andThen} (may be null) runs
     * with the new state once the append succeeded.
     */
    private void persist(CoordinatorEvent event, Runnable andThen) {
        ShardAllocationState next = state.updated(event);
        persisting = true;
        io.tell(() -> {
            try {
                long seq = journal.append(event);
                snapshotPolicy.maybeSnapshot(seq, next, snapshotter);
                mailbox.tell(new Persisted(next, andThen));
            } catch (RuntimeException e) {
                mailbox.tell(new PersistFailed(e));
            }
        });
    }

    private void onPersisted(Persisted p) {
        persisting = false;
        state = p.state();
        if (p.andThen() != null) {
            p.andThen().run();
        }
    }

    /** Fire and forget; every caller has a retry or timeout path. */
    private void send(String to, Object message) {
        CompletableFuture<Void> sent;
        try {
            sent = transport.send(address, to, message);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        sent.whenComplete((ok, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                mailbox.tell(new SendFailed(to, message, cause));
            }
        });
    }

    private void onSendFailed(SendFailed f) {
        log.fine(() -> "send " + f.message().getClass().getSimpleName() + " to " + f.to() + " failed: "
                + f.cause().getMessage());
        if (f.message() instanceof ShardingProtocol.BeginHandOff b) {
            // an unreachable region cannot ack; stop waiting for it
            onBeginHandOffAck(b.shardId(), f.to());
        }
    }

    // ---------- termination ----------

    private void fail(RuntimeException cause) {
        if (status == Status.STOPPED) return;
        log.log(Level.SEVERE, "coordinator failed, stopping instance", cause);
        stopInternal();
        onFatal.accept(cause);
    }

    private void stopInternal() {
        if (status == Status.STOPPED) return;
        status = Status.STOPPED;
        rebalanceTimer.cancel();
        handOffs.values().forEach(p -> p.timer.cancel());
        unackedHostShard.values().forEach(Cancellable::cancel);
        membership.unsubscribe(membershipListener);
        transport.unbind(address);
        mailbox.close();
        stash.clear();
        // behind any append still in flight
        io.tell(() -> {
            try {
                journal.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "closing coordinator journal failed", e);
            }
        });
        log.info("coordinator stopped");
    }
}
