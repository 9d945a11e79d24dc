// file: server/src/main/java/io/shardlite/server/region/ShardRegion.java
package io.shardlite.server.region;

import io.shardlite.core.MessageExtractor;
import io.shardlite.core.ShardingMessage;
import io.shardlite.core.exception.DeliveryFailedException;
import io.shardlite.core.exception.MessageEncodingException;
import io.shardlite.core.exception.ShardingException;
import io.shardlite.core.exception.UnknownPartitionException;
import io.shardlite.core.protocol.ShardingProtocol;
import io.shardlite.server.config.ShardingSettings;
import io.shardlite.server.membership.Membership;
import io.shardlite.server.membership.MembershipEvent;
import io.shardlite.server.membership.MembershipListener;
import io.shardlite.server.runtime.Cancellable;
import io.shardlite.server.runtime.Dispatchers;
import io.shardlite.server.runtime.EntityFactory;
import io.shardlite.server.runtime.Mailbox;
import io.shardlite.server.shard.Shard;
import io.shardlite.server.transport.Transport;
import io.shardlite.storage.RememberEntitiesStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Logger;

/**
 * Per-node router and shard-location cache.
 * <p>
 * Responsibilities:
 *  - Resolve each inbound message once into a {@link ShardingMessage}.
 *  - Deliver to a local {@link Shard}, forward to the owning region, or buffer
 *    while asking the coordinator (one GetShardHome per shard at a time).
 *  - Host shards the coordinator assigns here, and stop them on HandOff.
 *  - Retry: Register and GetShardHome every retryInterval; failed remote
 *    forwards invalidate the cache entry and go back through resolution.
 *  - Give up only with {@link DeliveryFailedException} or
 *    {@link UnknownPartitionException}, reported to the {@link UndeliveredHandler}.
 *  - Report the entity count of each local shard to the coordinator every
 *    rebalanceInterval.
 * <p>
 * Ordering: every routed message gets an arrival number, and a shard's buffer
 * stays sorted by it, so a forward that fails late goes back ahead of newer
 * messages. Messages a local shard hands back during handoff were delivered to
 * it before anything buffered since, so they are flushed first.
 * <p>
 * A proxy region routes the same way but never hosts shards.
 * <p>
 * All state is confined to the region's mailbox; the public methods only enqueue.
 */
public final class ShardRegion {
    private static final Logger log = Logger.getLogger(ShardRegion.class.getName());

    private final String regionId;
    private final boolean proxy;
    private final MessageExtractor extractor;
    private final EntityFactory factory;
    private final ShardingSettings settings;
    private final Transport transport;
    private final String coordinatorAddress;
    private final Membership membership;
    private final RememberEntitiesStore store;
    private final Object stopMessage;
    private final Dispatchers dispatchers;
    private final UndeliveredHandler undelivered;
    private final Mailbox<Object> mailbox;
    private final MembershipListener membershipListener;
    private final Shard.Parent shardParent;

    private final Map<String, String> owners = new HashMap<>();
    private final Map<String, Shard> shards = new TreeMap<>();
    private final Set<String> handingOff = new HashSet<>();
    private final Map<String, ShardBuffer> buffers = new LinkedHashMap<>();
    private final Map<String, Resolving> resolving = new HashMap<>();
    private int buffered;
    private long arrivals;

    private boolean registered;
    private Cancellable registerTimer = Cancellable.NONE;
    private Cancellable sizesTimer = Cancellable.NONE;
    private CompletableFuture<Void> shutdownFuture;
    private Cancellable shutdownTimer = Cancellable.NONE;
    private boolean stopped;

    /**
     * Host region.
     *
     * @param store       remember-entities store, or null
     * @param stopMessage delivered to entities before they stop, or null
     */
    public ShardRegion(String regionId,
                       MessageExtractor extractor,
                       EntityFactory factory,
                       ShardingSettings settings,
                       Transport transport,
                       String coordinatorAddress,
                       Membership membership,
                       RememberEntitiesStore store,
                       Object stopMessage,
                       Dispatchers dispatchers,
                       UndeliveredHandler undelivered) {
        this(regionId, false, extractor, factory, settings, transport, coordinatorAddress, membership,
                store, stopMessage, dispatchers, undelivered);
    }

    private ShardRegion(String regionId,
                        boolean proxy,
                        MessageExtractor extractor,
                        EntityFactory factory,
                        ShardingSettings settings,
                        Transport transport,
                        String coordinatorAddress,
                        Membership membership,
                        RememberEntitiesStore store,
                        Object stopMessage,
                        Dispatchers dispatchers,
                        UndeliveredHandler undelivered) {
        this.regionId = Objects.requireNonNull(regionId, "regionId");
        if (regionId.isBlank() || regionId.contains("/")) {
            throw new IllegalArgumentException("regionId must be non-blank and contain no '/'");
        }
        this.proxy = proxy;
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.factory = proxy ? null : Objects.requireNonNull(factory, "factory");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.coordinatorAddress = Objects.requireNonNull(coordinatorAddress, "coordinatorAddress");
        this.membership = Objects.requireNonNull(membership, "membership");
        this.store = store;
        this.stopMessage = stopMessage;
        this.dispatchers = Objects.requireNonNull(dispatchers, "dispatchers");
        this.undelivered = undelivered == null ? UndeliveredHandler.logging() : undelivered;
        this.mailbox = new Mailbox<>("region-" + regionId, dispatchers.executor(), this::receive);
        this.membershipListener = mailbox::tell;
        this.shardParent = new Shard.Parent() {
            @Override
            public void shardStarted(String shardId) {
                mailbox.tell(new ShardRunning(shardId));
            }

            @Override
            public void shardStopped(String shardId) {
                mailbox.tell(new ShardTerminated(shardId));
            }

            @Override
            public void returnToRegion(String shardId, ShardingMessage message) {
                mailbox.tell(new Returned(message));
            }
        };
    }

    /** Routing-only region: never hosts shards, never receives allocations. */
    public static ShardRegion proxy(String regionId,
                                    MessageExtractor extractor,
                                    ShardingSettings settings,
                                    Transport transport,
                                    String coordinatorAddress,
                                    Membership membership,
                                    Dispatchers dispatchers,
                                    UndeliveredHandler undelivered) {
        return new ShardRegion(regionId, true, extractor, null, settings, transport, coordinatorAddress,
                membership, null, null, dispatchers, undelivered);
    }

    // ---------- public API ----------

    /** Bind the transport address and start registering with the coordinator. */
    public void start() {
        transport.bind(regionId, (from, message) -> mailbox.tell(new Remote(message)));
        membership.subscribe(membershipListener);
        mailbox.tell(new RegisterTick());
        registerTimer = dispatchers.scheduler().scheduleAtFixedRate(
                settings.retryInterval(), settings.retryInterval(), () -> mailbox.tell(new RegisterTick()));
        if (!proxy) {
            sizesTimer = dispatchers.scheduler().scheduleAtFixedRate(
                    settings.rebalanceInterval(), settings.rebalanceInterval(), () -> mailbox.tell(new SizesTick()));
        }
        log.info(() -> (proxy ? "proxy " : "region ") + regionId + " started, coordinator at " + coordinatorAddress);
    }

    /** Route a message to its entity, wherever it lives. */
    public void tell(Object message) {
        Objects.requireNonNull(message, "message");
        if (!mailbox.tell(new Inbound(message))) {
            undelivered.onUndelivered(message, new DeliveryFailedException(null, "region " + regionId + " is stopped"));
        }
    }

    /**
     * Hand off every local shard, then tell the coordinator this region is gone.
     * The future completes once no shard is left.
     */
    public CompletableFuture<Void> gracefulShutdown() {
        CompletableFuture<Void> f = new CompletableFuture<>();
        if (!mailbox.tell(new Shutdown(f))) {
            f.complete(null);
        }
        return f;
    }

    /** Stop at once: local shards stop their entities, nothing is handed off. */
    public void stop() {
        mailbox.tell(new Stop());
    }

    public CompletableFuture<RegionState> currentState() {
        CompletableFuture<RegionState> f = new CompletableFuture<>();
        if (!mailbox.tell(new GetState(f))) {
            f.complete(new RegionState(regionId, proxy, Map.of()));
        }
        return f;
    }

    public String regionId() {
        return regionId;
    }

    public boolean isProxy() {
        return proxy;
    }

    // ---------- internal protocol ----------

    private record Inbound(Object message) {
    }

    private record Remote(Object message) {
    }

    private record Returned(ShardingMessage message) {
    }

    private record ShardRunning(String shardId) {
    }

    private record ShardTerminated(String shardId) {
    }

    private record RegisterTick() {
    }

    private record SizesTick() {
    }

    private record SizesCollected(Map<String, Integer> sizes) {
    }

    private record ForwardFailed(String owner, String shardId, Pending pending, Throwable cause) {
    }

    private record ResolveTick(String shardId) {
    }

    private record ShutdownTick() {
    }

    private record Shutdown(CompletableFuture<Void> done) {
    }

    private record Stop() {
    }

    private record GetState(CompletableFuture<RegionState> reply) {
    }

    /** A routed message, its arrival number and the number of failed remote deliveries so far. */
    private record Pending(ShardingMessage message, int failedAttempts, long arrival) {

        Pending failedOnce() {
            return new Pending(message, failedAttempts + 1, arrival);
        }
    }

    /** Messages of one shard waiting for a known owner. */
    private static final class ShardBuffer {
        /** Handed back by the local shard during handoff. */
        final Deque<Pending> returned = new ArrayDeque<>();
        /** Sorted by arrival. */
        final List<Pending> waiting = new ArrayList<>();

        void add(Pending p, boolean fromLocalShard) {
            if (fromLocalShard) {
                returned.add(p);
                return;
            }
            int i = waiting.size();
            while (i > 0 && waiting.get(i - 1).arrival() > p.arrival()) {
                i--;
            }
            waiting.add(i, p);
        }

        int size() {
            return returned.size() + waiting.size();
        }

        List<Pending> inFlushOrder() {
            List<Pending> out = new ArrayList<>(returned);
            out.addAll(waiting);
            return out;
        }
    }

    private static final class Resolving {
        int attempts;
        Cancellable timer = Cancellable.NONE;
    }

    private void receive(Object msg) {
        if (msg instanceof Inbound m) {
            route(ShardingMessage.resolve(extractor, m.message()));
        } else if (msg instanceof Remote m) {
            if (m.message() instanceof ShardingProtocol.Control c) {
                onControl(c);
            } else {
                // forwarded by another region; ownership may have moved again since
                route(ShardingMessage.resolve(extractor, m.message()));
            }
        } else if (msg instanceof Returned m) {
            onReturned(m.message());
        } else if (msg instanceof ForwardFailed m) {
            onForwardFailed(m);
        } else if (msg instanceof ShardRunning m) {
            log.fine(() -> "region " + regionId + ": shard " + m.shardId() + " running");
        } else if (msg instanceof ShardTerminated m) {
            onShardStopped(m.shardId());
        } else if (msg instanceof ResolveTick m) {
            onResolveTick(m.shardId());
        } else if (msg instanceof RegisterTick) {
            if (!registered) {
                sendToCoordinator(proxy
                        ? new ShardingProtocol.RegisterProxy(regionId)
                        : new ShardingProtocol.Register(regionId));
            }
        } else if (msg instanceof SizesTick) {
            collectSizes();
        } else if (msg instanceof SizesCollected m) {
            if (registered && !m.sizes().isEmpty()) {
                sendToCoordinator(new ShardingProtocol.ShardSizes(regionId, m.sizes()));
            }
        } else if (msg instanceof MembershipEvent e) {
            onMembershipEvent(e);
        } else if (msg instanceof GetState m) {
            reportState(m.reply());
        } else if (msg instanceof Shutdown m) {
            onShutdown(m.done());
        } else if (msg instanceof ShutdownTick) {
            if (shutdownFuture != null && !shards.isEmpty()) {
                sendToCoordinator(new ShardingProtocol.GracefulShutdownRequest(regionId));
            }
        } else if (msg instanceof Stop) {
            stopInternal("stopped");
        } else {
            log.warning(() -> "region " + regionId + ": unexpected message " + msg.getClass().getName());
        }
    }

    // ---------- routing ----------

    private void route(ShardingMessage sm) {
        if (sm instanceof ShardingMessage.Unroutable) {
            undelivered.onUndelivered(sm.original(), new UnknownPartitionException(sm.original()));
            return;
        }
        dispatch(sm.shardId(), new Pending(sm, 0, arrivals++));
    }

    private void dispatch(String shardId, Pending p) {
        String owner = owners.get(shardId);
        if (owner == null) {
            buffer(shardId, p, false);
        } else if (owner.equals(regionId)) {
            deliverLocally(shardId, p);
        } else {
            forward(owner, shardId, p);
        }
    }

    /** A message the local shard did not deliver; it is older than anything buffered since the handoff began. */
    private void onReturned(ShardingMessage sm) {
        String shardId = sm.shardId();
        Pending p = new Pending(sm, 0, arrivals++);
        if (owners.get(shardId) == null) {
            buffer(shardId, p, true);
        } else {
            dispatch(shardId, p);
        }
    }

    private void deliverLocally(String shardId, Pending p) {
        Shard shard = shards.get(shardId);
        if (shard == null || handingOff.contains(shardId)) {
            owners.remove(shardId);
            buffer(shardId, p, false);
            return;
        }
        log.finer(() -> "region " + regionId + ": local delivery to shard " + shardId);
        shard.deliver(p.message());
    }

    private void forward(String owner, String shardId, Pending p) {
        log.finer(() -> "region " + regionId + ": forwarding to " + owner + " for shard " + shardId);
        CompletableFuture<Void> sent;
        try {
            sent = transport.send(regionId, owner, p.message().original());
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        sent.whenComplete((ok, error) -> {
            if (error != null) {
                mailbox.tell(new ForwardFailed(owner, shardId, p, unwrap(error)));
            }
        });
    }

    private void onForwardFailed(ForwardFailed f) {
        String shardId = f.shardId();
        Pending p = f.pending();
        if (f.cause() instanceof MessageEncodingException) {
            fail(shardId, p, "message cannot be sent to " + f.owner() + ": " + f.cause().getMessage(), f.cause());
            return;
        }
        log.warning(() -> "region " + regionId + ": forward to " + f.owner() + " failed, re-resolving shard "
                + shardId + ": " + f.cause().getMessage());
        if (f.owner().equals(owners.get(shardId))) {
            owners.remove(shardId);
        }
        Pending again = p.failedOnce();
        if (again.failedAttempts() >= settings.maxDeliveryAttempts()) {
            fail(shardId, again, "delivery failed " + again.failedAttempts() + " times, last to " + f.owner(), f.cause());
        } else if (owners.containsKey(shardId)) {
            // a newer owner is known already
            dispatch(shardId, again);
        } else {
            buffer(shardId, again, false);
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private void buffer(String shardId, Pending p, boolean fromLocalShard) {
        if (buffered >= settings.bufferSize()) {
            fail(shardId, p, "region " + regionId + " buffer full (" + settings.bufferSize() + " messages)", null);
            return;
        }
        buffers.computeIfAbsent(shardId, k -> new ShardBuffer()).add(p, fromLocalShard);
        buffered++;
        if (!resolving.containsKey(shardId) && !handingOff.contains(shardId)) {
            Resolving r = new Resolving();
            resolving.put(shardId, r);
            requestShardHome(shardId, r);
        }
    }

    private void requestShardHome(String shardId, Resolving r) {
        r.attempts++;
        log.fine(() -> "region " + regionId + ": GetShardHome(" + shardId + ") attempt " + r.attempts);
        sendToCoordinator(new ShardingProtocol.GetShardHome(shardId, regionId));
        r.timer = dispatchers.scheduler().schedule(settings.retryInterval(),
                () -> mailbox.tell(new ResolveTick(shardId)));
    }

    private void onResolveTick(String shardId) {
        Resolving r = resolving.get(shardId);
        if (r == null) return;
        if (r.attempts >= settings.maxResolveAttempts()) {
            resolving.remove(shardId);
            log.warning(() -> "region " + regionId + ": no home for shard " + shardId + " after "
                    + r.attempts + " attempts");
            failBuffered(shardId, "no home for shard " + shardId + " after " + r.attempts + " attempts");
        } else {
            requestShardHome(shardId, r);
        }
    }

    private void flush(String shardId) {
        ShardBuffer b = buffers.remove(shardId);
        if (b == null) return;
        buffered -= b.size();
        for (Pending p : b.inFlushOrder()) {
            try {
                dispatch(shardId, p);
            } catch (RuntimeException e) {
                fail(shardId, p, "routing failed: " + e.getMessage(), e);
            }
        }
    }

    private void failBuffered(String shardId, String reason) {
        ShardBuffer b = buffers.remove(shardId);
        if (b == null) return;
        buffered -= b.size();
        for (Pending p : b.inFlushOrder()) {
            fail(shardId, p, reason, null);
        }
    }

    private void fail(String shardId, Pending p, String reason, Throwable cause) {
        ShardingException ex = cause == null
                ? new DeliveryFailedException(shardId, reason)
                : new DeliveryFailedException(shardId, reason, cause);
        undelivered.onUndelivered(p.message().original(), ex);
    }

    // ---------- coordinator protocol ----------

    private void onControl(ShardingProtocol.Control c) {
        if (c instanceof ShardingProtocol.ShardHome m) {
            onShardHome(m.shardId(), m.regionId());
        } else if (c instanceof ShardingProtocol.RegisterAck) {
            if (!registered) {
                registered = true;
                registerTimer.cancel();
                log.info(() -> "region " + regionId + " registered with coordinator");
            }
        } else if (c instanceof ShardingProtocol.HostShard m) {
            onHostShard(m.shardId());
        } else if (c instanceof ShardingProtocol.BeginHandOff m) {
            owners.remove(m.shardId());
            sendToCoordinator(new ShardingProtocol.BeginHandOffAck(m.shardId(), regionId));
        } else if (c instanceof ShardingProtocol.HandOff m) {
            onHandOff(m.shardId());
        } else {
            log.fine(() -> "region " + regionId + ": ignoring " + c);
        }
    }

    private void onShardHome(String shardId, String owner) {
        Resolving r = resolving.remove(shardId);
        if (r != null) {
            r.timer.cancel();
        }
        if (owner.equals(regionId)) {
            if (proxy) {
                log.warning(() -> "proxy " + regionId + " was named home of shard " + shardId + ", ignoring");
                return;
            }
            if (handingOff.contains(shardId)) {
                // the previous instance is still stopping; resolve again once it is gone
                return;
            }
            ensureShard(shardId);
        }
        log.fine(() -> "region " + regionId + ": shard " + shardId + " is at " + owner);
        owners.put(shardId, owner);
        flush(shardId);
    }

    private void onHostShard(String shardId) {
        if (proxy) {
            log.warning(() -> "proxy " + regionId + " asked to host shard " + shardId + ", ignoring");
            return;
        }
        if (handingOff.contains(shardId)) {
            return; // coordinator resends HostShard until acknowledged
        }
        ensureShard(shardId);
        owners.put(shardId, regionId);
        sendToCoordinator(new ShardingProtocol.ShardStarted(shardId, regionId));
        Resolving r = resolving.remove(shardId);
        if (r != null) {
            r.timer.cancel();
        }
        flush(shardId);
    }

    private void onHandOff(String shardId) {
        owners.remove(shardId);
        Shard shard = shards.get(shardId);
        if (shard == null) {
            sendToCoordinator(new ShardingProtocol.ShardStopped(shardId, regionId));
            return;
        }
        if (handingOff.add(shardId)) {
            log.info(() -> "region " + regionId + " handing off shard " + shardId);
            shard.handOff();
        }
    }

    private void onShardStopped(String shardId) {
        shards.remove(shardId);
        handingOff.remove(shardId);
        sendToCoordinator(new ShardingProtocol.ShardStopped(shardId, regionId));
        if (buffers.containsKey(shardId) && !resolving.containsKey(shardId)) {
            Resolving r = new Resolving();
            resolving.put(shardId, r);
            requestShardHome(shardId, r);
        }
        if (shutdownFuture != null && shards.isEmpty()) {
            finishShutdown();
        }
    }

    private void ensureShard(String shardId) {
        if (shards.containsKey(shardId)) return;
        log.info(() -> "region " + regionId + " starting shard " + shardId);
        Shard shard = new Shard(shardId, regionId, factory, settings, store, stopMessage, dispatchers, shardParent);
        shards.put(shardId, shard);
        shard.start();
    }

    /** Fire and forget; every control message has a retry or timeout behind it. */
    private void sendToCoordinator(ShardingProtocol.Control message) {
        transport.send(regionId, coordinatorAddress, message).whenComplete((ok, error) -> {
            if (error != null) {
                log.fine(() -> "region " + regionId + ": coordinator unreachable for "
                        + message.getClass().getSimpleName() + ": " + unwrap(error).getMessage());
            }
        });
    }

    private void collectSizes() {
        if (shards.isEmpty()) return;
        List<String> ids = new ArrayList<>(shards.keySet());
        List<CompletableFuture<Set<String>>> futures = new ArrayList<>();
        for (String id : ids) {
            futures.add(shards.get(id).entityIds());
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).whenComplete((v, t) -> {
            Map<String, Integer> sizes = new TreeMap<>();
            for (int i = 0; i < ids.size(); i++) {
                sizes.put(ids.get(i), futures.get(i).getNow(Set.of()).size());
            }
            mailbox.tell(new SizesCollected(sizes));
        });
    }

    // ---------- membership ----------

    private void onMembershipEvent(MembershipEvent e) {
        if (e instanceof MembershipEvent.RegionRemoved removed && !removed.regionId().equals(regionId)) {
            int before = owners.size();
            owners.values().removeIf(removed.regionId()::equals);
            int dropped = before - owners.size();
            if (dropped > 0) {
                log.info(() -> "region " + regionId + ": dropped " + dropped + " cache entries of removed region "
                        + removed.regionId());
            }
        }
    }

    // ---------- shutdown & state ----------

    private void onShutdown(CompletableFuture<Void> done) {
        if (shutdownFuture != null) {
            shutdownFuture.whenComplete((v, t) -> done.complete(null));
            return;
        }
        shutdownFuture = done;
        log.info(() -> "region " + regionId + " shutting down gracefully, " + shards.size() + " shards to hand off");
        if (shards.isEmpty()) {
            finishShutdown();
            return;
        }
        sendToCoordinator(new ShardingProtocol.GracefulShutdownRequest(regionId));
        shutdownTimer = dispatchers.scheduler().scheduleAtFixedRate(
                settings.retryInterval(), settings.retryInterval(), () -> mailbox.tell(new ShutdownTick()));
    }

    private void finishShutdown() {
        sendToCoordinator(new ShardingProtocol.RegionStopped(regionId));
        CompletableFuture<Void> done = shutdownFuture;
        stopInternal("shut down");
        done.complete(null);
    }

    private void stopInternal(String why) {
        if (stopped) return;
        stopped = true;
        registerTimer.cancel();
        sizesTimer.cancel();
        shutdownTimer.cancel();
        resolving.values().forEach(r -> r.timer.cancel());
        resolving.clear();
        for (String shardId : new ArrayList<>(buffers.keySet())) {
            failBuffered(shardId, "region " + regionId + " " + why);
        }
        for (Shard shard : shards.values()) {
            shard.handOff();
        }
        shards.clear();
        membership.unsubscribe(membershipListener);
        transport.unbind(regionId);
        mailbox.close();
        log.info(() -> "region " + regionId + " " + why);
    }

    private void reportState(CompletableFuture<RegionState> reply) {
        List<String> ids = new ArrayList<>(shards.keySet());
        List<CompletableFuture<Set<String>>> futures = new ArrayList<>();
        for (String id : ids) {
            futures.add(shards.get(id).entityIds());
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).whenComplete((v, t) -> {
            Map<String, Set<String>> out = new TreeMap<>();
            for (int i = 0; i < ids.size(); i++) {
                out.put(ids.get(i), futures.get(i).getNow(Set.of()));
            }
            reply.complete(new RegionState(regionId, proxy, out));
        });
    }
}
