// file: server/src/main/java/io/shardlite/server/coordinator/CoordinatorSupervisor.java
package io.shardlite.server.coordinator;

import io.shardlite.server.runtime.Cancellable;
import io.shardlite.server.runtime.Scheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Keeps exactly one coordinator instance alive on this node.
 * <p>
 * When an instance dies (journal or snapshot failure, allocation conflict) the
 * supervisor waits {@code backoff} and builds a fresh one, which recovers its
 * state from the journal. Regions notice nothing beyond slower answers: their
 * GetShardHome retries land on the new instance once it is bound.
 */
public final class CoordinatorSupervisor implements AutoCloseable {
    private static final Logger log = Logger.getLogger(CoordinatorSupervisor.class.getName());

    private final Function<Consumer<Throwable>, ShardCoordinator> factory;
    private final Scheduler scheduler;
    private final Duration backoff;

    private ShardCoordinator current;
    private Cancellable pendingRestart = Cancellable.NONE;
    private boolean stopped;
    private int restarts;

    /**
     * @param factory builds a new, unstarted coordinator wired to report fatal failures to the given callback
     */
    public CoordinatorSupervisor(Function<Consumer<Throwable>, ShardCoordinator> factory,
                                 Scheduler scheduler,
                                 Duration backoff) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        if (backoff.isNegative()) throw new IllegalArgumentException("backoff must be >= 0");
    }

    public synchronized void start() {
        if (stopped) throw new IllegalStateException("supervisor already stopped");
        if (current == null) {
            spawn();
        }
    }

    /** The live instance, or null while a restart is pending. */
    public synchronized ShardCoordinator current() {
        return current;
    }

    public synchronized int restarts() {
        return restarts;
    }

    @Override
    public synchronized void close() {
        stopped = true;
        pendingRestart.cancel();
        if (current != null) {
            current.stop();
            current = null;
        }
    }

    private void spawn() {
        ShardCoordinator[] holder = new ShardCoordinator[1];
        ShardCoordinator c = factory.apply(cause -> onFailure(holder[0], cause));
        holder[0] = c;
        current = c;
        c.start();
    }

    private synchronized void onFailure(ShardCoordinator failed, Throwable cause) {
        if (stopped || failed != current) {
            return;
        }
        current = null;
        log.warning(() -> "coordinator instance died (" + cause.getMessage() + "), restarting in " + backoff);
        pendingRestart = scheduler.schedule(backoff, this::restart);
    }

    private synchronized void restart() {
        if (stopped || current != null) {
            return;
        }
        restarts++;
        log.info(() -> "restarting coordinator (restart #" + restarts + ")");
        spawn();
    }
}
