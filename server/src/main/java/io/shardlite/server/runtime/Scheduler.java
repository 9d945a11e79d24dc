// file: server/src/main/java/io/shardlite/server/runtime/Scheduler.java
package io.shardlite.server.runtime;

import java.time.Duration;

/**
 * Timer service used for every timeout and periodic tick.
 * <p>
 * Tasks should only enqueue a message into a {@link Mailbox}; state changes
 * happen when the owning machine processes that message.
 */
public interface Scheduler {

    Cancellable schedule(Duration delay, Runnable task);

    Cancellable scheduleAtFixedRate(Duration initialDelay, Duration interval, Runnable task);

    /** Current time in milliseconds on this scheduler's clock. */
    long currentTimeMillis();
}
