// file: server/src/test/java/io/shardlite/server/testkit/TestDispatchers.java
package io.shardlite.server.testkit;

import io.shardlite.server.runtime.Dispatchers;

/** Everything runs on the calling thread; time only moves through the scheduler. */
public final class TestDispatchers {

    private TestDispatchers() {
    }

    public static Dispatchers direct(ManualScheduler scheduler) {
        return new Dispatchers(Runnable::run, Runnable::run, scheduler);
    }
}
