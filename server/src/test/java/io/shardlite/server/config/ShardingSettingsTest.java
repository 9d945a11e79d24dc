// file: server/src/test/java/io/shardlite/server/config/ShardingSettingsTest.java
package io.shardlite.server.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ShardingSettingsTest {

    @Test
    void defaults_are_valid_and_passivation_is_on() {
        var s = ShardingSettings.defaults();

        assertTrue(s.passivationEnabled());
        assertFalse(s.rememberEntities());
        assertTrue(s.shardHandOffTimeout().compareTo(s.handOffTimeout()) < 0);
    }

    @Test
    void zero_idle_timeout_disables_passivation() {
        assertFalse(ShardingSettings.defaults().withPassivateIdleAfter(Duration.ZERO).passivationEnabled());
    }

    @Test
    void withers_change_only_their_field() {
        var base = ShardingSettings.defaults();
        var changed = base.withBufferSize(7);

        assertEquals(7, changed.bufferSize());
        assertEquals(base.withBufferSize(base.bufferSize()), base);
        assertEquals(base.numberOfShards(), changed.numberOfShards());
        assertEquals(base.retryInterval(), changed.retryInterval());
    }

    @Test
    void rejects_nonsense() {
        var s = ShardingSettings.defaults();
        assertThrows(IllegalArgumentException.class, () -> s.withNumberOfShards(0));
        assertThrows(IllegalArgumentException.class, () -> s.withRebalanceThreshold(0));
        assertThrows(IllegalArgumentException.class, () -> s.withMaxSimultaneousRebalance(0));
        assertThrows(IllegalArgumentException.class, () -> s.withRetryInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> s.withPassivateIdleAfter(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> s.withSnapshotAfter(0));
        assertThrows(IllegalArgumentException.class,
                () -> s.withHandOffTimeouts(Duration.ofSeconds(5), Duration.ofSeconds(5)),
                "shard timeout must be strictly below the coordinator timeout");
    }
}
