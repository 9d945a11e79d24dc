// file: server/src/main/java/io/shardlite/server/dto/JsonSharding.java
package io.shardlite.server.dto;

/**
 * Optional overrides of the sharding defaults. Absent fields keep the default;
 * durations are in milliseconds.
 */
public class JsonSharding {
    public Integer numberOfShards;
    public Long rebalanceIntervalMillis;
    public Integer rebalanceThreshold;
    public Integer maxSimultaneousRebalance;
    public Long passivateIdleAfterMillis;
    public Long handOffTimeoutMillis;
    public Long shardHandOffTimeoutMillis;
    public Long retryIntervalMillis;
    public Integer bufferSize;
    public Integer maxResolveAttempts;
    public Integer maxDeliveryAttempts;
    public Boolean rememberEntities;
    public Integer snapshotAfter;
    public Long coordinatorFailureBackoffMillis;
    public Long requestTimeoutMillis;
}
