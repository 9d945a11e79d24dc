// file: core/src/main/java/io/shardlite/core/HashCodeMessageExtractor.java
package io.shardlite.core;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * {@link MessageExtractor} that spreads entities over a fixed number of shards
 * by hashing the entity id.
 * <p>
 * Properties:
 *  - Deterministic across JVMs: uses the first 8 bytes of SHA-256 rather than
 *    {@link String#hashCode()}, so every node computes the same shard id.
 *  - {@link ShardingEnvelope} and {@link StartEntity} are handled here;
 *    subclasses only map their own message types via {@link #entityIdOf}.
 *  - Shard ids are the decimal strings "0" .. numberOfShards-1.
 */
public abstract class HashCodeMessageExtractor implements MessageExtractor {

    private final int numberOfShards;

    protected HashCodeMessageExtractor(int numberOfShards) {
        if (numberOfShards <= 0) throw new IllegalArgumentException("numberOfShards must be > 0");
        this.numberOfShards = numberOfShards;
    }

    /**
     * Extractor that only understands {@link ShardingEnvelope} and {@link StartEntity}.
     */
    public static HashCodeMessageExtractor forEnvelopes(int numberOfShards) {
        return new HashCodeMessageExtractor(numberOfShards) {
            @Override
            protected String entityIdOf(Object message) {
                return null;
            }
        };
    }

    /**
     * Entity id for application messages that are not envelopes, or null.
     */
    protected abstract String entityIdOf(Object message);

    @Override
    public final String entityId(Object message) {
        if (message instanceof ShardingEnvelope envelope) {
            return envelope.entityId();
        }
        if (message instanceof StartEntity start) {
            return start.entityId();
        }
        return entityIdOf(message);
    }

    @Override
    public Object entityMessage(Object message) {
        if (message instanceof ShardingEnvelope envelope) {
            return envelope.message();
        }
        return message;
    }

    @Override
    public String shardId(Object message) {
        String entityId = entityId(message);
        return entityId == null ? null : shardIdForEntity(entityId);
    }

    public String shardIdForEntity(String entityId) {
        return Long.toString(Long.remainderUnsigned(hash64(entityId), numberOfShards));
    }

    public int numberOfShards() {
        return numberOfShards;
    }

    private static long hash64(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] h = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(h, 0, 8).order(ByteOrder.BIG_ENDIAN).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
