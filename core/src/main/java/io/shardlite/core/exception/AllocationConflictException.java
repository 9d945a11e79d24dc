// file: core/src/main/java/io/shardlite/core/exception/AllocationConflictException.java
package io.shardlite.core.exception;

/**
 * Two owners were observed for the same shard. Coordinator serialization makes
 * this impossible in a correct run, so it is treated as a protocol bug and is
 * fatal to the coordinator instance that observes it.
 */
public class AllocationConflictException extends ShardingException {

    public AllocationConflictException(String shardId, String existingOwner, String newOwner) {
        super("shard " + shardId + " already allocated to " + existingOwner + ", refusing " + newOwner);
    }
}
