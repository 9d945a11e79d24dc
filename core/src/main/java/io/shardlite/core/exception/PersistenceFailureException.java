// file: core/src/main/java/io/shardlite/core/exception/PersistenceFailureException.java
package io.shardlite.core.exception;

/**
 * A durable write (journal append, snapshot) did not complete.
 */
public class PersistenceFailureException extends ShardingException {

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
