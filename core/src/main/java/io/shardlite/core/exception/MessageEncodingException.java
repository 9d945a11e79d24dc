// file: core/src/main/java/io/shardlite/core/exception/MessageEncodingException.java
package io.shardlite.core.exception;

/**
 * A message cannot be put on the wire or read back from it: its type is not
 * allowed, or its body does not serialize. Permanent; resending cannot help.
 */
public class MessageEncodingException extends ShardingException {

    private final String type;

    public MessageEncodingException(String type, String message) {
        super(message);
        this.type = type;
    }

    public MessageEncodingException(String type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    /** Class name of the offending message. */
    public String type() {
        return type;
    }
}
