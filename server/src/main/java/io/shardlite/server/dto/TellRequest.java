// file: server/src/main/java/io/shardlite/server/dto/TellRequest.java
package io.shardlite.server.dto;

/**
 * JSON body for POST /entities/{entityId}.
 * Example:
 *   { "text": "hello" }
 */
public class TellRequest {
    public String text;
}
