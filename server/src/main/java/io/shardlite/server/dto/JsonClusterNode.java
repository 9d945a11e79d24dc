// file: server/src/main/java/io/shardlite/server/dto/JsonClusterNode.java
package io.shardlite.server.dto;

public class JsonClusterNode {
    public String nodeId;
    public String host;
    public int grpcPort;
    public int httpPort;
}
