// file: server/src/main/java/io/shardlite/server/dto/JsonConfig.java
package io.shardlite.server.dto;

import java.util.List;

/**
 * Root of the JSON cluster file.
 * Example:
 *   {
 *     "localNodeId": "node-a",
 *     "coordinatorNodeId": "node-a",
 *     "nodes": [ { "nodeId": "node-a", "host": "127.0.0.1", "grpcPort": 50051, "httpPort": 8080 } ],
 *     "sharding": { "numberOfShards": 30, "rememberEntities": true }
 *   }
 */
public class JsonConfig {
    public String localNodeId;
    public String coordinatorNodeId;
    public List<JsonClusterNode> nodes;
    public JsonSharding sharding;
}
