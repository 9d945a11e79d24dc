// file: server/src/main/java/io/shardlite/server/cluster/ClusterConfig.java
package io.shardlite.server.cluster;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shardlite.server.config.ShardingSettings;
import io.shardlite.server.dto.JsonClusterNode;
import io.shardlite.server.dto.JsonConfig;
import io.shardlite.server.dto.JsonSharding;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static cluster layout: which nodes exist, where they listen, which one runs
 * the coordinator, and the sharding settings every node must agree on.
 */
public final class ClusterConfig {

    public record Node(
            String nodeId,
            String host,
            int grpcPort,
            int httpPort
    ) {
        public Node {
            Objects.requireNonNull(nodeId, "nodeId");
            Objects.requireNonNull(host, "host");
            if (nodeId.isBlank()) throw new IllegalArgumentException("nodeId must not be blank");
            if (nodeId.contains("/")) throw new IllegalArgumentException("nodeId must not contain '/'");
            if (grpcPort <= 0 || grpcPort > 65535) throw new IllegalArgumentException("grpcPort out of range");
            if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("httpPort out of range");
        }

        public String grpcTarget() {
            return host + ":" + grpcPort;
        }
    }

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final String localNodeId;
    private final String coordinatorNodeId;
    private final List<Node> nodes;
    private final ShardingSettings settings;

    public ClusterConfig(String localNodeId,
                         String coordinatorNodeId,
                         List<Node> nodes,
                         ShardingSettings settings) {
        if (nodes == null || nodes.isEmpty()) throw new IllegalArgumentException("nodes must not be empty");
        Set<String> ids = new HashSet<>();
        for (Node n : nodes) {
            if (!ids.add(n.nodeId())) throw new IllegalArgumentException("duplicate nodeId " + n.nodeId());
        }
        this.localNodeId = Objects.requireNonNull(localNodeId, "localNodeId");
        this.coordinatorNodeId = Objects.requireNonNull(coordinatorNodeId, "coordinatorNodeId");
        if (!ids.contains(coordinatorNodeId)) {
            throw new IllegalArgumentException("coordinatorNodeId %s not present in cluster nodes".formatted(coordinatorNodeId));
        }
        this.nodes = List.copyOf(nodes);
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /** One node that is its own coordinator, with default settings. */
    public static ClusterConfig singleNode(String nodeId, int grpcPort, int httpPort) {
        return new ClusterConfig(nodeId, nodeId,
                List.of(new Node(nodeId, "localhost", grpcPort, httpPort)),
                ShardingSettings.defaults());
    }

    /**
     * @param overrideLocalNodeId the CLI --node-id; wins over the file's localNodeId when present
     */
    public static ClusterConfig fromJsonFile(Path path, String overrideLocalNodeId) {
        try {
            JsonConfig cfg = MAPPER.readValue(path.toFile(), JsonConfig.class);
            return fromJson(cfg, overrideLocalNodeId);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load ClusterConfig from " + path, e);
        }
    }

    public static ClusterConfig fromJson(String json, String overrideLocalNodeId) {
        try {
            return fromJson(MAPPER.readValue(json, JsonConfig.class), overrideLocalNodeId);
        } catch (IOException e) {
            throw new IllegalArgumentException("invalid cluster config JSON", e);
        }
    }

    private static ClusterConfig fromJson(JsonConfig cfg, String overrideLocalNodeId) {
        if (cfg.nodes == null) throw new IllegalArgumentException("nodes must not be empty");
        List<Node> nodeList = cfg.nodes.stream()
                .map(ClusterConfig::toNode)
                .toList();

        String localId = (overrideLocalNodeId != null && !overrideLocalNodeId.isBlank())
                ? overrideLocalNodeId
                : cfg.localNodeId;
        String coordinatorId = cfg.coordinatorNodeId != null
                ? cfg.coordinatorNodeId
                : nodeList.get(0).nodeId();

        return new ClusterConfig(localId, coordinatorId, nodeList, toSettings(cfg.sharding));
    }

    private static Node toNode(JsonClusterNode n) {
        return new Node(n.nodeId, n.host == null ? "localhost" : n.host, n.grpcPort, n.httpPort);
    }

    static ShardingSettings toSettings(JsonSharding s) {
        ShardingSettings out = ShardingSettings.defaults();
        if (s == null) return out;
        if (s.numberOfShards != null) out = out.withNumberOfShards(s.numberOfShards);
        if (s.rebalanceIntervalMillis != null) out = out.withRebalanceInterval(millis(s.rebalanceIntervalMillis));
        if (s.rebalanceThreshold != null) out = out.withRebalanceThreshold(s.rebalanceThreshold);
        if (s.maxSimultaneousRebalance != null) out = out.withMaxSimultaneousRebalance(s.maxSimultaneousRebalance);
        if (s.passivateIdleAfterMillis != null) out = out.withPassivateIdleAfter(millis(s.passivateIdleAfterMillis));
        if (s.handOffTimeoutMillis != null || s.shardHandOffTimeoutMillis != null) {
            Duration coordinator = s.handOffTimeoutMillis != null ? millis(s.handOffTimeoutMillis) : out.handOffTimeout();
            Duration shard = s.shardHandOffTimeoutMillis != null ? millis(s.shardHandOffTimeoutMillis) : out.shardHandOffTimeout();
            out = out.withHandOffTimeouts(coordinator, shard);
        }
        if (s.retryIntervalMillis != null) out = out.withRetryInterval(millis(s.retryIntervalMillis));
        if (s.bufferSize != null) out = out.withBufferSize(s.bufferSize);
        if (s.maxResolveAttempts != null) out = out.withMaxResolveAttempts(s.maxResolveAttempts);
        if (s.maxDeliveryAttempts != null) out = out.withMaxDeliveryAttempts(s.maxDeliveryAttempts);
        if (s.rememberEntities != null) out = out.withRememberEntities(s.rememberEntities);
        if (s.snapshotAfter != null) out = out.withSnapshotAfter(s.snapshotAfter);
        if (s.coordinatorFailureBackoffMillis != null) {
            out = out.withCoordinatorFailureBackoff(millis(s.coordinatorFailureBackoffMillis));
        }
        if (s.requestTimeoutMillis != null) out = out.withRequestTimeout(millis(s.requestTimeoutMillis));
        return out;
    }

    private static Duration millis(long v) {
        return Duration.ofMillis(v);
    }

    public String localNodeId() {
        return localNodeId;
    }

    public String coordinatorNodeId() {
        return coordinatorNodeId;
    }

    public boolean isCoordinatorNode() {
        return localNodeId.equals(coordinatorNodeId);
    }

    public List<Node> nodes() {
        return nodes;
    }

    public ShardingSettings settings() {
        return settings;
    }

    /** nodeId -> "host:grpcPort" for every node, the local one included. */
    public Map<String, String> grpcTargets() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Node n : nodes) {
            out.put(n.nodeId(), n.grpcTarget());
        }
        return out;
    }

    public Node localNode() {
        return nodes.stream()
                .filter(n -> n.nodeId().equals(localNodeId))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "localNodeId %s not present in cluster nodes".formatted(localNodeId)
                ));
    }
}
