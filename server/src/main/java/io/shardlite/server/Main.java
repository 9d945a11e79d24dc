// file: server/src/main/java/io/shardlite/server/Main.java
package io.shardlite.server;

import io.shardlite.core.HashCodeMessageExtractor;
import io.shardlite.core.allocation.LeastShardAllocationStrategy;
import io.shardlite.server.cluster.ClusterConfig;
import io.shardlite.server.config.ShardingSettings;
import io.shardlite.server.coordinator.CoordinatorSupervisor;
import io.shardlite.server.coordinator.ShardCoordinator;
import io.shardlite.server.demo.LoggingEntity;
import io.shardlite.server.membership.StaticMembership;
import io.shardlite.server.region.ShardRegion;
import io.shardlite.server.region.UndeliveredHandler;
import io.shardlite.server.runtime.Dispatchers;
import io.shardlite.server.runtime.ExecutorScheduler;
import io.shardlite.server.transport.GrpcTransport;
import io.shardlite.server.transport.MessageSerializer;
import io.shardlite.server.transport.Transport;
import io.shardlite.storage.CoordinatorEventCodec;
import io.shardlite.storage.FileEventJournal;
import io.shardlite.storage.FileSnapshotter;
import io.shardlite.storage.JournalRememberEntitiesStore;
import io.shardlite.storage.RememberEntitiesStore;
import io.grpc.Server;
import io.grpc.ServerBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single shard-lite node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI and the optional cluster file.
 *  - Start the gRPC server carrying sharding traffic between nodes.
 *  - On the coordinator node: run the coordinator under a supervisor, with its
 *    journal and snapshots under {@code <dataDir>/coordinator}.
 *  - Run this node's region hosting {@link LoggingEntity} instances.
 *  - Start the HTTP API, and hand off shards gracefully on JVM shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);
        ClusterConfig cluster = buildClusterConfig(cfg);
        ShardingSettings settings = cluster.settings();
        String nodeId = cluster.localNodeId();
        Path dataDir = Path.of(cfg.dataDir());

        // ------ Runtime ------
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.max(2, Runtime.getRuntime().availableProcessors()), named("shardlite-worker"));
        ExecutorService ioExecutor = Executors.newCachedThreadPool(named("shardlite-io"));
        var scheduler = new ExecutorScheduler("shardlite-scheduler");
        var dispatchers = new Dispatchers(executor, ioExecutor, scheduler);

        // ------ Transport + membership ------
        var transport = new GrpcTransport(nodeId, cluster.grpcTargets(), new MessageSerializer(),
                settings.requestTimeout(), ioExecutor);
        var membership = new StaticMembership(cluster.grpcTargets().keySet());
        String coordinatorAddress = Transport.coordinatorAddress(cluster.coordinatorNodeId());

        Server grpcServer = ServerBuilder
                .forPort(cluster.localNode().grpcPort())
                .addService(transport.service())
                .build();
        try {
            grpcServer.start();
        } catch (IOException e) {
            throw new IOException("Failed to start gRPC server on port " + cluster.localNode().grpcPort(), e);
        }

        // ------ Coordinator (one node only) ------
        CoordinatorSupervisor supervisor = null;
        if (cluster.isCoordinatorNode()) {
            Path coordDir = dataDir.resolve("coordinator");
            var strategy = new LeastShardAllocationStrategy(
                    settings.rebalanceThreshold(), settings.maxSimultaneousRebalance());
            supervisor = new CoordinatorSupervisor(
                    onFatal -> new ShardCoordinator(
                            coordinatorAddress,
                            settings,
                            strategy,
                            new FileEventJournal<>(coordDir.resolve("journal"), new CoordinatorEventCodec()),
                            new FileSnapshotter(coordDir.resolve("snapshots")),
                            transport,
                            membership,
                            dispatchers,
                            onFatal),
                    scheduler,
                    settings.coordinatorFailureBackoff());
            supervisor.start();
        }

        // ------ Region ------
        RememberEntitiesStore store = settings.rememberEntities()
                ? new JournalRememberEntitiesStore(dataDir.resolve("entities"))
                : null;
        var region = new ShardRegion(
                nodeId,
                HashCodeMessageExtractor.forEnvelopes(settings.numberOfShards()),
                (entityId, ctx) -> new LoggingEntity(ctx),
                settings,
                transport,
                coordinatorAddress,
                membership,
                store,
                null,
                dispatchers,
                UndeliveredHandler.logging());
        region.start();

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), region, membership, supervisor, settings.requestTimeout());
        web.start();

        System.out.printf(
                "Node %s listening on http://%s:%d (HTTP) and grpc://%s:%d (sharding)%s%n",
                nodeId,
                "localhost", cfg.httpPort(),
                cluster.localNode().host(),
                cluster.localNode().grpcPort(),
                cluster.isCoordinatorNode() ? ", coordinator here" : ""
        );

        CoordinatorSupervisor coordinatorToStop = supervisor;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                region.gracefulShutdown().get(settings.handOffTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (Exception e) {
                log.log(Level.WARNING, "graceful shutdown did not complete, stopping anyway", e);
                region.stop();
            }
            web.stop();
            if (coordinatorToStop != null) {
                coordinatorToStop.close();
            }
            grpcServer.shutdown();
            transport.close();
            scheduler.close();
            executor.shutdown();
            ioExecutor.shutdown();
            if (store != null) {
                store.close();
            }
        }, "shardlite-shutdown"));
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }

    private static ClusterConfig buildClusterConfig(ServerConfig cfg) {
        if (cfg.clusterConfigPath() != null && !cfg.clusterConfigPath().isBlank()) {
            return ClusterConfig.fromJsonFile(Path.of(cfg.clusterConfigPath()), cfg.nodeId());
        }
        return ClusterConfig.singleNode(cfg.nodeId(), cfg.grpcPort(), cfg.httpPort());
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
