// file: server/src/main/java/io/shardlite/server/ServerConfig.java
package io.shardlite.server;

/**
 * Per-node server configuration parsed from CLI args.
 *
 * Supports:
 *  - nodeId:            region id of this node, also its transport address
 *  - httpPort:          admin / entity HTTP API port
 *  - grpcPort:          inter-node sharding transport port
 *  - dataDir:           root for the coordinator journal, snapshots and remembered entities
 *  - clusterConfigPath: optional JSON cluster config for multi-node setups
 */
public record ServerConfig(
        String nodeId,
        int httpPort,
        int grpcPort,
        String dataDir,
        String clusterConfigPath
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --node-id,   -n   <id>
     *   --http-port, -p   <port>
     *   --grpc-port, -g   <port>
     *   --data-dir,  -d   <path>
     *   --cluster-config, -c <path>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        String nodeId = "node-a";
        int httpPort = 8080;
        int grpcPort = 50051;
        String dataDir = "./data";
        String clusterConfigPath = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--node-id", "-n" -> {
                    ensureValue(args, i);
                    nodeId = args[++i];
                }

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parsePort(args[++i], "http-port");
                }

                case "--grpc-port", "-g" -> {
                    ensureValue(args, i);
                    grpcPort = parsePort(args[++i], "grpc-port");
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--cluster-config", "-c" -> {
                    ensureValue(args, i);
                    clusterConfigPath = args[++i];
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        if (nodeId.isBlank() || nodeId.contains("/")) {
            System.err.println("Invalid node-id: " + nodeId);
            System.exit(1);
        }
        return new ServerConfig(nodeId, httpPort, grpcPort, dataDir, clusterConfigPath);
    }

    private static int parsePort(String value, String name) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + value);
            System.exit(1);
            return -1;
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --node-id,        -n   Node / region identifier (default: node-a)
              --http-port,      -p   HTTP port (default: 8080)
              --grpc-port,      -g   gRPC transport port (default: 50051)
              --data-dir,       -d   Data directory (default: ./data)
              --cluster-config, -c   Path to JSON cluster config (optional)
              --help,           -h   Show this help message
            """);
        System.exit(0);
    }
}
