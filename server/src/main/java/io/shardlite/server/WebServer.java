// file: server/src/main/java/io/shardlite/server/WebServer.java
package io.shardlite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.shardlite.core.ShardingEnvelope;
import io.shardlite.core.StartEntity;
import io.shardlite.core.state.ShardAllocationState;
import io.shardlite.server.coordinator.CoordinatorSupervisor;
import io.shardlite.server.coordinator.ShardCoordinator;
import io.shardlite.server.dto.AllocationsResponse;
import io.shardlite.server.dto.RegionStateResponse;
import io.shardlite.server.dto.TellRequest;
import io.shardlite.server.membership.StaticMembership;
import io.shardlite.server.region.RegionState;
import io.shardlite.server.region.ShardRegion;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Thin HTTP adapter over the local {@link ShardRegion}, and over the
 * coordinator when it runs on this node.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert region / coordinator views back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST /entities/{entityId}              tell {"text": ...} to the entity (202)
 *   - POST /entities/{entityId}/start        start the entity without a message (202)
 *   - GET  /admin/region                     local region state
 *   - GET  /admin/allocations                coordinator table (404 on other nodes)
 *   - POST /admin/regions/{regionId}/remove  report a region as removed from the cluster
 *   - POST /admin/shutdown                   graceful shutdown of the local region (202)
 *   - GET  /admin/health                     basic health check
 *
 * Telling is fire-and-forget: 202 means the region accepted the message, not
 * that the entity processed it.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB
    private static final String ENTITIES = "/entities/";
    private static final String REGIONS = "/admin/regions/";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ShardRegion region;
    private final StaticMembership membership;
    private final CoordinatorSupervisor coordinator; // null unless this node hosts the coordinator
    private final Duration viewTimeout;

    public WebServer(int port,
                     ShardRegion region,
                     StaticMembership membership,
                     CoordinatorSupervisor coordinator,
                     Duration viewTimeout) {
        this.region = Objects.requireNonNull(region, "region");
        this.membership = Objects.requireNonNull(membership, "membership");
        this.coordinator = coordinator;
        this.viewTimeout = Objects.requireNonNull(viewTimeout, "viewTimeout");

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    private void route(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            // region views block on a future
            exchange.dispatch(this::route);
            return;
        }
        var path = exchange.getRequestPath();
        var method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if (path.startsWith(ENTITIES) && "POST".equals(method)) {
            String rest = path.substring(ENTITIES.length());
            if (rest.endsWith("/start")) {
                handleStart(exchange, rest.substring(0, rest.length() - "/start".length()));
            } else {
                handleTell(exchange, rest);
            }
        } else if ("/admin/region".equals(path) && "GET".equals(method)) {
            handleRegion(exchange);
        } else if ("/admin/allocations".equals(path) && "GET".equals(method)) {
            handleAllocations(exchange);
        } else if (path.startsWith(REGIONS) && path.endsWith("/remove") && "POST".equals(method)) {
            String regionId = path.substring(REGIONS.length(), path.length() - "/remove".length());
            handleRemoveRegion(exchange, regionId);
        } else if ("/admin/shutdown".equals(path) && "POST".equals(method)) {
            region.gracefulShutdown();
            send(exchange, 202, Map.of("status", "shutting down"));
            RequestLogger.logRequest(method, path, 202);
        } else if ("/admin/health".equals(path)) {
            send(exchange, 200, Map.of("status", "ok"));
            RequestLogger.logRequest(method, path, 200);
        } else {
            send(exchange, 404, Map.of("error", "not found"));
            RequestLogger.logRequest(method, path, 404);
        }
    }

    // ---------- handlers ----------

    /** POST /entities/{entityId} */
    private void handleTell(HttpServerExchange ex, String entityId) {
        if (entityId.isBlank() || entityId.contains("/")) {
            send(ex, 400, Map.of("error", "invalid entity id"));
            RequestLogger.logRequest("POST", ex.getRequestPath(), 400);
            return;
        }
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    Throwable error = null;
                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, TellRequest.class);
                            if (req.text == null) {
                                throw new IllegalArgumentException("text must be present");
                            }
                            region.tell(new ShardingEnvelope(entityId, req.text));
                            status = 202;
                            send(exchange, status, Map.of("accepted", true, "entityId", entityId));
                        }
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, Map.of("error", e.getClass().getSimpleName()));
                    }
                    long totalMs = (System.nanoTime() - start) / 1_000_000L;
                    RequestLogger.logRequest("POST", path, status, totalMs, -1, error);
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest("POST", exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    /** POST /entities/{entityId}/start */
    private void handleStart(HttpServerExchange ex, String entityId) {
        int status;
        if (entityId.isBlank() || entityId.contains("/")) {
            status = 400;
            send(ex, status, Map.of("error", "invalid entity id"));
        } else {
            region.tell(new StartEntity(entityId));
            status = 202;
            send(ex, status, Map.of("accepted", true, "entityId", entityId));
        }
        RequestLogger.logRequest("POST", ex.getRequestPath(), status);
    }

    /** GET /admin/region */
    private void handleRegion(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        long waitMs = -1L;
        Throwable error = null;
        try {
            long wStart = System.nanoTime();
            RegionState state = region.currentState().get(viewTimeout.toMillis(), TimeUnit.MILLISECONDS);
            waitMs = (System.nanoTime() - wStart) / 1_000_000L;

            var dto = new RegionStateResponse();
            dto.regionId = state.regionId();
            dto.proxy = state.proxy();
            dto.shards = state.shards();
            send(ex, status, dto);
        } catch (TimeoutException te) {
            status = 503;
            error = te;
            send(ex, status, Map.of("error", "region did not answer in time"));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName()));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest("GET", ex.getRequestPath(), status, totalMs, waitMs, error);
        }
    }

    /** GET /admin/allocations */
    private void handleAllocations(HttpServerExchange ex) {
        int status;
        ShardCoordinator c = coordinator == null ? null : coordinator.current();
        if (c == null) {
            status = coordinator == null ? 404 : 503;
            send(ex, status, Map.of("error", coordinator == null
                    ? "coordinator does not run on this node"
                    : "coordinator is restarting"));
        } else {
            ShardAllocationState state = c.currentState();
            var dto = new AllocationsResponse();
            dto.coordinator = c.address();
            dto.status = c.status().name();
            dto.regions = state.regions();
            dto.handOffInProgress = state.handOffInProgress();
            status = 200;
            send(ex, status, dto);
        }
        RequestLogger.logRequest("GET", ex.getRequestPath(), status);
    }

    /** POST /admin/regions/{regionId}/remove */
    private void handleRemoveRegion(HttpServerExchange ex, String regionId) {
        int status;
        if (regionId.isBlank()) {
            status = 400;
            send(ex, status, Map.of("error", "region id must not be empty"));
        } else if (membership.regionRemoved(regionId)) {
            status = 200;
            send(ex, status, Map.of("removed", regionId));
        } else {
            status = 404;
            send(ex, status, Map.of("error", "unknown region " + regionId));
        }
        RequestLogger.logRequest("POST", ex.getRequestPath(), status);
    }

    // ---------- helpers ----------

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
