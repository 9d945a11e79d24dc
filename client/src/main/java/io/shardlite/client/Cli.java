// file: client/src/main/java/io/shardlite/client/Cli.java
package io.shardlite.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Simple CLI for interacting with a running shard-lite node over HTTP.
 *
 * Usage:
 *   shardlite-cli [--base-url http://host:port] tell <entityId> <text>
 *   shardlite-cli [--base-url http://host:port] start <entityId>
 *   shardlite-cli [--base-url http://host:port] region
 *   shardlite-cli [--base-url http://host:port] allocations
 *   shardlite-cli [--base-url http://host:port] shutdown
 *
 * Examples:
 *   shardlite-cli tell user-42 hello
 *   shardlite-cli --base-url http://localhost:8081 region
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String baseUrl = parsed.getKey();
            String[] rest = parsed.getValue();

            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            String cmd = rest[0];
            Cli cli = new Cli(baseUrl);

            switch (cmd) {
                case "tell" -> {
                    if (rest.length != 3) {
                        usageAndExit("tell requires <entityId> <text>");
                    }
                    cli.post("/entities/" + encodePath(rest[1]), tellBody(rest[2]), 202);
                }
                case "start" -> {
                    if (rest.length != 2) {
                        usageAndExit("start requires <entityId>");
                    }
                    cli.post("/entities/" + encodePath(rest[1]) + "/start", "", 202);
                }
                case "region" -> cli.get("/admin/region");
                case "allocations" -> cli.get("/admin/allocations");
                case "shutdown" -> cli.post("/admin/shutdown", "", 202);
                default -> usageAndExit("unknown command: " + cmd);
            }
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 2 && "--base-url".equals(args[0])) {
            if (args.length < 3) {
                usageAndExit("--base-url requires a value");
            }
            String baseUrl = args[1];
            String[] rest = new String[args.length - 2];
            System.arraycopy(args, 2, rest, 0, rest.length);
            return Map.entry(baseUrl, rest);
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /** {"text": "..."} without a JSON library. */
    static String tellBody(String text) {
        StringBuilder sb = new StringBuilder("{\"text\":\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append("\"}").toString();
    }

    static String encodePath(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private void post(String path, String body, int expected) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != expected) {
            throw new CliException("POST " + path + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println("OK");
    }

    private void get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .GET()
                .build();

        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("GET " + path + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        System.out.println(resp.body());
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  shardlite-cli [--base-url http://host:port] tell <entityId> <text>
                  shardlite-cli [--base-url http://host:port] start <entityId>
                  shardlite-cli [--base-url http://host:port] region
                  shardlite-cli [--base-url http://host:port] allocations
                  shardlite-cli [--base-url http://host:port] shutdown
                """);
        System.exit(1);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
