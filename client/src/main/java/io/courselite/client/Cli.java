// file: client/src/main/java/io/courselite/client/Cli.java
package io.courselite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.PrintStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Simple CLI for querying a running CourseLite node over HTTP.
 *
 * Usage:
 *   courselite-cli [--base-url http://host:port] list
 *   courselite-cli [--base-url http://host:port] show <courseNumber>
 *   courselite-cli [--base-url http://host:port] reload <serverSidePath>
 *   courselite-cli [--base-url http://host:port] health
 *
 * Examples:
 *   courselite-cli list
 *   courselite-cli show CSCI300
 *   courselite-cli reload data/courses.csv
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper();
    private final PrintStream out;

    Cli(String baseUrl, PrintStream out) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
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
            Cli cli = new Cli(baseUrl, System.out);

            switch (cmd) {
                case "list" -> cli.list();
                case "show" -> {
                    if (rest.length != 2) {
                        usageAndExit("show requires <courseNumber>");
                    }
                    cli.show(rest[1]);
                }
                case "reload" -> {
                    if (rest.length != 2) {
                        usageAndExit("reload requires <path>");
                    }
                    cli.reload(rest[1]);
                }
                case "health" -> cli.health();
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

    void list() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/courses"))
                .GET()
                .build());
        if (resp.statusCode() != 200) {
            throw new CliException("LIST failed (" + resp.statusCode() + "): " + resp.body());
        }
        out.print(renderList(json.readTree(resp.body())));
    }

    void show(String courseNumber) throws Exception {
        String encoded = URLEncoder.encode(courseNumber.strip(), StandardCharsets.UTF_8).replace("+", "%20");
        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/courses/" + encoded))
                .GET()
                .build());
        if (resp.statusCode() == 404) {
            out.println("(not found)");
            return;
        }
        if (resp.statusCode() != 200) {
            throw new CliException("SHOW failed (" + resp.statusCode() + "): " + resp.body());
        }
        out.print(renderCourse(json.readTree(resp.body())));
    }

    void reload(String path) throws Exception {
        String body = json.writeValueAsString(Map.of("path", path));
        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/admin/reload"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build());
        if (resp.statusCode() != 200) {
            throw new CliException("RELOAD failed (" + resp.statusCode() + "): " + resp.body());
        }
        out.print(renderReload(json.readTree(resp.body())));
    }

    void health() throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/admin/health"))
                .GET()
                .build());
        if (resp.statusCode() != 200) {
            throw new CliException("HEALTH failed (" + resp.statusCode() + "): " + resp.body());
        }
        JsonNode node = json.readTree(resp.body());
        out.printf("%s (loaded=%s, courses=%d)%n",
                node.path("status").asText(), node.path("loaded").asBoolean(), node.path("courses").asInt());
    }

    // ---------- rendering ----------

    static String renderList(JsonNode body) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode c : body.path("courses")) {
            sb.append(c.path("number").asText()).append(": ").append(c.path("title").asText()).append('\n');
        }
        sb.append("(").append(body.path("count").asInt()).append(" courses)\n");
        return sb.toString();
    }

    static String renderCourse(JsonNode body) {
        StringBuilder sb = new StringBuilder();
        sb.append("Course: ").append(body.path("number").asText())
                .append(" - ").append(body.path("title").asText()).append('\n');
        JsonNode prereqs = body.path("prerequisites");
        if (prereqs.isEmpty()) {
            sb.append("Prerequisites: None\n");
            return sb.toString();
        }
        sb.append("Prerequisites:\n");
        for (JsonNode p : prereqs) {
            sb.append("  - ").append(p.path("number").asText()).append(" - ")
                    .append(p.path("found").asBoolean() ? p.path("title").asText() : "(title unknown)")
                    .append('\n');
        }
        return sb.toString();
    }

    static String renderReload(JsonNode body) {
        StringBuilder sb = new StringBuilder();
        sb.append("Loaded ").append(body.path("added").asInt()).append(" courses");
        int skipped = body.path("skipped").asInt();
        if (skipped > 0) {
            sb.append(" (").append(skipped).append(" skipped due to errors)");
        }
        sb.append(" from '").append(body.path("source").asText()).append("'.\n");
        for (JsonNode e : body.path("errors")) {
            sb.append("  line ").append(e.path("line").asLong()).append(": ").append(e.path("reason").asText()).append('\n');
        }
        return sb.toString();
    }

    private HttpResponse<String> send(HttpRequest req) throws Exception {
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  courselite-cli [--base-url http://host:port] list
                  courselite-cli [--base-url http://host:port] show <courseNumber>
                  courselite-cli [--base-url http://host:port] reload <path>
                  courselite-cli [--base-url http://host:port] health
                """);
        System.exit(1);
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
