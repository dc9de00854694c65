// file: server/src/test/java/io/courselite/server/WebServerTest.java
package io.courselite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP surface.
 *
 * Focus:
 *  - Listing and lookup with prerequisite resolution.
 *  - 404 for unknown courses, 400 for empty numbers, 405 for wrong methods.
 *  - Reload: success, unreadable file (422), invalid JSON (400), oversized body (413).
 */
class WebServerTest {

    private static final int PORT = 18181; // test-only port
    private final ObjectMapper json = new ObjectMapper();
    private CatalogService catalog;
    private WebServer server;
    private HttpClient client;

    @TempDir
    Path tmp;

    @BeforeEach
    void startServer() {
        catalog = new CatalogService();
        catalog.reload(new StringReader("""
                X100,Foundations
                X200,Follow-up,X100,X999
                CSCI100,Introduction to Computer Science
                """), "fixture");

        server = new WebServer(PORT, catalog);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .GET()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void list_returns_courses_in_ascending_order() throws Exception {
        var resp = get("/courses");
        assertEquals(200, resp.statusCode());

        JsonNode body = json.readTree(resp.body());
        assertEquals(3, body.get("count").asInt());
        assertEquals("CSCI100", body.get("courses").get(0).get("number").asText());
        assertEquals("X100", body.get("courses").get(1).get("number").asText());
        assertEquals("X200", body.get("courses").get(2).get("number").asText());
    }

    @Test
    void course_info_resolves_prerequisites() throws Exception {
        var resp = get("/courses/x200");
        assertEquals(200, resp.statusCode());

        JsonNode body = json.readTree(resp.body());
        assertTrue(body.get("found").asBoolean());
        assertEquals("X200", body.get("number").asText());

        JsonNode prereqs = body.get("prerequisites");
        assertEquals(2, prereqs.size());
        assertEquals("X100", prereqs.get(0).get("number").asText());
        assertEquals("Foundations", prereqs.get(0).get("title").asText());
        assertTrue(prereqs.get(0).get("found").asBoolean());
        assertEquals("X999", prereqs.get(1).get("number").asText());
        assertTrue(prereqs.get(1).get("title").isNull());
        assertFalse(prereqs.get(1).get("found").asBoolean());
    }

    @Test
    void unknown_course_returns_404() throws Exception {
        var resp = get("/courses/NOPE1");
        assertEquals(404, resp.statusCode());
        assertFalse(json.readTree(resp.body()).get("found").asBoolean());
    }

    @Test
    void empty_course_number_returns_400() throws Exception {
        var resp = get("/courses/");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("course number must not be empty"));
    }

    @Test
    void wrong_method_returns_405_and_unknown_path_404() throws Exception {
        assertEquals(405, post("/courses", "{}").statusCode());
        assertEquals(405, get("/admin/reload").statusCode());
        assertEquals(404, get("/nothing-here").statusCode());
    }

    @Test
    void health_reports_catalog_state() throws Exception {
        var resp = get("/admin/health");
        assertEquals(200, resp.statusCode());
        JsonNode body = json.readTree(resp.body());
        assertEquals("ok", body.get("status").asText());
        assertTrue(body.get("loaded").asBoolean());
        assertEquals(3, body.get("courses").asInt());
    }

    @Test
    void reload_replaces_catalog_and_reports_errors() throws Exception {
        Path file = tmp.resolve("courses.csv");
        Files.writeString(file, "MATH201,Discrete Mathematics\nBROKEN\n");

        var resp = post("/admin/reload", json.writeValueAsString(java.util.Map.of("path", file.toString())));
        assertEquals(200, resp.statusCode(), resp.body());

        JsonNode body = json.readTree(resp.body());
        assertTrue(body.get("ok").asBoolean());
        assertEquals(1, body.get("added").asInt());
        assertEquals(1, body.get("skipped").asInt());
        assertEquals(2, body.get("errors").get(0).get("line").asLong());

        assertEquals(404, get("/courses/X100").statusCode());
        assertEquals(200, get("/courses/MATH201").statusCode());
    }

    @Test
    void reload_of_missing_file_returns_422_and_keeps_catalog() throws Exception {
        var resp = post("/admin/reload",
                json.writeValueAsString(java.util.Map.of("path", tmp.resolve("missing.csv").toString())));
        assertEquals(422, resp.statusCode());
        assertEquals(200, get("/courses/X100").statusCode());
    }

    @Test
    void reload_of_file_without_courses_returns_422() throws Exception {
        Path file = tmp.resolve("empty.csv");
        Files.writeString(file, "# only a comment\n");

        var resp = post("/admin/reload", json.writeValueAsString(java.util.Map.of("path", file.toString())));
        assertEquals(422, resp.statusCode());
        assertFalse(json.readTree(resp.body()).get("ok").asBoolean());
        assertEquals(3, catalog.size());
    }

    @Test
    void oversized_reload_body_returns_413_and_keeps_catalog() throws Exception {
        String body = "{\"path\":\"" + "a".repeat(1024 * 1024 + 16) + "\"}";

        var resp = post("/admin/reload", body);

        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
        assertEquals(3, catalog.size());
        assertEquals(200, get("/courses/X100").statusCode());
    }

    @Test
    void invalid_json_and_missing_path_return_400() throws Exception {
        var bad = post("/admin/reload", "{ invalid-json");
        assertEquals(400, bad.statusCode());
        assertTrue(bad.body().contains("invalid JSON"));

        var noPath = post("/admin/reload", "{}");
        assertEquals(400, noPath.statusCode());
        assertTrue(noPath.body().contains("path must not be empty"));
    }
}
