// file: server/src/main/java/io/courselite/server/WebServer.java
package io.courselite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.courselite.server.dto.CourseInfoResponse;
import io.courselite.server.dto.CourseListResponse;
import io.courselite.server.dto.ReloadRequest;
import io.courselite.server.dto.ReloadResponse;
import io.courselite.storage.CatalogLoadException;
import io.courselite.storage.LoadReport;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Thin HTTP adapter over {@link CatalogService}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit basic per-request logging.
 *
 * Path layout:
 *   - GET  /courses              All courses, ascending by number
 *   - GET  /courses/{number}     One course with resolved prerequisites
 *   - POST /admin/reload         Replace the catalog from a server-side file
 *   - GET  /admin/health         Basic health check
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 1024 * 1024; // 1 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final CatalogService catalog;

    public WebServer(int port, CatalogService catalog) {
        this.catalog = catalog;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

                    if ("/courses".equals(path)) {
                        if ("GET".equals(method)) {
                            handleList(exchange);
                        } else {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            CatalogAccessLog.record(method, path, 405, 0, -1, null, null);
                        }
                    } else if (path.startsWith("/courses/")) {
                        String number = path.substring("/courses/".length());
                        if (number.isBlank()) {
                            send(exchange, 400, Map.of("error", "course number must not be empty"));
                            CatalogAccessLog.record(method, path, 400, 0, -1, "course=<empty>", null);
                        } else if ("GET".equals(method)) {
                            handleCourseInfo(exchange, number);
                        } else {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            CatalogAccessLog.record(method, path, 405, 0, -1, null, null);
                        }
                    } else if ("/admin/health".equals(path)) {
                        Map<String, Object> body = new LinkedHashMap<>();
                        body.put("status", "ok");
                        body.put("loaded", catalog.isLoaded());
                        body.put("courses", catalog.size());
                        send(exchange, 200, body);
                        CatalogAccessLog.record(method, path, 200, 0, -1,
                                "loaded=" + body.get("loaded") + " courses=" + body.get("courses"), null);
                    } else if ("/admin/reload".equals(path)) {
                        if ("POST".equals(method)) {
                            handleReload(exchange);
                        } else {
                            send(exchange, 405, Map.of("error", "method not allowed"));
                            CatalogAccessLog.record(method, path, 405, 0, -1, null, null);
                        }
                    } else {
                        send(exchange, 404, Map.of("error", "not found"));
                        CatalogAccessLog.record(method, path, 404, 0, -1, null, null);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- handlers ----------

    /** GET /courses */
    private void handleList(HttpServerExchange ex) {
        long start = System.nanoTime();
        int status = 200;
        long catalogMs = -1L;
        String detail = null;
        Throwable error = null;
        try {
            long cStart = System.nanoTime();
            var rows = catalog.listAll();
            catalogMs = (System.nanoTime() - cStart) / 1_000_000L;
            detail = CatalogAccessLog.describeList(rows.size());

            var dto = new CourseListResponse();
            dto.count = rows.size();
            dto.courses = new ArrayList<>(rows.size());
            for (CatalogService.CourseSummary row : rows) {
                var entry = new CourseListResponse.CourseEntry();
                entry.number = row.number();
                entry.title = row.title();
                dto.courses.add(entry);
            }
            send(ex, status, dto);
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            CatalogAccessLog.record("GET", ex.getRequestPath(), status, totalMs, catalogMs, detail, error);
        }
    }

    /** GET /courses/{number} */
    private void handleCourseInfo(HttpServerExchange ex, String number) {
        long start = System.nanoTime();
        int status = 200;
        long catalogMs = -1L;
        String detail = "course=" + number;
        Throwable error = null;
        try {
            long cStart = System.nanoTime();
            Optional<CatalogService.CourseInfo> info = catalog.courseInfo(number);
            catalogMs = (System.nanoTime() - cStart) / 1_000_000L;
            detail = CatalogAccessLog.describeLookup(number, info);

            if (info.isEmpty()) {
                status = 404;
                send(ex, status, Map.of("found", false));
            } else {
                send(ex, status, toDto(info.get()));
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", bad.getMessage()));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody(e));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            CatalogAccessLog.record("GET", ex.getRequestPath(), status, totalMs, catalogMs, detail, error);
        }
    }

    /** POST /admin/reload */
    private void handleReload(HttpServerExchange ex) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    String method = "POST";
                    String path = exchange.getRequestPath();
                    long start = System.nanoTime();
                    int status;
                    long catalogMs = -1L;
                    String detail = null;
                    Throwable error = null;

                    try {
                        if (data.length > MAX_BODY_BYTES) {
                            status = 413;
                            detail = "body=" + data.length + "B";
                            send(exchange, status, Map.of("error", "request body too large"));
                        } else {
                            var req = json.readValue(data, ReloadRequest.class);
                            if (req == null || req.path == null || req.path.isBlank()) {
                                throw new IllegalArgumentException("path must not be empty");
                            }
                            detail = "source='" + req.path + "'";
                            long cStart = System.nanoTime();
                            LoadReport report = catalog.reload(Path.of(req.path));
                            catalogMs = (System.nanoTime() - cStart) / 1_000_000L;
                            detail = CatalogAccessLog.describeReload(report);

                            status = report.isEmpty() ? 422 : 200;
                            send(exchange, status, toDto(report));
                        }
                    } catch (IllegalArgumentException bad) {
                        status = 400;
                        error = bad;
                        send(exchange, status, Map.of("error", String.valueOf(bad.getMessage())));
                    } catch (JsonProcessingException jsonEx) {
                        status = 400;
                        error = jsonEx;
                        send(exchange, status, Map.of("error", "invalid JSON"));
                    } catch (CatalogLoadException loadEx) {
                        status = 422;
                        error = loadEx;
                        send(exchange, status, Map.of("error", loadEx.getMessage()));
                    } catch (Exception e) {
                        status = 500;
                        error = e;
                        send(exchange, status, errorBody(e));
                    } finally {
                        long totalMs = (System.nanoTime() - start) / 1_000_000L;
                        CatalogAccessLog.record(method, path, exchange.getStatusCode(), totalMs, catalogMs, detail, error);
                    }
                },
                (exchange, ioEx) -> {
                    String path = exchange.getRequestPath();
                    int status = 400;
                    send(exchange, status, Map.of("error", "invalid request body"));
                    CatalogAccessLog.record("POST", path, status, 0, -1, null, ioEx);
                }
        );
    }

    // ---------- mapping ----------

    private static CourseInfoResponse toDto(CatalogService.CourseInfo info) {
        var dto = new CourseInfoResponse();
        dto.found = true;
        dto.number = info.number();
        dto.title = info.title();
        dto.prerequisites = new ArrayList<>(info.prerequisites().size());
        for (CatalogService.PrerequisiteInfo p : info.prerequisites()) {
            var rec = new CourseInfoResponse.Prerequisite();
            rec.number = p.number();
            rec.title = p.title();
            rec.found = p.found();
            dto.prerequisites.add(rec);
        }
        return dto;
    }

    private static ReloadResponse toDto(LoadReport report) {
        var dto = new ReloadResponse();
        dto.ok = !report.isEmpty();
        dto.source = report.source();
        dto.added = report.added();
        dto.overwritten = report.overwritten();
        dto.skipped = report.skipped();
        dto.errors = new ArrayList<>(report.errors().size());
        for (LoadReport.LineError e : report.errors()) {
            var rec = new ReloadResponse.LineErrorRecord();
            rec.line = e.lineNumber();
            rec.reason = e.reason();
            dto.errors.add(rec);
        }
        return dto;
    }

    private static Map<String, String> errorBody(Exception e) {
        return Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage()));
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int status, Object body) {
        try {
            ex.setStatusCode(status);
            var bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
