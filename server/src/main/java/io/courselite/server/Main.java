// file: server/src/main/java/io/courselite/server/Main.java
package io.courselite.server;

import io.courselite.storage.CatalogLoadException;
import io.courselite.storage.LoadReport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a CourseLite node.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Create the CatalogService and optionally preload a course file.
 *  - Either run the interactive advising console, or start the HTTP server
 *    with a shutdown hook that stops it and tears the catalog down.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        var cfg = ServerConfig.fromArgs(args);
        var catalog = new CatalogService();

        if (cfg.hasDataPath()) {
            preload(catalog, Path.of(cfg.dataPath()));
        }

        if (cfg.interactive()) {
            var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new AdvisingConsole(catalog, in, System.out, System.err).run();
            catalog.clear();
            return;
        }

        var web = new WebServer(cfg.httpPort(), catalog);
        web.start();

        System.out.printf(
                "CourseLite listening on http://%s:%d (%d courses loaded)%n",
                "localhost", cfg.httpPort(), catalog.size()
        );

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } finally {
                catalog.clear();
            }
        }));
    }

    private static void preload(CatalogService catalog, Path file) {
        try {
            LoadReport report = catalog.reload(file);
            if (report.isEmpty()) {
                log.warning("Startup file " + file + " held no valid courses; starting with an empty catalog");
            }
        } catch (CatalogLoadException e) {
            log.log(Level.WARNING, "Could not load startup file " + file + "; starting with an empty catalog", e);
        }
    }
}
