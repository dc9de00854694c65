// file: storage/src/main/java/io/courselite/storage/CatalogLoader.java
package io.courselite.storage;

import io.courselite.core.Course;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ingestion loop: reads course data line by line and inserts every
 * successfully parsed course into a {@link CourseStore}.
 * <p>
 * Steps per line:
 *  1) Parse with {@link CourseRecordParser}.
 *  2) Parsed    -> insert into the target store (overwrites count as added).
 *  3) Skipped   -> ignore (blank line or comment).
 *  4) Malformed -> log a warning, record the line number + reason, keep going.
 * <p>
 * A single bad line never stops the load. Only a failure to read the source
 * itself raises {@link CatalogLoadException}.
 */
public final class CatalogLoader {
    private static final Logger log = Logger.getLogger(CatalogLoader.class.getName());

    private final CourseRecordParser parser;

    public CatalogLoader() {
        this(new CourseRecordParser());
    }

    public CatalogLoader(CourseRecordParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /** Load a UTF-8 file into the target store. */
    public LoadReport load(Path file, CourseStore target) {
        Objects.requireNonNull(file, "file");
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(in, file.toString(), target);
        } catch (IOException e) {
            throw new CatalogLoadException("Could not open file '" + file + "'", e);
        }
    }

    /** Load from an already-open reader. The reader is not closed. */
    public LoadReport load(Reader source, String sourceName, CourseStore target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");

        BufferedReader in = source instanceof BufferedReader br ? br : new BufferedReader(source);
        long lineNumber = 0;
        int added = 0;
        int overwritten = 0;
        List<LoadReport.LineError> errors = new ArrayList<>();

        try {
            for (String line; (line = in.readLine()) != null; ) {
                lineNumber++;
                ParseResult result = parser.parse(line);

                if (result instanceof ParseResult.Parsed parsed) {
                    Course course = parsed.course();
                    if (!target.insert(course.number(), course)) {
                        overwritten++;
                    }
                    added++;
                } else if (result instanceof ParseResult.Malformed malformed) {
                    log.log(Level.WARNING, sourceName + " line " + lineNumber + ": " + malformed.reason());
                    errors.add(new LoadReport.LineError(lineNumber, malformed.reason()));
                }
            }
        } catch (IOException e) {
            throw new CatalogLoadException("Failed reading '" + sourceName + "' at line " + lineNumber, e);
        }

        var report = new LoadReport(sourceName, added, overwritten, errors.size(), errors);
        log.info(report.summary());
        return report;
    }
}
