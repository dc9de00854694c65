// file: storage/src/main/java/io/courselite/storage/LoadReport.java
package io.courselite.storage;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one ingestion run.
 *
 * @param source      human-readable source name (usually the file path)
 * @param added       lines that produced a course and were inserted (including overwrites)
 * @param overwritten subset of {@code added} whose course number was already present
 * @param skipped     malformed lines that were reported and not inserted
 * @param errors      one entry per malformed line, in file order
 */
public record LoadReport(String source, int added, int overwritten, int skipped, List<LineError> errors) {

    /** A malformed line: 1-based line number and the reason it was rejected. */
    public record LineError(long lineNumber, String reason) {}

    public LoadReport {
        Objects.requireNonNull(source, "source");
        errors = List.copyOf(errors);
    }

    /** True when nothing usable was loaded. */
    public boolean isEmpty() {
        return added == 0;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Loaded ").append(added).append(" courses");
        if (skipped > 0) {
            sb.append(" (").append(skipped).append(" skipped due to errors)");
        }
        sb.append(" from '").append(source).append("'.");
        return sb.toString();
    }
}
