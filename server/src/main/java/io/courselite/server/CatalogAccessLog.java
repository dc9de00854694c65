// file: server/src/main/java/io/courselite/server/CatalogAccessLog.java
package io.courselite.server;

import io.courselite.storage.LoadReport;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per HTTP request, annotated with what the catalog answered.
 *
 * Lines look like:
 *   GET /courses/x200 -> 200 [course=X200 prereqs=2 unresolved=1] total=0ms catalog=0ms
 *   POST /admin/reload -> 200 [source='data/courses.csv' added=8 overwritten=0 skipped=1] total=4ms catalog=4ms
 *
 * Server faults go out at WARNING with the stack trace; everything else at INFO.
 */
final class CatalogAccessLog {
    private static final Logger log = Logger.getLogger(CatalogAccessLog.class.getName());

    private CatalogAccessLog() {
    }

    static String describeList(int count) {
        return "courses=" + count;
    }

    static String describeLookup(String number, Optional<CatalogService.CourseInfo> info) {
        if (info.isEmpty()) {
            return "course=" + number + " missing";
        }
        long unresolved = info.get().prerequisites().stream().filter(p -> !p.found()).count();
        return "course=" + info.get().number()
                + " prereqs=" + info.get().prerequisites().size()
                + " unresolved=" + unresolved;
    }

    static String describeReload(LoadReport report) {
        return "source='" + report.source() + "' added=" + report.added()
                + " overwritten=" + report.overwritten() + " skipped=" + report.skipped();
    }

    static String format(String method, String path, int status, long totalMillis, long catalogMillis,
                         String detail, Throwable error) {
        StringBuilder sb = new StringBuilder()
                .append(method).append(' ').append(path).append(" -> ").append(status);
        if (detail != null && !detail.isEmpty()) {
            sb.append(" [").append(detail).append(']');
        }
        sb.append(" total=").append(totalMillis).append("ms");
        if (catalogMillis >= 0) {
            sb.append(" catalog=").append(catalogMillis).append("ms");
        }
        if (error != null && status < 500) {
            sb.append(" error=\"").append(error.getMessage()).append('"');
        }
        return sb.toString();
    }

    static void record(String method, String path, int status, long totalMillis, long catalogMillis,
                       String detail, Throwable error) {
        String line = format(method, path, status, totalMillis, catalogMillis, detail, error);
        if (status >= 500) {
            log.log(Level.WARNING, line, error);
        } else {
            log.info(line);
        }
    }
}
