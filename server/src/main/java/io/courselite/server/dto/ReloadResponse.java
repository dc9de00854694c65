// file: server/src/main/java/io/courselite/server/dto/ReloadResponse.java
package io.courselite.server.dto;

import java.util.List;

/**
 * JSON response for POST /admin/reload.
 *   {
 *     "ok": true,
 *     "source": "data/courses.csv",
 *     "added": 8,
 *     "overwritten": 0,
 *     "skipped": 1,
 *     "errors": [ { "line": 4, "reason": "Malformed line: requires course number and title." } ]
 *   }
 * "ok" is false when the file held no valid courses and the previous catalog was kept.
 */
public class ReloadResponse {
    public boolean ok;
    public String source;
    public int added;
    public int overwritten;
    public int skipped;
    public List<LineErrorRecord> errors;

    public static class LineErrorRecord {
        public long line;
        public String reason;
    }
}
