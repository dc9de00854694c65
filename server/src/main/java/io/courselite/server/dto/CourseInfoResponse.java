// file: server/src/main/java/io/courselite/server/dto/CourseInfoResponse.java
package io.courselite.server.dto;

import java.util.List;

/**
 * JSON response for GET /courses/{number}.
 * When the course is found:
 *   {
 *     "found": true,
 *     "number": "CSCI300",
 *     "title": "Introduction to Algorithms",
 *     "prerequisites": [
 *       { "number": "CSCI200", "title": "Data Structures", "found": true },
 *       { "number": "MATH999", "title": null, "found": false }
 *     ]
 *   }
 * When not found:
 *   { "found": false }
 */
public class CourseInfoResponse {
    public boolean found;
    public String number;
    public String title;
    public List<Prerequisite> prerequisites;

    public static class Prerequisite {
        public String number;
        public String title;   // null when the prerequisite is not in the catalog
        public boolean found;
    }
}
