// file: server/src/main/java/io/courselite/server/dto/CourseListResponse.java
package io.courselite.server.dto;

import java.util.List;

/**
 * JSON response for GET /courses.
 *   {
 *     "count": 2,
 *     "courses": [
 *       { "number": "CSCI100", "title": "Introduction to Computer Science" },
 *       { "number": "CSCI200", "title": "Data Structures" }
 *     ]
 *   }
 */
public class CourseListResponse {
    public int count;
    public List<CourseEntry> courses;

    public static class CourseEntry {
        public String number;
        public String title;
    }
}
