// file: server/src/main/java/io/courselite/server/dto/ReloadRequest.java
package io.courselite.server.dto;

/**
 * JSON body for POST /admin/reload.
 * Example:
 *   { "path": "data/courses.csv" }
 */
public class ReloadRequest {
    public String path; // server-side path of the course file
}
