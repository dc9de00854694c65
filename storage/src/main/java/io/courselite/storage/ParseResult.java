// file: storage/src/main/java/io/courselite/storage/ParseResult.java
package io.courselite.storage;

import io.courselite.core.Course;

import java.util.Objects;

/**
 * Outcome of parsing one line of course data:
 *  - Parsed:    a valid, normalized course ready for insertion.
 *  - Skipped:   a blank or comment line; not an error.
 *  - Malformed: the line could not be turned into a course; reason is human-readable.
 */
public sealed interface ParseResult permits ParseResult.Parsed, ParseResult.Skipped, ParseResult.Malformed {

    record Parsed(Course course) implements ParseResult {
        public Parsed {
            Objects.requireNonNull(course, "course");
        }
    }

    record Skipped() implements ParseResult {}

    record Malformed(String reason) implements ParseResult {
        public Malformed {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
