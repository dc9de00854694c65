// file: core/src/main/java/io/courselite/core/CourseCodes.java
package io.courselite.core;

import java.util.Locale;

/**
 * Normalization rules for course numbers.
 * <p>
 * Every entry point that accepts a course number from the outside world
 * (file ingestion, HTTP, console) runs it through {@link #normalize(String)}
 * so that "csci200 " and "CSCI200" address the same catalog entry.
 */
public final class CourseCodes {

    private CourseCodes() {
        // utility
    }

    /** Trim surrounding whitespace and upper-case. Null maps to the empty string. */
    public static String normalize(String raw) {
        if (raw == null) return "";
        return raw.strip().toUpperCase(Locale.ROOT);
    }
}
