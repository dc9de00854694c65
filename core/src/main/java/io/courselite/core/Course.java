// file: core/src/main/java/io/courselite/core/Course.java
package io.courselite.core;

import java.util.List;
import java.util.Objects;

/**
 * Immutable course record stored in the catalog.
 * <p>
 * Fields:
 *  - number:        normalized course number (trimmed, upper-case), the catalog key.
 *  - title:         display name. Not used for ordering or equality of keys.
 *  - prerequisites: normalized course numbers, sorted and de-duplicated by the parser.
 *                   Entries may name courses that are not in the catalog.
 * <p>
 * The prerequisite list is copied on construction, so callers cannot mutate it afterwards.
 */
public record Course(String number, String title, List<String> prerequisites) {

    public Course {
        if (number == null || number.isBlank()) {
            throw new IllegalArgumentException("number must not be blank");
        }
        Objects.requireNonNull(title, "title");
        prerequisites = prerequisites == null ? List.of() : List.copyOf(prerequisites);
    }

    public Course(String number, String title) {
        this(number, title, List.of());
    }

    public boolean hasPrerequisites() {
        return !prerequisites.isEmpty();
    }
}
