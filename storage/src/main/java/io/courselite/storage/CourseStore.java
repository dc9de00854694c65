// file: storage/src/main/java/io/courselite/storage/CourseStore.java
package io.courselite.storage;

import io.courselite.core.Course;

import java.util.Optional;

/**
 * Minimal synchronous catalog interface used by the loader and the query layer.
 * <p>
 * Semantics:
 *  - insert() never fails for a normalized, non-empty key; an existing key is
 *    overwritten in place (latest write wins).
 *  - find() returns empty on a miss; a miss is not an error.
 *  - inOrder() enumerates every course once, ascending by course number.
 *  - teardown() drops every entry; safe on an empty store and safe to repeat.
 */
public interface CourseStore {

    /**
     * Insert or overwrite a course under the given key.
     *
     * @return true if the key was new, false if an existing entry was overwritten
     */
    boolean insert(String key, Course course);

    Optional<Course> find(String key);

    /** Courses in ascending key order. */
    Iterable<Course> inOrder();

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    void teardown();
}
