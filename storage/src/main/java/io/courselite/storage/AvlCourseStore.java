// file: storage/src/main/java/io/courselite/storage/AvlCourseStore.java
package io.courselite.storage;

import io.courselite.core.AvlTree;
import io.courselite.core.Course;

import java.util.Optional;

/**
 * {@link CourseStore} backed by a single {@link AvlTree}.
 * <p>
 * Not thread-safe. Use {@link SynchronizedCourseStore} when the store is shared
 * between threads (for example behind the HTTP server).
 */
public class AvlCourseStore implements CourseStore {
    private final AvlTree<Course> tree = new AvlTree<>();

    @Override
    public boolean insert(String key, Course course) {
        return tree.insert(key, course);
    }

    @Override
    public Optional<Course> find(String key) {
        return tree.find(key);
    }

    @Override
    public Iterable<Course> inOrder() {
        return tree.inOrder();
    }

    @Override
    public int size() {
        return tree.size();
    }

    @Override
    public void teardown() {
        tree.teardown();
    }

    /** Current tree height; 0 when empty. */
    public int height() {
        return tree.height();
    }

    public long rotationCount() {
        return tree.rotationCount();
    }

    AvlTree<Course> tree() {
        return tree;
    }
}
