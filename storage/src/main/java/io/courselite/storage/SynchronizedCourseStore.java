// file: storage/src/main/java/io/courselite/storage/SynchronizedCourseStore.java
package io.courselite.storage;

import io.courselite.core.Course;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Coarse-grained thread-safe wrapper around another {@link CourseStore}.
 * <p>
 * One exclusive lock guards every public operation, so readers never observe
 * the intermediate shape of a tree while an insert is rotating it.
 * inOrder() copies the courses into a list while holding the lock and
 * returns that snapshot.
 */
public final class SynchronizedCourseStore implements CourseStore {
    private final CourseStore delegate;
    private final Object lock = new Object();

    public SynchronizedCourseStore(CourseStore delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean insert(String key, Course course) {
        synchronized (lock) {
            return delegate.insert(key, course);
        }
    }

    @Override
    public Optional<Course> find(String key) {
        synchronized (lock) {
            return delegate.find(key);
        }
    }

    @Override
    public List<Course> inOrder() {
        synchronized (lock) {
            List<Course> out = new ArrayList<>(delegate.size());
            for (Course c : delegate.inOrder()) {
                out.add(c);
            }
            return List.copyOf(out);
        }
    }

    @Override
    public int size() {
        synchronized (lock) {
            return delegate.size();
        }
    }

    @Override
    public void teardown() {
        synchronized (lock) {
            delegate.teardown();
        }
    }
}
