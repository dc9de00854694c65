// file: server/src/main/java/io/courselite/server/CatalogService.java
package io.courselite.server;

import io.courselite.core.Course;
import io.courselite.core.CourseCodes;
import io.courselite.storage.AvlCourseStore;
import io.courselite.storage.CatalogLoadException;
import io.courselite.storage.CatalogLoader;
import io.courselite.storage.CourseStore;
import io.courselite.storage.LoadReport;
import io.courselite.storage.SynchronizedCourseStore;

import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Application service for catalog queries.
 * <p>
 * Responsibilities:
 *  - Own the current {@link CourseStore} and replace it on reload.
 *  - Normalize user-supplied course numbers before lookup.
 *  - Resolve prerequisite titles by re-querying the same store, treating a miss
 *    as "title unknown" rather than an error.
 *  - Render plain-text listings for the console front end.
 * <p>
 * Reload semantics:
 *  - Courses are loaded into a fresh store; the current catalog stays visible
 *    to readers until the new one is complete.
 *  - If the new source cannot be read or yields no valid courses, the partial
 *    store is torn down and the previous catalog is kept.
 *  - On success the new store is swapped in and the old one is torn down.
 *  - Queries hold the read lock for their whole duration and the swap holds the
 *    write lock, so a reader never observes a store that is being torn down.
 */
public class CatalogService {
    private static final Logger log = Logger.getLogger(CatalogService.class.getName());

    /** One row of the alphanumeric course list. */
    public record CourseSummary(String number, String title) {}

    /** A prerequisite reference; title is null when the course is not in the catalog. */
    public record PrerequisiteInfo(String number, String title, boolean found) {}

    public record CourseInfo(String number, String title, List<PrerequisiteInfo> prerequisites) {}

    private final CatalogLoader loader;
    private final ReadWriteLock swapLock = new ReentrantReadWriteLock();
    private CourseStore store;
    private boolean loaded;

    public CatalogService() {
        this(new CatalogLoader());
    }

    public CatalogService(CatalogLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.store = newStore();
    }

    /**
     * Replace the catalog with the contents of a course file.
     *
     * @return the load report; when {@link LoadReport#isEmpty()} the catalog was not replaced
     * @throws CatalogLoadException if the file cannot be read (catalog not replaced)
     */
    public LoadReport reload(Path file) {
        Objects.requireNonNull(file, "file");
        return replaceWith(fresh -> loader.load(file, fresh));
    }

    /** Same as {@link #reload(Path)} but reads from an open reader. */
    public LoadReport reload(Reader source, String sourceName) {
        Objects.requireNonNull(source, "source");
        return replaceWith(fresh -> loader.load(source, sourceName, fresh));
    }

    public boolean isLoaded() {
        swapLock.readLock().lock();
        try {
            return loaded;
        } finally {
            swapLock.readLock().unlock();
        }
    }

    public int size() {
        swapLock.readLock().lock();
        try {
            return store.size();
        } finally {
            swapLock.readLock().unlock();
        }
    }

    /** All courses, ascending by course number. */
    public List<CourseSummary> listAll() {
        swapLock.readLock().lock();
        try {
            List<CourseSummary> out = new ArrayList<>();
            for (Course c : store.inOrder()) {
                out.add(new CourseSummary(c.number(), c.title()));
            }
            return out;
        } finally {
            swapLock.readLock().unlock();
        }
    }

    /**
     * Look up one course and resolve its prerequisites.
     *
     * @param rawNumber course number as typed by the user (any case, surrounding blanks allowed)
     * @throws IllegalArgumentException if the number is empty after normalization
     */
    public Optional<CourseInfo> courseInfo(String rawNumber) {
        String key = CourseCodes.normalize(rawNumber);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("course number must not be empty");
        }

        // The course and its prerequisites must all resolve against one store.
        swapLock.readLock().lock();
        try {
            Optional<Course> hit = store.find(key);
            if (hit.isEmpty()) {
                return Optional.empty();
            }

            Course course = hit.get();
            List<PrerequisiteInfo> prereqs = new ArrayList<>(course.prerequisites().size());
            for (String p : course.prerequisites()) {
                Optional<Course> ref = store.find(p);
                prereqs.add(ref
                        .map(r -> new PrerequisiteInfo(p, r.title(), true))
                        .orElseGet(() -> new PrerequisiteInfo(p, null, false)));
            }
            return Optional.of(new CourseInfo(course.number(), course.title(), prereqs));
        } finally {
            swapLock.readLock().unlock();
        }
    }

    /** Drop the loaded catalog. */
    public synchronized void clear() {
        swapAndTeardown(newStore(), false);
    }

    // ---------- text rendering ----------

    public String formatCourseList() {
        StringBuilder sb = new StringBuilder();
        sb.append("---- Course List (Alphanumeric) ----\n");
        for (CourseSummary s : listAll()) {
            sb.append(s.number()).append(": ").append(s.title()).append('\n');
        }
        sb.append("------------------------------------\n");
        return sb.toString();
    }

    public static String formatCourseInfo(CourseInfo info) {
        StringBuilder sb = new StringBuilder();
        sb.append("Course: ").append(info.number()).append(" - ").append(info.title()).append('\n');
        if (info.prerequisites().isEmpty()) {
            sb.append("Prerequisites: None\n");
            return sb.toString();
        }
        sb.append("Prerequisites:\n");
        for (PrerequisiteInfo p : info.prerequisites()) {
            sb.append("  - ").append(p.number()).append(" - ")
                    .append(p.found() ? p.title() : "(title unknown)")
                    .append('\n');
        }
        return sb.toString();
    }

    // ---------- helpers ----------

    private synchronized LoadReport replaceWith(Function<CourseStore, LoadReport> loadInto) {
        CourseStore fresh = newStore();
        LoadReport report;
        try {
            report = loadInto.apply(fresh);
        } catch (RuntimeException e) {
            fresh.teardown();
            log.log(Level.WARNING, "Catalog reload failed; keeping previous catalog", e);
            throw e;
        }

        if (report.isEmpty()) {
            fresh.teardown();
            log.warning("No valid course records in '" + report.source() + "'; keeping previous catalog");
            return report;
        }

        swapAndTeardown(fresh, true);
        return report;
    }

    private void swapAndTeardown(CourseStore next, boolean nowLoaded) {
        swapLock.writeLock().lock();
        try {
            CourseStore old = store;
            store = next;
            loaded = nowLoaded;
            old.teardown();
        } finally {
            swapLock.writeLock().unlock();
        }
    }

    private static CourseStore newStore() {
        return new SynchronizedCourseStore(new AvlCourseStore());
    }
}
