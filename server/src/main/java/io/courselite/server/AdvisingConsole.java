// file: server/src/main/java/io/courselite/server/AdvisingConsole.java
package io.courselite.server;

import io.courselite.core.CourseCodes;
import io.courselite.storage.CatalogLoadException;
import io.courselite.storage.LoadReport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Interactive advising menu over a {@link CatalogService}.
 *
 * Menu:
 *   1. Load file data into the catalog
 *   2. Print an alphanumeric list of all courses
 *   3. Print course information (title and prerequisites)
 *   9. Exit
 *
 * Invalid input never ends the loop; only option 9 or end of input does.
 */
public final class AdvisingConsole {

    private static final String MENU = """

            ================ Advising Assistance Menu ================
              1. Load file data into the data structure
              2. Print an alphanumeric list of all courses
              3. Print course information (title and prerequisites)
              9. Exit the program
            ==========================================================
            Enter your choice:\s""";

    private final CatalogService catalog;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public AdvisingConsole(CatalogService catalog, BufferedReader in, PrintStream out, PrintStream err) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    /** Run the menu loop until the user exits or input ends. */
    public void run() throws IOException {
        while (true) {
            out.print(MENU);
            out.flush();

            String choiceLine = in.readLine();
            if (choiceLine == null) {
                err.println();
                err.println("ERROR: Input stream closed unexpectedly. Exiting.");
                return;
            }
            String choiceTrim = choiceLine.strip();
            if (choiceTrim.isEmpty()) {
                out.println("Please enter a valid option number.");
                continue;
            }

            int choice;
            try {
                choice = Integer.parseInt(choiceTrim);
            } catch (NumberFormatException e) {
                out.println("Invalid input. Please enter 1, 2, 3, or 9.");
                continue;
            }

            switch (choice) {
                case 9 -> {
                    out.println("Exiting Advising Assistance Program. Goodbye!");
                    return;
                }
                case 1 -> loadFile();
                case 2 -> printAllCourses();
                case 3 -> printCourseInfo();
                default -> out.println("Unknown option. Please enter 1, 2, 3, or 9.");
            }
        }
    }

    private void loadFile() throws IOException {
        out.print("Enter the filename containing course data (e.g., courses.csv): ");
        out.flush();
        String filename = in.readLine();
        if (filename == null) {
            err.println("ERROR: Failed to read filename.");
            return;
        }
        filename = filename.strip();
        if (filename.isEmpty()) {
            out.println("Filename cannot be empty.");
            return;
        }

        LoadReport report;
        try {
            report = catalog.reload(Path.of(filename));
        } catch (CatalogLoadException | InvalidPathException e) {
            err.println("ERROR: Could not open file '" + filename + "'. Check the path and try again.");
            return;
        }

        for (LoadReport.LineError e : report.errors()) {
            err.println("WARN (line " + e.lineNumber() + "): " + e.reason());
        }
        out.println(report.summary());
        if (report.isEmpty()) {
            err.println("ERROR: No valid course records were loaded. Verify file format.");
        }
    }

    private void printAllCourses() {
        if (!catalog.isLoaded()) {
            out.println("Please load data (Option 1) before printing the course list.");
            return;
        }
        out.print(catalog.formatCourseList());
    }

    private void printCourseInfo() throws IOException {
        if (!catalog.isLoaded()) {
            out.println("Please load data (Option 1) before printing course information.");
            return;
        }
        out.print("Enter the course number to look up (e.g., CSCI300): ");
        out.flush();
        String raw = in.readLine();
        if (raw == null) {
            err.println("ERROR: Failed to read course number.");
            return;
        }
        String key = CourseCodes.normalize(raw);
        if (key.isEmpty()) {
            out.println("Course number cannot be empty.");
            return;
        }

        Optional<CatalogService.CourseInfo> info = catalog.courseInfo(key);
        if (info.isEmpty()) {
            out.println("Course '" + key + "' was not found. Please check the course number and try again.");
            return;
        }
        out.print(CatalogService.formatCourseInfo(info.get()));
    }
}
