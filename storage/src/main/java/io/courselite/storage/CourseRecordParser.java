// file: storage/src/main/java/io/courselite/storage/CourseRecordParser.java
package io.courselite.storage;

import io.courselite.core.Course;
import io.courselite.core.CourseCodes;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Turns one line of delimited course data into a {@link ParseResult}.
 * <p>
 * Line format (CSV):
 *   courseNumber, title, prereq1, prereq2, ...
 * <p>
 * Rules:
 *  - A trailing '\r' is dropped (CRLF files).
 *  - Blank lines and lines whose first non-blank char is '#' are skipped.
 *  - Fields may be double-quoted; "" inside a quoted field is a literal quote.
 *  - Every field is trimmed, then one pair of surrounding quotes is stripped.
 *  - Course number and title are required and must be non-empty.
 *  - Each prerequisite cell may hold several codes separated by whitespace, '|', ';' or ','.
 *  - Course number and prerequisite codes are normalized via {@link CourseCodes#normalize(String)};
 *    prerequisites are sorted and de-duplicated.
 * <p>
 * The parser is stateless and never throws for bad input.
 */
public final class CourseRecordParser {

    static final String MISSING_FIELDS = "Malformed line: requires course number and title.";

    private static final ParseResult SKIPPED = new ParseResult.Skipped();

    public ParseResult parse(String rawLine) {
        if (rawLine == null) return SKIPPED;

        String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.charAt(0) == '#') {
            return SKIPPED;
        }

        List<String> fields = splitCsv(line);
        for (int i = 0; i < fields.size(); i++) {
            fields.set(i, stripQuotes(fields.get(i).strip()));
        }

        if (fields.size() < 2 || fields.get(0).isEmpty() || fields.get(1).isEmpty()) {
            return new ParseResult.Malformed(MISSING_FIELDS);
        }

        String number = CourseCodes.normalize(fields.get(0));
        if (number.isEmpty()) {
            return new ParseResult.Malformed(MISSING_FIELDS);
        }
        String title = fields.get(1);

        TreeSet<String> prereqs = new TreeSet<>();
        for (int i = 2; i < fields.size(); i++) {
            for (String token : splitPrerequisiteCell(fields.get(i))) {
                prereqs.add(CourseCodes.normalize(token));
            }
        }

        return new ParseResult.Parsed(new Course(number, title, new ArrayList<>(prereqs)));
    }

    /** Split on commas outside double quotes. Always returns at least one field. */
    static List<String> splitCsv(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    field.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        fields.add(field.toString());
        return fields;
    }

    /** Split one prerequisite cell such as "CSCI200 | MATH201" into non-empty tokens. */
    static List<String> splitPrerequisiteCell(String cell) {
        List<String> tokens = new ArrayList<>();
        StringBuilder token = new StringBuilder();
        for (int i = 0; i < cell.length(); i++) {
            char c = cell.charAt(i);
            if (Character.isWhitespace(c) || c == '|' || c == ';' || c == ',') {
                flush(token, tokens);
            } else {
                token.append(c);
            }
        }
        flush(token, tokens);
        return tokens;
    }

    private static void flush(StringBuilder token, List<String> tokens) {
        if (!token.isEmpty()) {
            tokens.add(token.toString());
            token.setLength(0);
        }
    }

    private static String stripQuotes(String s) {
        if (s.length() >= 2 && s.charAt(0) == '"' && s.charAt(s.length() - 1) == '"') {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }
}
