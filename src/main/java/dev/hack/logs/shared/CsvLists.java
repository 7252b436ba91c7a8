package dev.hack.logs.shared;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Parses comma separated option values such as {@code --services api,worker}.
 */
public final class CsvLists {
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setIgnoreSurroundingSpaces(true)
        .setIgnoreEmptyLines(true)
        .build();

    private CsvLists() {}

    /**
     * Returns trimmed, non-empty items in first-seen order without duplicates.
     *
     * @throws IllegalArgumentException when the value is not a valid CSV row (e.g. an unclosed quote)
     */
    public static List<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        Set<String> items = new LinkedHashSet<>();
        try (CSVParser parser = CSVParser.parse(raw.trim(), FORMAT)) {
            for (CSVRecord record : parser.getRecords()) {
                for (String value : record) {
                    String trimmed = value.trim();
                    if (!trimmed.isEmpty()) {
                        items.add(trimmed);
                    }
                }
            }
        } catch (IOException | UncheckedIOException | IllegalStateException ex) {
            throw new IllegalArgumentException("Invalid list \"" + raw.trim() + "\": " + ex.getMessage(), ex);
        }
        return new ArrayList<>(items);
    }
}
