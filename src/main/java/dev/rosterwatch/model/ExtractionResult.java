package dev.rosterwatch.model;

import java.util.List;

/**
 * Outcome of parsing a results page. A page without any table is reported as
 * {@link #noTable()}, which is different from a table with zero rows.
 */
public record ExtractionResult(boolean tablePresent, List<BookingRecord> records) {

    private static final ExtractionResult NO_TABLE = new ExtractionResult(false, List.of());

    public ExtractionResult {
        records = List.copyOf(records);
    }

    public static ExtractionResult noTable() {
        return NO_TABLE;
    }

    public static ExtractionResult of(List<BookingRecord> records) {
        return new ExtractionResult(true, records);
    }
}
