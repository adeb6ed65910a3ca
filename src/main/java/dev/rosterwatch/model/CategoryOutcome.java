package dev.rosterwatch.model;

import java.util.List;

/**
 * Result of one category pass within a cycle.
 */
public record CategoryOutcome(
        ScrapeCategory category,
        boolean success,
        int recordsFound,
        List<BookingRecord> notified) {

    public static CategoryOutcome failed(ScrapeCategory category, List<BookingRecord> notified) {
        return new CategoryOutcome(category, false, 0, List.copyOf(notified));
    }

    public static CategoryOutcome succeeded(ScrapeCategory category, int recordsFound, List<BookingRecord> notified) {
        return new CategoryOutcome(category, true, recordsFound, List.copyOf(notified));
    }
}
