package dev.rosterwatch.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row extracted from a roster results page.
 * Only the fingerprint of a record outlives the cycle that produced it.
 */
@Value
@Builder
public class BookingRecord {
    String lastName;
    @Builder.Default
    String firstName = "";
    @Builder.Default
    String date = "";
    @Builder.Default
    String bookingNumber = "";
    String fullNameDisplay;

    /**
     * Name as shown in alerts ("Last, First").
     */
    public String displayName() {
        return lastName + ", " + firstName;
    }
}
