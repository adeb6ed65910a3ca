package dev.rosterwatch.model;

/**
 * Search codes accepted by the PAID results endpoint.
 */
public enum SearchType {
    NOW_IN_CUSTODY("0"),
    RELEASED_LAST_7_DAYS("1"),
    EMERGENCY_RELEASES("2"),
    BOOKED_LAST_7_DAYS("3"),
    BOOKED_TODAY("4"),
    BOOKED_YESTERDAY("5");

    private final String code;

    SearchType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
