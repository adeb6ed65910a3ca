package dev.rosterwatch.model;

/**
 * The roster searches polled every cycle. Each category keeps its own seen set.
 */
public enum ScrapeCategory {
    BOOKED(SearchType.BOOKED_TODAY, "booked", "Booked Today", "booked_today"),
    RELEASED(SearchType.RELEASED_LAST_7_DAYS, "released", "Released Last 7 Days", "released_7_days");

    private final SearchType searchType;
    private final String key;
    private final String label;
    private final String fileStem;

    ScrapeCategory(SearchType searchType, String key, String label, String fileStem) {
        this.searchType = searchType;
        this.key = key;
        this.label = label;
        this.fileStem = fileStem;
    }

    public SearchType getSearchType() {
        return searchType;
    }

    /**
     * Key used for this category in the persisted seen-state file.
     */
    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Stem of the debug snapshot file, e.g. {@code debug_booked_today.html}.
     */
    public String getFileStem() {
        return fileStem;
    }
}
