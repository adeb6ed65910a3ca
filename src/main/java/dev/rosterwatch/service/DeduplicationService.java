package dev.rosterwatch.service;

import dev.rosterwatch.model.BookingRecord;
import dev.rosterwatch.model.ScrapeCategory;
import dev.rosterwatch.repository.SeenBookingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tracks which bookings have already triggered a notification.
 * Fingerprints are only ever added; the full state is written back once per cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeduplicationService {

    static final String SEPARATOR = "|";

    private final SeenBookingStore seenBookingStore;

    private final Map<ScrapeCategory, Set<String>> seen = new EnumMap<>(ScrapeCategory.class);

    /**
     * Deterministic identity of a booking: last name, first name, date and booking
     * number joined by {@value #SEPARATOR}, empty fields left out.
     *
     * @param record The extracted record
     * @return Fingerprint stable across runs
     */
    public static String fingerprint(BookingRecord record) {
        return Stream.of(record.getLastName(), record.getFirstName(), record.getDate(), record.getBookingNumber())
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining(SEPARATOR));
    }

    /**
     * Replace the in-memory state with what is on disk.
     */
    public void load() {
        seen.clear();
        seen.putAll(seenBookingStore.load());
    }

    public boolean hasSeen(ScrapeCategory category, String fingerprint) {
        return seenSet(category).contains(fingerprint);
    }

    /**
     * @return true if the fingerprint was not already recorded
     */
    public boolean markSeen(ScrapeCategory category, String fingerprint) {
        boolean added = seenSet(category).add(fingerprint);
        if (added) {
            log.debug("Marked {} as seen: {}", category.getKey(), fingerprint);
        }
        return added;
    }

    public int seenCount(ScrapeCategory category) {
        return seenSet(category).size();
    }

    /**
     * Persist every category. Failures are logged by the store and reported here
     * as false.
     */
    public boolean save() {
        for (ScrapeCategory category : ScrapeCategory.values()) {
            seenSet(category);
        }
        return seenBookingStore.save(seen);
    }

    private Set<String> seenSet(ScrapeCategory category) {
        return seen.computeIfAbsent(category, c -> new LinkedHashSet<>());
    }
}
