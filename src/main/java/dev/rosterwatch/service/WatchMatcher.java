package dev.rosterwatch.service;

import dev.rosterwatch.config.WatchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a roster name belongs to the configured watchlist.
 * <p>
 * Upstream names are inconsistently cased and sometimes truncated, so matching is
 * permissive: a given name may be a prefix of the recorded first name, and entries
 * are accepted in both "Surname Given" and "Given Surname" order.
 */
@Service
public class WatchMatcher {

    private final List<String> watchNames;

    @Autowired
    public WatchMatcher(WatchProperties properties) {
        this(properties.getEffectiveWatchNames());
    }

    WatchMatcher(List<String> watchNames) {
        this.watchNames = List.copyOf(watchNames);
    }

    public List<String> getWatchNames() {
        return watchNames;
    }

    public boolean matches(String firstName, String lastName) {
        return matches(firstName, lastName, watchNames);
    }

    /**
     * Check a name against an explicit watchlist.
     *
     * @param firstName  Recorded first name, may be empty
     * @param lastName   Recorded last name
     * @param watchNames Entries in "Surname" or "Surname Given" form
     * @return true on the first entry that accepts the name
     */
    public static boolean matches(String firstName, String lastName, List<String> watchNames) {
        String first = normalize(firstName);
        String last = normalize(lastName);

        for (String watch : watchNames) {
            String[] parts = normalize(watch).split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty()) {
                continue;
            }

            if (parts.length == 1) {
                if (last.equals(parts[0]) || first.equals(parts[0])) {
                    return true;
                }
                continue;
            }

            String rest = String.join(" ", Arrays.copyOfRange(parts, 1, parts.length));
            if (last.equals(parts[0]) && first.startsWith(rest)) {
                return true;
            }
            // "Given Surname" order
            if (first.equals(parts[0]) && last.equals(rest)) {
                return true;
            }
        }
        return false;
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
