package dev.rosterwatch.service;

import dev.rosterwatch.config.WatchProperties;
import dev.rosterwatch.extract.BookingTableExtractor;
import dev.rosterwatch.metrics.WatchMetrics;
import dev.rosterwatch.model.BookingRecord;
import dev.rosterwatch.model.CategoryOutcome;
import dev.rosterwatch.model.CycleSummary;
import dev.rosterwatch.model.ExtractionResult;
import dev.rosterwatch.model.ScrapeCategory;
import dev.rosterwatch.notify.AlertMessageFormatter;
import dev.rosterwatch.notify.Notifier;
import dev.rosterwatch.source.RosterFetchException;
import dev.rosterwatch.source.RosterSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one check cycle: every category is fetched, parsed and matched against the
 * watchlist, and each new match is notified once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WatchCycleService {

    private static final String SEPARATOR = "==================================================";

    private final RosterSource rosterSource;
    private final BookingTableExtractor extractor;
    private final WatchMatcher watchMatcher;
    private final DeduplicationService deduplicationService;
    private final ErrorEscalationService errorEscalationService;
    private final Notifier notifier;
    private final AlertMessageFormatter formatter;
    private final WatchMetrics metrics;
    private final WatchProperties properties;

    /**
     * Check every category, then persist the seen state whatever the outcome.
     * The failure counter is reset only when all categories succeeded.
     *
     * @return Per-category outcomes of this cycle
     */
    public CycleSummary runCycle() {
        log.info(SEPARATOR);
        log.info("Starting check cycle...");
        metrics.recordCycle();

        List<CategoryOutcome> outcomes = new ArrayList<>();
        for (ScrapeCategory category : ScrapeCategory.values()) {
            outcomes.add(checkCategory(category));
        }

        if (outcomes.stream().allMatch(CategoryOutcome::success)) {
            errorEscalationService.reportSuccess();
        }

        boolean persisted = deduplicationService.save();
        for (ScrapeCategory category : ScrapeCategory.values()) {
            metrics.updateSeenCount(category, deduplicationService.seenCount(category));
        }

        log.info("Check cycle complete");
        return new CycleSummary(List.copyOf(outcomes), persisted);
    }

    /**
     * Fetch, extract, match and notify for a single category. Never throws;
     * failures are routed to the escalation service.
     */
    CategoryOutcome checkCategory(ScrapeCategory category) {
        String label = category.getLabel();
        log.info("Checking '{}'...", label);
        List<BookingRecord> notified = new ArrayList<>();

        try {
            long start = System.currentTimeMillis();
            String html = rosterSource.search(category.getSearchType()).block();
            metrics.recordFetchLatency(category, System.currentTimeMillis() - start);

            if (properties.isDebug()) {
                saveDebugSnapshot(category, html);
            }

            ExtractionResult extraction = extractor.extract(html);
            if (!extraction.tablePresent()) {
                errorEscalationService.reportFailure("No Results Table",
                        "Could not find results table on '" + label
                                + "' page - site may have changed or be blocking requests");
                return CategoryOutcome.failed(category, notified);
            }

            List<BookingRecord> records = extraction.records();
            log.info("Found {} records in '{}'", records.size(), label);
            metrics.recordRecordsExtracted(category, records.size());

            for (BookingRecord record : records) {
                if (watchMatcher.matches(record.getFirstName(), record.getLastName())
                        && notifyIfNew(category, record)) {
                    notified.add(record);
                }
            }
            return CategoryOutcome.succeeded(category, records.size(), notified);

        } catch (RosterFetchException e) {
            if (e.isHttpError()) {
                errorEscalationService.reportFailure("HTTP Error " + e.getStatusCode(),
                        "Failed to fetch '" + label + "': " + e.getMessage());
            } else {
                errorEscalationService.reportFailure("Connection Error",
                        "Failed to connect for '" + label + "': " + e.getMessage());
            }
        } catch (RuntimeException e) {
            log.debug("Processing error for '{}'", label, e);
            errorEscalationService.reportFailure("Processing Error",
                    "Error processing '" + label + "': " + e.getMessage());
        }
        return CategoryOutcome.failed(category, notified);
    }

    private boolean notifyIfNew(ScrapeCategory category, BookingRecord record) {
        String fingerprint = DeduplicationService.fingerprint(record);
        if (deduplicationService.hasSeen(category, fingerprint)) {
            log.debug("Already seen {} for {}", category.getKey(), record.displayName());
            return false;
        }

        metrics.recordMatch(category);
        log.info("Watched name found in '{}': {}", category.getLabel(), record.displayName());
        notifier.send(formatter.matchAlert(category, record));
        deduplicationService.markSeen(category, fingerprint);
        return true;
    }

    private void saveDebugSnapshot(ScrapeCategory category, String html) {
        Path dataDir = Paths.get(properties.getDataFile()).toAbsolutePath().getParent();
        Path file = dataDir.resolve("debug_" + category.getFileStem() + ".html");
        try {
            Files.createDirectories(dataDir);
            Files.writeString(file, html == null ? "" : html, StandardCharsets.UTF_8);
            log.debug("Saved response HTML to {}", file);
        } catch (IOException e) {
            log.warn("Could not save debug HTML to {}: {}", file, e.getMessage());
        }
    }
}
