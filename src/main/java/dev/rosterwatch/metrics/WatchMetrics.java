package dev.rosterwatch.metrics;

import dev.rosterwatch.model.ScrapeCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Prometheus metrics for roster watch cycles.
 */
@Component
public class WatchMetrics {

    private static final String TAG_CATEGORY = "category";
    private final MeterRegistry registry;

    // Counters
    private final Counter cyclesCounter;
    private final Counter escalationsCounter;

    // Timers (per category)
    private final ConcurrentHashMap<String, Timer> fetchTimers = new ConcurrentHashMap<>();

    // Gauges
    private final ConcurrentHashMap<ScrapeCategory, AtomicInteger> seenSizes = new ConcurrentHashMap<>();

    public WatchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.cyclesCounter = Counter.builder("roster_watch_cycles_total")
                .description("Total check cycles run")
                .register(registry);

        this.escalationsCounter = Counter.builder("roster_watch_escalations_total")
                .description("Scraper error reports sent to the operator")
                .register(registry);

        for (ScrapeCategory category : ScrapeCategory.values()) {
            AtomicInteger size = new AtomicInteger(0);
            seenSizes.put(category, size);
            Gauge.builder("roster_watch_seen_records", size, AtomicInteger::get)
                    .description("Fingerprints already notified")
                    .tag(TAG_CATEGORY, category.getKey())
                    .register(registry);
        }
    }

    /**
     * Expose the escalation service's failure counter.
     */
    public void registerConsecutiveFailures(Supplier<Number> consecutiveFailures) {
        Gauge.builder("roster_watch_consecutive_failures", consecutiveFailures)
                .description("Scrape failures since the last fully successful cycle")
                .register(registry);
    }

    public void recordCycle() {
        cyclesCounter.increment();
    }

    public void recordRecordsExtracted(ScrapeCategory category, int count) {
        Counter.builder("roster_watch_records_extracted_total")
                .tag(TAG_CATEGORY, category.getKey())
                .register(registry)
                .increment(count);
    }

    public void recordMatch(ScrapeCategory category) {
        Counter.builder("roster_watch_matches_total")
                .tag(TAG_CATEGORY, category.getKey())
                .register(registry)
                .increment();
    }

    public void recordNotification(String sink, boolean delivered) {
        Counter.builder("roster_watch_notifications_total")
                .tag("sink", sink)
                .tag("outcome", delivered ? "delivered" : "failed")
                .register(registry)
                .increment();
    }

    public void recordScrapeFailure(String kind) {
        Counter.builder("roster_watch_scrape_failures_total")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordEscalation() {
        escalationsCounter.increment();
    }

    public void updateSeenCount(ScrapeCategory category, int count) {
        seenSizes.get(category).set(count);
    }

    /**
     * Get or create a timer for a category fetch.
     */
    public Timer getFetchTimer(ScrapeCategory category) {
        return fetchTimers.computeIfAbsent(category.getKey(), key ->
                Timer.builder("roster_watch_fetch_duration")
                        .description("Time to fetch a results page")
                        .tag(TAG_CATEGORY, key)
                        .register(registry));
    }

    public void recordFetchLatency(ScrapeCategory category, long latencyMs) {
        getFetchTimer(category).record(Duration.ofMillis(latencyMs));
    }
}
