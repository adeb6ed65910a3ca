package dev.rosterwatch.service;

import dev.rosterwatch.config.WatchProperties;
import dev.rosterwatch.metrics.WatchMetrics;
import dev.rosterwatch.model.FailureState;
import dev.rosterwatch.notify.AlertMessageFormatter;
import dev.rosterwatch.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Counts consecutive scrape failures and reports them to the operator, at most
 * once per cooldown window. The counter keeps running while reports are
 * suppressed so the next report carries the full count.
 */
@Slf4j
@Service
public class ErrorEscalationService {

    private final Notifier notifier;
    private final AlertMessageFormatter formatter;
    private final WatchMetrics metrics;
    private final Clock clock;
    private final Duration cooldown;
    private final FailureState state;

    @Autowired
    public ErrorEscalationService(Notifier notifier, AlertMessageFormatter formatter, WatchMetrics metrics,
            Clock clock, WatchProperties properties) {
        this(notifier, formatter, metrics, clock, Duration.ofHours(properties.getErrorReportIntervalHours()),
                new FailureState());
    }

    ErrorEscalationService(Notifier notifier, AlertMessageFormatter formatter, WatchMetrics metrics,
            Clock clock, Duration cooldown, FailureState state) {
        this.notifier = notifier;
        this.formatter = formatter;
        this.metrics = metrics;
        this.clock = clock;
        this.cooldown = cooldown;
        this.state = state;
        metrics.registerConsecutiveFailures(state::getConsecutiveFailures);
    }

    /**
     * Record a failed scrape and escalate unless a report went out within the
     * cooldown window.
     *
     * @param kind    Short failure category, e.g. "Connection Error"
     * @param details Human readable description
     * @return true if an escalation was sent
     */
    public boolean reportFailure(String kind, String details) {
        state.setConsecutiveFailures(state.getConsecutiveFailures() + 1);
        int failures = state.getConsecutiveFailures();
        metrics.recordScrapeFailure(kind);
        log.warn("Scraping error ({}): {} [failure #{}]", kind, details, failures);

        Instant now = clock.instant();
        Instant last = state.getLastEscalationTime();
        if (last != null && Duration.between(last, now).compareTo(cooldown) < 0) {
            Duration remaining = cooldown.minus(Duration.between(last, now));
            log.debug("Suppressing error report (next report in {} hours)",
                    String.format("%.1f", remaining.toMinutes() / 60.0));
            return false;
        }

        notifier.send(formatter.escalation(kind, details, failures, cooldown.toHours()));
        state.setLastEscalationTime(now);
        metrics.recordEscalation();
        return true;
    }

    /**
     * Reset the failure counter after a fully successful cycle.
     */
    public void reportSuccess() {
        if (state.getConsecutiveFailures() > 0) {
            log.info("Scraping recovered after {} failures", state.getConsecutiveFailures());
            state.setConsecutiveFailures(0);
        }
    }

    public int getConsecutiveFailures() {
        return state.getConsecutiveFailures();
    }

    public Instant getLastEscalationTime() {
        return state.getLastEscalationTime();
    }
}
