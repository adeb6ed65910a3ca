package dev.rosterwatch.notify;

import dev.rosterwatch.metrics.WatchMetrics;
import lombok.extern.slf4j.Slf4j;

/**
 * Notifier used when no webhook is configured. Messages go to the log only.
 */
@Slf4j
public class LogNotifier implements Notifier {

    private final WatchMetrics metrics;

    public LogNotifier(WatchMetrics metrics) {
        this.metrics = metrics;
        log.warn("No Slack webhook configured. Messages will be printed to the log.");
    }

    @Override
    public String getName() {
        return "log";
    }

    @Override
    public boolean send(String message) {
        log.info("[SLACK MESSAGE] {}", message);
        metrics.recordNotification(getName(), true);
        return true;
    }
}
