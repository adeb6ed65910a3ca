package dev.rosterwatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Watcher settings. Loaded from application.yml under the 'roster' prefix,
 * which maps the WATCH_NAMES, SLACK_WEBHOOK_URL, POLL_INTERVAL_MINUTES and
 * DATA_FILE environment variables.
 */
@Data
@ConfigurationProperties(prefix = "roster")
public class WatchProperties {

    /**
     * Names to alert on, either "Surname" or "Surname Given".
     */
    private List<String> watchNames = new ArrayList<>();

    /**
     * Slack-compatible incoming webhook. Blank means alerts are only logged.
     */
    private String webhookUrl = "";

    private int pollIntervalMinutes = 15;

    private String dataFile = "data/seen_bookings.json";

    /**
     * Minimum hours between two scraper error reports.
     */
    private int errorReportIntervalHours = 4;

    /**
     * Number of cycles to run before exiting; 0 keeps polling forever.
     */
    private int maxCycles = 0;

    private boolean debug = false;

    private Source source = new Source();

    @Data
    public static class Source {
        private String searchUrl = "https://apps.mcso.us/PAID/Home/SearchResults";
        private int timeoutSeconds = 60;
        private boolean insecureTls = true;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    }

    /**
     * Watch names with blanks and surrounding whitespace removed.
     */
    public List<String> getEffectiveWatchNames() {
        return watchNames.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(String::trim)
                .toList();
    }

    public boolean isWebhookConfigured() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
