package dev.rosterwatch.notify;

import dev.rosterwatch.model.BookingRecord;
import dev.rosterwatch.model.ScrapeCategory;
import org.springframework.stereotype.Component;

/**
 * Builds the Slack markdown messages sent to the operator.
 */
@Component
public class AlertMessageFormatter {

    /**
     * Alert for a watched name found in a category.
     */
    public String matchAlert(ScrapeCategory category, BookingRecord record) {
        return switch (category) {
            case BOOKED -> bookingAlert(record);
            case RELEASED -> releaseAlert(record);
        };
    }

    public String bookingAlert(BookingRecord record) {
        StringBuilder message = new StringBuilder("🚨 *BOOKING ALERT*\n");
        message.append("*Name:* ").append(record.displayName()).append('\n');
        appendIfPresent(message, "Booking Date", record.getDate());
        appendIfPresent(message, "Booking #", record.getBookingNumber());
        return message.toString();
    }

    public String releaseAlert(BookingRecord record) {
        StringBuilder message = new StringBuilder("✅ *RELEASE ALERT*\n");
        message.append("*Name:* ").append(record.displayName()).append('\n');
        appendIfPresent(message, "Original Booking Date", record.getDate());
        appendIfPresent(message, "Booking #", record.getBookingNumber());
        return message.toString();
    }

    /**
     * Operator report about scraper health.
     */
    public String escalation(String kind, String details, int failureCount, long reportIntervalHours) {
        return "⚠️ *SCRAPER ERROR*\n"
                + "*Error Type:* " + kind + "\n"
                + "*Details:* " + details + "\n"
                + "*Failure Count:* " + failureCount + " since last success\n"
                + "_Next error report in " + reportIntervalHours + " hours if errors persist_";
    }

    private static void appendIfPresent(StringBuilder message, String label, String value) {
        if (value != null && !value.isBlank()) {
            message.append('*').append(label).append(":* ").append(value).append('\n');
        }
    }
}
