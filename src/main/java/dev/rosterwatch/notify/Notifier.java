package dev.rosterwatch.notify;

/**
 * Destination for formatted alert messages.
 * Implementations log their own delivery failures; callers never retry.
 */
public interface Notifier {

    /**
     * Get the name of this sink (e.g., "Slack webhook")
     */
    String getName();

    /**
     * Deliver a message.
     *
     * @param message Fully formatted, Slack markdown
     * @return true if the sink accepted the message
     */
    boolean send(String message);
}
