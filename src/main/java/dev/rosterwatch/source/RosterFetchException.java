package dev.rosterwatch.source;

/**
 * A results page could not be fetched: the connection failed, timed out, or the
 * server answered with an error status.
 */
public class RosterFetchException extends RuntimeException {

    private final Integer statusCode;

    public RosterFetchException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public RosterFetchException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the server, or null when no response was received.
     */
    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isHttpError() {
        return statusCode != null;
    }
}
