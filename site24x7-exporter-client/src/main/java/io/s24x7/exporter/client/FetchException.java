package io.s24x7.exporter.client;

/**
 * Network failure, timeout or unusable response from the monitoring API.
 */
public class FetchException extends Site24x7Exception {

    private final int statusCode;

    public FetchException(String message) {
        this(message, -1);
    }

    public FetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed response, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
