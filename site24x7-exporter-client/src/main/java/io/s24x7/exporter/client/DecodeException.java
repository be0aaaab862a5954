package io.s24x7.exporter.client;

/**
 * A single entity in an otherwise valid payload could not be decoded.
 */
public class DecodeException extends Site24x7Exception {

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
