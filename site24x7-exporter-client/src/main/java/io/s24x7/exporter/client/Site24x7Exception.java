package io.s24x7.exporter.client;

/**
 * Base type of every failure raised while talking to the Site24x7 and Zoho APIs.
 */
abstract public class Site24x7Exception extends RuntimeException {

    protected Site24x7Exception(String message) {
        super(message);
    }

    protected Site24x7Exception(String message, Throwable cause) {
        super(message, cause);
    }
}
