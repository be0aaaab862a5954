package io.s24x7.exporter.client;

/**
 * Raised when credentials or an access token are not accepted.
 */
public class AuthException extends Site24x7Exception {

    public enum Reason {
        /** The accounts host refused the client id, client secret or refresh token. */
        REJECTED_CREDENTIALS,
        /** The monitoring API refused an access token that was issued earlier. */
        TOKEN_REJECTED,
        /** The token exchange could not be completed within the retry budget. */
        EXCHANGE_FAILED
    }

    private final Reason reason;

    public AuthException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public AuthException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
