package com.jumpad.mathapi.exception;

/**
 * Base exception for every failed credential check.
 *
 * <p>Each subclass identifies which check failed so that the failure can be logged
 * and counted precisely. Clients never see that distinction: all subtypes map to the
 * same 401 response carrying {@link #CLIENT_MESSAGE}.</p>
 *
 * @version 1.0.0
 */
public abstract class AuthException extends RuntimeException {

    public static final String KIND = "UNAUTHORIZED";

    /**
     * Message returned to clients for any authentication failure.
     */
    public static final String CLIENT_MESSAGE =
        "Invalid credentials. Bearer token missing, invalid or expired.";

    /**
     * Which credential check failed.
     */
    public enum Reason {
        MISSING_CREDENTIAL,
        INVALID_SIGNATURE,
        EXPIRED,
        MALFORMED_CLAIMS;

        /**
         * Returns the lower-case tag value used for metrics and logs.
         */
        public String tag() {
            return name().toLowerCase();
        }
    }

    private final Reason reason;

    protected AuthException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected AuthException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
