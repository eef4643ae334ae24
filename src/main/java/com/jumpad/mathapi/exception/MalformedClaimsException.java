package com.jumpad.mathapi.exception;

/**
 * The token cannot be parsed, or its claims are missing or carry unexpected values.
 */
public class MalformedClaimsException extends AuthException {

    public MalformedClaimsException(String message) {
        super(Reason.MALFORMED_CLAIMS, message);
    }

    public MalformedClaimsException(String message, Throwable cause) {
        super(Reason.MALFORMED_CLAIMS, message, cause);
    }
}
