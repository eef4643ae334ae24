package com.jumpad.mathapi.exception;

/**
 * The token signature does not match the configured signing secret.
 */
public class InvalidSignatureException extends AuthException {

    public InvalidSignatureException(String message) {
        super(Reason.INVALID_SIGNATURE, message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(Reason.INVALID_SIGNATURE, message, cause);
    }
}
