package com.jumpad.mathapi.exception;

/**
 * No bearer token was presented.
 */
public class MissingCredentialException extends AuthException {

    public MissingCredentialException(String message) {
        super(Reason.MISSING_CREDENTIAL, message);
    }
}
