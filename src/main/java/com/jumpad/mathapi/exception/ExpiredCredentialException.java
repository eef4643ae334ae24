package com.jumpad.mathapi.exception;

import java.time.Instant;

/**
 * The token signature is valid but its expiration instant has passed.
 */
public class ExpiredCredentialException extends AuthException {

    private final Instant expiredAt;

    public ExpiredCredentialException(Instant expiredAt) {
        super(Reason.EXPIRED, "Token expired at " + expiredAt);
        this.expiredAt = expiredAt;
    }

    public Instant getExpiredAt() {
        return expiredAt;
    }
}
