package com.jumpad.mathapi.security;

import java.time.Instant;

/**
 * Identity resolved from a verified credential.
 *
 * <p>Placed in the Spring Security context by the bearer token filter and
 * available to controllers through {@code @AuthenticationPrincipal}.</p>
 *
 * @param subject   the {@code sub} claim
 * @param role      the resolved role
 * @param expiresAt the credential's expiration instant
 */
public record AuthenticatedPrincipal(String subject, Role role, Instant expiresAt) {
}
