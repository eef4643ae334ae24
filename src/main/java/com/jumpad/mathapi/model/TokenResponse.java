package com.jumpad.mathapi.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response model for the token issuance endpoints.
 *
 * <pre>
 * {
 *     "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *     "token_type": "bearer"
 * }
 * </pre>
 *
 * @param accessToken the signed credential
 * @param tokenType   always {@code bearer}
 */
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType
) {

    public static final String BEARER = "bearer";

    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, BEARER);
    }
}
