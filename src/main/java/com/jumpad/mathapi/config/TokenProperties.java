package com.jumpad.mathapi.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Credential issuance and verification settings, bound to {@code app.token}.
 *
 * <p>The signing secret must be at least 32 bytes long (HS256); shorter secrets
 * are rejected when {@link com.jumpad.mathapi.service.TokenService} starts.</p>
 *
 * @param secret         HMAC signing secret
 * @param expiryMinutes  lifetime of issued credentials
 * @param issuer         value of the {@code iss} claim, checked on verification
 * @param adminSubject   subject embedded in administrator credentials
 * @param testerSubject  subject embedded in tester credentials
 */
@Validated
@ConfigurationProperties(prefix = "app.token")
public record TokenProperties(
    @NotBlank String secret,
    @Min(1) long expiryMinutes,
    @NotBlank String issuer,
    @NotBlank String adminSubject,
    @NotBlank String testerSubject
) {
}
