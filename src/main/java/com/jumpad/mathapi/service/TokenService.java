package com.jumpad.mathapi.service;

import com.jumpad.mathapi.config.TokenProperties;
import com.jumpad.mathapi.exception.AuthException;
import com.jumpad.mathapi.exception.ExpiredCredentialException;
import com.jumpad.mathapi.exception.InvalidSignatureException;
import com.jumpad.mathapi.exception.MalformedClaimsException;
import com.jumpad.mathapi.exception.MissingCredentialException;
import com.jumpad.mathapi.security.AuthenticatedPrincipal;
import com.jumpad.mathapi.security.Role;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies bearer credentials.
 *
 * <p>Credentials are HS256-signed JWTs and fully self-contained; nothing is stored
 * server side. Verification runs the checks in a fixed order and raises the
 * {@link AuthException} subtype of the first one that fails:</p>
 * <ol>
 *   <li>token present ({@link MissingCredentialException})</li>
 *   <li>token parses as an HS256 JWS ({@link MalformedClaimsException})</li>
 *   <li>signature matches ({@link InvalidSignatureException})</li>
 *   <li>not expired ({@link ExpiredCredentialException})</li>
 *   <li>issuer, subject and role claims present and known ({@link MalformedClaimsException})</li>
 * </ol>
 */
@Service
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);
    private static final int LOGGED_TOKEN_PREFIX = 10;

    static final String ISSUED_METRIC = "auth.token.issued";
    static final String VALIDATION_SUCCESS_METRIC = "auth.token.validation.success";
    static final String VALIDATION_FAILURE_METRIC = "auth.token.validation.failure";

    private final TokenProperties properties;
    private final Clock clock;
    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final MeterRegistry meterRegistry;
    private final Counter validationSuccessCounter;

    public TokenService(TokenProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        byte[] secret = properties.secret().getBytes(StandardCharsets.UTF_8);
        try {
            this.signer = new MACSigner(secret);
            this.verifier = new MACVerifier(secret);
        } catch (JOSEException e) {
            throw new IllegalStateException(
                "app.token.secret must be at least 256 bits (32 bytes) long for HS256", e);
        }

        this.validationSuccessCounter = Counter.builder(VALIDATION_SUCCESS_METRIC)
                .description("Number of successful credential validations")
                .register(meterRegistry);

        log.info("Token service initialized: issuer={}, expiry={}min",
            properties.issuer(), properties.expiryMinutes());
    }

    /**
     * Issues a credential for the static identity of the given role.
     *
     * @param role the role to embed
     * @return the serialized, signed credential
     */
    public String issue(Role role) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(Duration.ofMinutes(properties.expiryMinutes()));
        String subject = subjectFor(role);

        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(subject)
                .issuer(properties.issuer())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(expiresAt))
                .claim(Role.CLAIM, role.claimValue())
                .build();

        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign credential for role " + role, e);
        }

        Counter.builder(ISSUED_METRIC)
                .description("Number of credentials issued")
                .tag("role", role.claimValue())
                .register(meterRegistry)
                .increment();

        log.info("Issued {} credential for subject '{}', expires at {}", role, subject, expiresAt);
        return jwt.serialize();
    }

    /**
     * Verifies a bearer credential and resolves its principal.
     *
     * @param token the raw token from the Authorization header, may be null
     * @return the authenticated principal
     * @throws AuthException if any check fails
     */
    public AuthenticatedPrincipal verify(String token) {
        try {
            AuthenticatedPrincipal principal = doVerify(token);
            validationSuccessCounter.increment();
            log.debug("Credential validated for subject '{}' ({})", principal.subject(), principal.role());
            return principal;
        } catch (AuthException e) {
            Counter.builder(VALIDATION_FAILURE_METRIC)
                    .description("Number of failed credential validations")
                    .tag("reason", e.getReason().tag())
                    .register(meterRegistry)
                    .increment();
            log.debug("Credential rejected [{}] for token {}: {}",
                e.getReason(), abbreviate(token), e.getMessage());
            throw e;
        }
    }

    private AuthenticatedPrincipal doVerify(String token) {
        if (token == null || token.isBlank()) {
            throw new MissingCredentialException("No bearer token presented");
        }

        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token.trim());
        } catch (ParseException e) {
            throw new MalformedClaimsException("Token is not a signed JWT", e);
        }

        JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
        if (!JWSAlgorithm.HS256.equals(algorithm)) {
            throw new MalformedClaimsException("Unsupported signing algorithm: " + algorithm);
        }

        try {
            if (!jwt.verify(verifier)) {
                throw new InvalidSignatureException("Token signature does not match");
            }
        } catch (JOSEException e) {
            throw new InvalidSignatureException("Token signature could not be verified", e);
        }

        JWTClaimsSet claims;
        try {
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new MalformedClaimsException("Token claims are not a valid JSON object", e);
        }

        Date expiration = claims.getExpirationTime();
        if (expiration == null) {
            throw new MalformedClaimsException("Token has no expiration claim");
        }
        Instant expiresAt = expiration.toInstant();
        if (!expiresAt.isAfter(clock.instant())) {
            throw new ExpiredCredentialException(expiresAt);
        }

        if (!properties.issuer().equals(claims.getIssuer())) {
            throw new MalformedClaimsException("Unexpected issuer: " + claims.getIssuer());
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new MalformedClaimsException("Token has no subject");
        }

        String roleClaim = readRoleClaim(claims);
        Role role = Role.fromClaim(roleClaim)
                .orElseThrow(() -> new MalformedClaimsException("Unknown role claim: " + roleClaim));

        return new AuthenticatedPrincipal(subject, role, expiresAt);
    }

    private String readRoleClaim(JWTClaimsSet claims) {
        try {
            return claims.getStringClaim(Role.CLAIM);
        } catch (ParseException e) {
            throw new MalformedClaimsException("Role claim is not a string", e);
        }
    }

    private String subjectFor(Role role) {
        return role == Role.ADMINISTRATOR ? properties.adminSubject() : properties.testerSubject();
    }

    private static String abbreviate(String token) {
        if (token == null) {
            return "<none>";
        }
        return token.length() <= LOGGED_TOKEN_PREFIX ? token : token.substring(0, LOGGED_TOKEN_PREFIX) + "...";
    }
}
