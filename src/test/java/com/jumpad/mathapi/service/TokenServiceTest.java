package com.jumpad.mathapi.service;

import com.jumpad.mathapi.config.TokenProperties;
import com.jumpad.mathapi.exception.AuthException;
import com.jumpad.mathapi.exception.ExpiredCredentialException;
import com.jumpad.mathapi.exception.InvalidSignatureException;
import com.jumpad.mathapi.exception.MalformedClaimsException;
import com.jumpad.mathapi.exception.MissingCredentialException;
import com.jumpad.mathapi.security.AuthenticatedPrincipal;
import com.jumpad.mathapi.security.Role;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TokenService}.
 * Uses a fixed clock so expiry can be tested without sleeping.
 */
@DisplayName("TokenService Unit Tests")
class TokenServiceTest {

    private static final String SECRET = "unit-test-signing-secret-with-enough-bytes-0001";
    private static final String ISSUER = "secure-math-api-test";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private SimpleMeterRegistry meterRegistry;
    private TokenProperties properties;
    private TokenService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        properties = new TokenProperties(SECRET, 30, ISSUER, "admin", "tester");
        service = serviceAt(NOW);
    }

    private TokenService serviceAt(Instant instant) {
        return new TokenService(properties, Clock.fixed(instant, ZoneOffset.UTC), meterRegistry);
    }

    private String sign(JWTClaimsSet claims, String secret) throws Exception {
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        jwt.sign(new MACSigner(secret.getBytes(StandardCharsets.UTF_8)));
        return jwt.serialize();
    }

    private JWTClaimsSet.Builder validClaims() {
        return new JWTClaimsSet.Builder()
            .subject("tester")
            .issuer(ISSUER)
            .issueTime(Date.from(NOW))
            .expirationTime(Date.from(NOW.plus(Duration.ofMinutes(30))))
            .claim(Role.CLAIM, "tester");
    }

    private double failures(AuthException.Reason reason) {
        var counter = meterRegistry.find(TokenService.VALIDATION_FAILURE_METRIC)
            .tag("reason", reason.tag())
            .counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("Issuance")
    class Issuance {

        @Test
        @DisplayName("issued tester credential verifies to the tester principal")
        void shouldRoundTripTester() {
            AuthenticatedPrincipal principal = service.verify(service.issue(Role.TESTER));

            assertEquals("tester", principal.subject());
            assertEquals(Role.TESTER, principal.role());
            assertEquals(NOW.plus(Duration.ofMinutes(30)), principal.expiresAt());
        }

        @Test
        @DisplayName("issued admin credential carries the admin role claim")
        void shouldEmbedAdminRole() throws Exception {
            String token = service.issue(Role.ADMINISTRATOR);

            JWTClaimsSet claims = SignedJWT.parse(token).getJWTClaimsSet();
            assertEquals("admin", claims.getSubject());
            assertEquals("admin", claims.getStringClaim(Role.CLAIM));
            assertEquals(ISSUER, claims.getIssuer());
        }

        @Test
        @DisplayName("two issuances for the same role are both valid")
        void shouldIssueIndependentCredentials() {
            String first = service.issue(Role.TESTER);
            String second = serviceAt(NOW.plusSeconds(5)).issue(Role.TESTER);

            assertNotEquals(first, second);
            assertEquals(Role.TESTER, service.verify(first).role());
            assertEquals(Role.TESTER, service.verify(second).role());
        }

        @Test
        @DisplayName("issued credentials are counted per role")
        void shouldCountIssuance() {
            service.issue(Role.ADMINISTRATOR);
            service.issue(Role.ADMINISTRATOR);

            assertEquals(2.0, meterRegistry.get(TokenService.ISSUED_METRIC)
                .tag("role", "admin").counter().count());
        }

        @Test
        @DisplayName("secret shorter than 32 bytes is rejected at startup")
        void shouldRejectShortSecret() {
            TokenProperties weak = new TokenProperties("short", 30, ISSUER, "admin", "tester");

            assertThrows(IllegalStateException.class,
                () -> new TokenService(weak, Clock.systemUTC(), meterRegistry));
        }
    }

    @Nested
    @DisplayName("Verification Failures")
    class VerificationFailures {

        @Test
        @DisplayName("null or blank token is a missing credential")
        void shouldRejectMissingToken() {
            assertThrows(MissingCredentialException.class, () -> service.verify(null));
            assertThrows(MissingCredentialException.class, () -> service.verify("  "));
            assertEquals(2.0, failures(AuthException.Reason.MISSING_CREDENTIAL));
        }

        @Test
        @DisplayName("credential is rejected once the expiry instant is reached")
        void shouldRejectExpiredToken() {
            String token = service.issue(Role.TESTER);

            assertDoesNotThrow(() -> serviceAt(NOW.plus(Duration.ofMinutes(29))).verify(token));
            ExpiredCredentialException ex = assertThrows(ExpiredCredentialException.class,
                () -> serviceAt(NOW.plus(Duration.ofMinutes(31))).verify(token));
            assertEquals(NOW.plus(Duration.ofMinutes(30)), ex.getExpiredAt());
            assertThrows(ExpiredCredentialException.class,
                () -> serviceAt(NOW.plus(Duration.ofMinutes(30))).verify(token));
        }

        @Test
        @DisplayName("credential signed with another secret fails signature check")
        void shouldRejectForeignSecret() throws Exception {
            String token = sign(validClaims().build(), "another-secret-that-is-long-enough-for-hs256");

            assertThrows(InvalidSignatureException.class, () -> service.verify(token));
            assertEquals(1.0, failures(AuthException.Reason.INVALID_SIGNATURE));
        }

        @Test
        @DisplayName("tampered payload fails signature check")
        void shouldRejectTamperedPayload() throws Exception {
            String[] parts = service.issue(Role.TESTER).split("\\.");
            JWTClaimsSet forged = validClaims().claim(Role.CLAIM, "admin").build();
            String forgedPayload = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(forged.toString().getBytes(StandardCharsets.UTF_8));

            String tampered = parts[0] + "." + forgedPayload + "." + parts[2];

            assertThrows(InvalidSignatureException.class, () -> service.verify(tampered));
        }

        @Test
        @DisplayName("garbage string is malformed")
        void shouldRejectGarbage() {
            assertThrows(MalformedClaimsException.class, () -> service.verify("not-a-jwt"));
            assertEquals(1.0, failures(AuthException.Reason.MALFORMED_CLAIMS));
        }

        @Test
        @DisplayName("missing role claim is malformed")
        void shouldRejectMissingRole() throws Exception {
            JWTClaimsSet claims = new JWTClaimsSet.Builder(validClaims().build())
                .claim(Role.CLAIM, null)
                .build();

            String token = sign(claims, SECRET);

            assertThrows(MalformedClaimsException.class, () -> service.verify(token));
        }

        @Test
        @DisplayName("unknown role claim is malformed")
        void shouldRejectUnknownRole() throws Exception {
            String token = sign(validClaims().claim(Role.CLAIM, "superuser").build(), SECRET);

            assertThrows(MalformedClaimsException.class, () -> service.verify(token));
        }

        @Test
        @DisplayName("non-string role claim is malformed")
        void shouldRejectNonStringRole() throws Exception {
            String token = sign(validClaims().claim(Role.CLAIM, 42).build(), SECRET);

            assertThrows(MalformedClaimsException.class, () -> service.verify(token));
        }

        @Test
        @DisplayName("missing expiration claim is malformed")
        void shouldRejectMissingExpiration() throws Exception {
            String token = sign(validClaims().expirationTime(null).build(), SECRET);

            assertThrows(MalformedClaimsException.class, () -> service.verify(token));
        }

        @Test
        @DisplayName("foreign issuer is malformed")
        void shouldRejectForeignIssuer() throws Exception {
            String token = sign(validClaims().issuer("someone-else").build(), SECRET);

            assertThrows(MalformedClaimsException.class, () -> service.verify(token));
        }

        @Test
        @DisplayName("missing subject is malformed")
        void shouldRejectMissingSubject() throws Exception {
            String token = sign(validClaims().subject(null).build(), SECRET);

            assertThrows(MalformedClaimsException.class, () -> service.verify(token));
        }

        @Test
        @DisplayName("successful validations are counted")
        void shouldCountSuccess() {
            service.verify(service.issue(Role.TESTER));

            assertEquals(1.0, meterRegistry.get(TokenService.VALIDATION_SUCCESS_METRIC).counter().count());
        }
    }
}
