package com.jumpad.mathapi.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jumpad.mathapi.config.RateLimitConfig;
import jakarta.servlet.FilterChain;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RateLimitFilter}.
 * Tests rate limiting behavior including allowed and blocked requests.
 */
@DisplayName("RateLimitFilter Unit Tests")
class RateLimitFilterTest {

    private static final int LIMIT = 100;

    private RateLimitConfig rateLimitConfig;
    private RateLimitFilter filter;
    private FilterChain filterChain;
    private MockHttpServletRequest request;
    private MockHttpServletResponse response;

    @BeforeEach
    void setUp() {
        rateLimitConfig = new RateLimitConfig(LIMIT, Duration.ofMinutes(10), 10_000);
        filter = new RateLimitFilter(rateLimitConfig, new ErrorResponseWriter(new ObjectMapper()));
        filterChain = mock(FilterChain.class);
        request = new MockHttpServletRequest("POST", "/somar");
        response = new MockHttpServletResponse();
    }

    private MockHttpServletResponse send(String ip) throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/somar");
        MockHttpServletResponse res = new MockHttpServletResponse();
        req.setRemoteAddr(ip);
        filter.doFilterInternal(req, res, filterChain);
        return res;
    }

    @Test
    @DisplayName("Request under rate limit is allowed")
    void shouldAllowRequestUnderRateLimit() throws Exception {
        request.setRemoteAddr("127.0.0.1");

        filter.doFilterInternal(request, response, filterChain);

        assertEquals(200, response.getStatus());
        verify(filterChain).doFilter(request, response);
        assertEquals(String.valueOf(LIMIT - 1), response.getHeader("X-Rate-Limit-Remaining"));
        assertEquals(String.valueOf(LIMIT), response.getHeader("X-Rate-Limit-Limit"));
    }

    @Test
    @DisplayName("Health and actuator requests are not rate limited")
    void shouldNotRateLimitOperationalEndpoints() {
        assertTrue(filter.shouldNotFilter(new MockHttpServletRequest("GET", "/saude")));
        assertTrue(filter.shouldNotFilter(new MockHttpServletRequest("GET", "/actuator/health")));
        assertFalse(filter.shouldNotFilter(new MockHttpServletRequest("POST", "/token_tester")));
    }

    @Test
    @DisplayName("Request exceeding rate limit returns 429 with a JSON body")
    void shouldReturn429WhenRateLimitExceeded() throws Exception {
        String testIp = "192.168.1.100";
        for (int i = 0; i < LIMIT; i++) {
            send(testIp);
        }

        MockHttpServletResponse blocked = send(testIp);

        assertEquals(429, blocked.getStatus());
        assertTrue(Long.parseLong(blocked.getHeader("Retry-After")) >= 1);
        assertEquals("0", blocked.getHeader("X-Rate-Limit-Remaining"));
        assertTrue(blocked.getContentAsString().contains(RateLimitFilter.RATE_LIMITED));
        verify(filterChain, times(LIMIT)).doFilter(any(), any());
    }

    @Test
    @DisplayName("Different IPs have separate rate limits")
    void shouldHaveSeparateRateLimitsPerIp() throws Exception {
        for (int i = 0; i < LIMIT; i++) {
            send("1.1.1.1");
        }

        MockHttpServletResponse other = send("2.2.2.2");

        assertEquals(200, other.getStatus());
        verify(filterChain, times(LIMIT + 1)).doFilter(any(), any());
    }

    @Test
    @DisplayName("Varying X-Forwarded-For from one peer shares that peer's bucket")
    void shouldIgnoreClientSuppliedForwardedFor() throws Exception {
        int blocked = 0;
        for (int i = 0; i < 1000; i++) {
            MockHttpServletRequest req = new MockHttpServletRequest("POST", "/somar");
            MockHttpServletResponse res = new MockHttpServletResponse();
            req.setRemoteAddr("10.0.0.1");
            req.addHeader("X-Forwarded-For", "203.0.113." + i);
            filter.doFilterInternal(req, res, filterChain);
            if (res.getStatus() == 429) {
                blocked++;
            }
        }

        assertEquals(1000 - LIMIT, blocked);
        assertEquals(1, rateLimitConfig.trackedClients());
        verify(filterChain, times(LIMIT)).doFilter(any(), any());
    }

    @Test
    @DisplayName("Non-positive limit is rejected")
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class,
            () -> new RateLimitConfig(0, Duration.ofMinutes(10), 10_000));
    }
}
