package com.jumpad.mathapi.filter;

import com.jumpad.mathapi.config.RateLimitConfig;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * HTTP filter for rate limiting API requests.
 *
 * <p>Applies per-IP token bucket limits to every path except the health check and
 * actuator endpoints. The client is the socket peer; {@code X-Forwarded-For} is only
 * honoured when {@code server.forward-headers-strategy} makes the container rewrite
 * the remote address, which must be enabled only behind a trusted proxy.</p>
 *
 * <p>Runs after the Spring Security chain, so requests rejected by the
 * authorization gate do not consume tokens.</p>
 *
 * <h2>Behavior:</h2>
 * <ul>
 *   <li>Allows requests if tokens are available</li>
 *   <li>Returns 429 Too Many Requests if limit exceeded</li>
 *   <li>Includes Retry-After header indicating wait time</li>
 * </ul>
 */
@Component
@Order(1)
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String RATE_LIMITED = "RATE_LIMITED";

    private final RateLimitConfig rateLimitConfig;
    private final ErrorResponseWriter errorResponseWriter;

    public RateLimitFilter(RateLimitConfig rateLimitConfig, ErrorResponseWriter errorResponseWriter) {
        this.rateLimitConfig = rateLimitConfig;
        this.errorResponseWriter = errorResponseWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri.equals("/saude") || uri.startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String clientIp = request.getRemoteAddr();
        Bucket bucket = rateLimitConfig.resolveBucket(clientIp);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (probe.isConsumed()) {
            response.addHeader("X-Rate-Limit-Remaining",
                String.valueOf(probe.getRemainingTokens()));
            response.addHeader("X-Rate-Limit-Limit",
                String.valueOf(rateLimitConfig.getRequestsPerMinute()));

            filterChain.doFilter(request, response);
        } else {
            long waitTimeSeconds = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()));

            logger.warn("Rate limit exceeded for IP: {}. Wait time: {}s", clientIp, waitTimeSeconds);

            response.addHeader("Retry-After", String.valueOf(waitTimeSeconds));
            response.addHeader("X-Rate-Limit-Remaining", "0");
            response.addHeader("X-Rate-Limit-Limit",
                String.valueOf(rateLimitConfig.getRequestsPerMinute()));

            errorResponseWriter.write(response, HttpStatus.TOO_MANY_REQUESTS, RATE_LIMITED,
                "Rate limit exceeded. Please wait " + waitTimeSeconds
                    + " seconds before retrying. Limit: " + rateLimitConfig.getRequestsPerMinute()
                    + " requests per minute.");
        }
    }
}
