package com.jumpad.mathapi.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Per-client rate limiting using Bucket4j token buckets.
 *
 * <h2>Rate Limit Strategy:</h2>
 * <ul>
 *   <li>One bucket per client address (socket peer)</li>
 *   <li>Default: 200 requests per minute ({@code API_RATE_LIMIT})</li>
 *   <li>Greedy refill</li>
 * </ul>
 *
 * <p>Buckets are held in a Caffeine cache. A bucket idle for longer than
 * {@code client-idle-expiry} is dropped; it would have refilled completely by then,
 * so a fresh one is equivalent. The cache is also capped at {@code max-clients}
 * entries. Limits are per instance.</p>
 */
@Configuration
public class RateLimitConfig {

    private final int requestsPerMinute;

    private final Cache<String, Bucket> buckets;

    @Autowired
    public RateLimitConfig(@Value("${app.rate-limiting.requests-per-minute:200}") int requestsPerMinute,
                           @Value("${app.rate-limiting.client-idle-expiry:10m}") Duration clientIdleExpiry,
                           @Value("${app.rate-limiting.max-clients:100000}") long maxClients) {
        this(requestsPerMinute, clientIdleExpiry, maxClients, Ticker.systemTicker());
    }

    RateLimitConfig(int requestsPerMinute, Duration clientIdleExpiry, long maxClients, Ticker ticker) {
        if (requestsPerMinute < 1) {
            throw new IllegalArgumentException(
                "app.rate-limiting.requests-per-minute must be positive, got: " + requestsPerMinute);
        }
        if (clientIdleExpiry.compareTo(Duration.ofMinutes(1)) < 0) {
            throw new IllegalArgumentException(
                "app.rate-limiting.client-idle-expiry must be at least one refill period (1m), got: "
                    + clientIdleExpiry);
        }
        this.requestsPerMinute = requestsPerMinute;
        this.buckets = Caffeine.newBuilder()
            .expireAfterAccess(clientIdleExpiry)
            .maximumSize(maxClients)
            .ticker(ticker)
            .build();
    }

    /**
     * Gets or creates the bucket for a client.
     *
     * @param clientKey the client address
     * @return the client's bucket
     */
    public Bucket resolveBucket(String clientKey) {
        return buckets.get(clientKey, this::createNewBucket);
    }

    private Bucket createNewBucket(String clientKey) {
        Bandwidth limit = Bandwidth.classic(
            requestsPerMinute,
            Refill.greedy(requestsPerMinute, Duration.ofMinutes(1))
        );

        return Bucket.builder()
            .addLimit(limit)
            .build();
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    /**
     * Number of clients currently holding a bucket, after pending evictions.
     */
    public long trackedClients() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }
}
