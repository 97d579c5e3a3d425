package com.questrail.seabird.radio.upstream;

import java.time.Duration;
import java.util.Objects;

/**
 * UpstreamPolicy
 * -----------------------------------------------------------------------------
 * Caching, rate limiting and retry settings for one upstream.
 *
 * <ul>
 *   <li><b>bucketCapacity / refillPeriod</b>: burst size and sustained rate of
 *       upstream requests</li>
 *   <li><b>maxRateLimitWait</b>: how long a query may wait for a token before
 *       failing as rate limited</li>
 *   <li><b>retryAttempts / retryDelay</b>: extra attempts after a retryable
 *       failure, and the fixed spacing between them</li>
 *   <li><b>cacheTtl / cacheMaximumSize</b>: freshness window and bound of the
 *       value cache</li>
 *   <li><b>requestTimeout</b>: per-request limit applied by HTTP sources</li>
 * </ul>
 */
public record UpstreamPolicy(
        int bucketCapacity,
        Duration refillPeriod,
        Duration maxRateLimitWait,
        int retryAttempts,
        Duration retryDelay,
        Duration cacheTtl,
        long cacheMaximumSize,
        Duration requestTimeout
) {
    public UpstreamPolicy {
        Objects.requireNonNull(refillPeriod, "refillPeriod");
        Objects.requireNonNull(maxRateLimitWait, "maxRateLimitWait");
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(cacheTtl, "cacheTtl");
        Objects.requireNonNull(requestTimeout, "requestTimeout");

        if (bucketCapacity <= 0) {
            throw new IllegalArgumentException("bucketCapacity must be > 0");
        }
        if (refillPeriod.isNegative() || refillPeriod.isZero()) {
            throw new IllegalArgumentException("refillPeriod must be positive");
        }
        if (maxRateLimitWait.isNegative()) {
            throw new IllegalArgumentException("maxRateLimitWait must be >= 0");
        }
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must be >= 0");
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be >= 0");
        }
        if (cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cacheTtl must be positive");
        }
        if (cacheMaximumSize <= 0) {
            throw new IllegalArgumentException("cacheMaximumSize must be > 0");
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
    }

    public static UpstreamPolicy defaults() {
        return new UpstreamPolicy(
                5,
                Duration.ofSeconds(2),
                Duration.ofSeconds(2),
                2,
                Duration.ofMillis(500),
                Duration.ofSeconds(60),
                256,
                Duration.ofSeconds(5)
        );
    }

    public UpstreamPolicy withCacheTtl(Duration ttl) {
        return new UpstreamPolicy(bucketCapacity, refillPeriod, maxRateLimitWait, retryAttempts,
                retryDelay, ttl, cacheMaximumSize, requestTimeout);
    }
}
