package com.questrail.seabird.radio.upstream;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.questrail.seabird.radio.internal.time.MonotonicClock;
import com.questrail.seabird.radio.internal.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * UpstreamRadioClient
 * =============================================================================
 * Cached, rate-limited, retrying access to one {@link UpstreamSource}.
 *
 * <h2>Query path</h2>
 * <ol>
 *   <li>a cache entry younger than the TTL answers immediately, with no
 *       upstream request</li>
 *   <li>otherwise a token is taken from the {@link TokenBucketRateLimiter};
 *       when none is available the query re-checks on the scheduler until
 *       {@code maxRateLimitWait} runs out, then fails with
 *       {@link RateLimitedException}</li>
 *   <li>the source is called; retryable failures are retried after a fixed
 *       delay up to {@code retryAttempts} times, then the query fails with
 *       {@link UpstreamUnavailableException}. Non-retryable failures fail at
 *       once.</li>
 *   <li>a fetched value is cached and returned</li>
 * </ol>
 *
 * <p>One token covers a query and all of its retries. Concurrent misses on
 * the same key may each fetch; the last value written wins.</p>
 *
 * <p>All waiting is done with scheduled tasks, never by parking a handler
 * thread. Cache expiry is measured on the {@link MonotonicClock}.</p>
 *
 * @param <V> decoded value type
 */
public final class UpstreamRadioClient<V> {

    private static final Logger log = LoggerFactory.getLogger(UpstreamRadioClient.class);

    private final String name;
    private final UpstreamSource<V> source;
    private final TokenBucketRateLimiter limiter;
    private final UpstreamPolicy policy;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Cache<String, V> cache;

    public UpstreamRadioClient(String name,
                               UpstreamSource<V> source,
                               TokenBucketRateLimiter limiter,
                               UpstreamPolicy policy,
                               MonotonicClock clock,
                               MonotonicScheduler scheduler) {
        this.name = Objects.requireNonNull(name, "name");
        this.source = Objects.requireNonNull(source, "source");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");

        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(policy.cacheTtl())
                .maximumSize(policy.cacheMaximumSize())
                .ticker(clock::nowNanos)
                .executor(Runnable::run)
                .build();
    }

    /**
     * Client with a rate limiter sized from {@code policy}.
     */
    public static <V> UpstreamRadioClient<V> create(String name,
                                                    UpstreamSource<V> source,
                                                    UpstreamPolicy policy,
                                                    MonotonicClock clock,
                                                    MonotonicScheduler scheduler) {
        TokenBucketRateLimiter limiter =
                new TokenBucketRateLimiter(policy.bucketCapacity(), policy.refillPeriod(), clock);
        return new UpstreamRadioClient<>(name, source, limiter, policy, clock, scheduler);
    }

    public String name() {
        return name;
    }

    /**
     * Look up {@code key}, from cache if fresh.
     *
     * @return a future completed with the value, or exceptionally with
     *         {@link RateLimitedException} or {@link UpstreamUnavailableException}
     */
    public CompletableFuture<V> query(String key) {
        Objects.requireNonNull(key, "key");

        V cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("{}: cache hit for {}", name, key);
            return CompletableFuture.completedFuture(cached);
        }

        CompletableFuture<V> result = new CompletableFuture<>();
        long deadlineNanos = clock.nowNanos() + policy.maxRateLimitWait().toNanos();
        acquire(key, result, deadlineNanos);
        return result;
    }

    /**
     * Drop every cached value.
     */
    public void invalidateAll() {
        cache.invalidateAll();
    }

    private void acquire(String key, CompletableFuture<V> result, long deadlineNanos) {
        long waitNanos = limiter.tryAcquire();
        if (waitNanos == 0) {
            attempt(key, result, 0);
            return;
        }

        long retryAt = clock.nowNanos() + waitNanos;
        if (retryAt - deadlineNanos > 0) {
            result.completeExceptionally(new RateLimitedException(
                    name + ": no request budget within " + policy.maxRateLimitWait().toMillis() + " ms"));
            return;
        }
        scheduler.scheduleAtNanos(retryAt, () -> acquire(key, result, deadlineNanos));
    }

    private void attempt(String key, CompletableFuture<V> result, int retriesSoFar) {
        log.debug("{}: fetching {} (retry {})", name, key, retriesSoFar);

        CompletableFuture<V> fetch;
        try {
            fetch = source.fetch(key);
        } catch (RuntimeException e) {
            onFailure(key, result, retriesSoFar, e);
            return;
        }

        fetch.whenComplete((value, failure) -> {
            if (failure != null) {
                onFailure(key, result, retriesSoFar, unwrap(failure));
            } else if (value == null) {
                onFailure(key, result, retriesSoFar,
                        new UpstreamFetchException("empty response for " + key, false));
            } else {
                cache.put(key, value);
                result.complete(value);
            }
        });
    }

    private void onFailure(String key, CompletableFuture<V> result, int retriesSoFar, Throwable cause) {
        if (isRetryable(cause) && retriesSoFar < policy.retryAttempts()) {
            log.warn("{}: fetch of {} failed, retrying in {} ms: {}",
                    name, key, policy.retryDelay().toMillis(), cause.getMessage());
            scheduler.scheduleAfter(policy.retryDelay(), clock,
                    () -> attempt(key, result, retriesSoFar + 1));
            return;
        }

        log.warn("{}: giving up on {} after {} attempt(s): {}",
                name, key, retriesSoFar + 1, cause.getMessage());
        result.completeExceptionally(new UpstreamUnavailableException(
                name + " is unavailable: " + cause.getMessage(), cause));
    }

    static boolean isRetryable(Throwable cause) {
        if (cause instanceof UpstreamFetchException fetchException) {
            return fetchException.isRetryable();
        }
        return cause instanceof IOException || cause instanceof TimeoutException;
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable t = failure;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
