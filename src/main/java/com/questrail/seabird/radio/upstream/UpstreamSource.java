package com.questrail.seabird.radio.upstream;

import java.util.concurrent.CompletableFuture;

/**
 * One external data provider queried by the {@link UpstreamRadioClient}.
 *
 * <p>A source performs a single fetch and nothing else: no caching, rate
 * limiting or retries. It signals retryable trouble with
 * {@link java.io.IOException} or a retryable {@link UpstreamFetchException},
 * and bad payloads with a non-retryable one.</p>
 *
 * @param <V> decoded value type
 */
@FunctionalInterface
public interface UpstreamSource<V>
{
    CompletableFuture<V> fetch(String key);
}
