package com.questrail.seabird.radio.upstream;

/**
 * A single upstream fetch failed.
 */
public final class UpstreamFetchException extends RuntimeException
{
    private final boolean retryable;

    public UpstreamFetchException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public UpstreamFetchException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Whether the same request may succeed if sent again (HTTP 429 or 5xx);
     * a malformed payload or a 4xx is not.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
