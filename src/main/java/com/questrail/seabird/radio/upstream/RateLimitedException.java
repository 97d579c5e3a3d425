package com.questrail.seabird.radio.upstream;

/**
 * No request token became available within the configured wait. Reported to
 * the user as RATE_LIMITED.
 */
public final class RateLimitedException extends RuntimeException
{
    public RateLimitedException(String message) {
        super(message);
    }
}
