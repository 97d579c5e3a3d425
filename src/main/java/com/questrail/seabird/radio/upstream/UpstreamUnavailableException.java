package com.questrail.seabird.radio.upstream;

/**
 * The upstream could not produce a value: retries were exhausted or the
 * response was unusable. Reported to the user as UPSTREAM_UNAVAILABLE.
 */
public final class UpstreamUnavailableException extends RuntimeException
{
    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
