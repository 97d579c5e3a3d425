package com.questrail.seabird.radio.api;

/**
 * Structured error categories carried back to the core on a failed command.
 *
 * <p>Only {@link #INTERNAL} reflects a fault in this process. Every other kind
 * is an expected outcome the user can act on (fix the arguments, try later).</p>
 */
public enum ErrorKind {
    UNKNOWN_COMMAND,
    BAD_ARGUMENTS,
    RATE_LIMITED,
    UPSTREAM_UNAVAILABLE,
    TIMEOUT,
    INTERNAL
}
