package com.questrail.seabird.radio.observability;

import com.questrail.seabird.radio.api.ErrorKind;

import java.time.Instant;

/**
 * A command that completed with a structured error.
 *
 * @param cause the handler failure, or {@code null} when the router rejected
 *              the command before invoking a handler
 */
public record CommandFailureEvent(
    Instant timestamp,
    String correlationId,
    String command,
    ErrorKind kind,
    Throwable cause
) {
    public boolean isInternal() {
        return kind == ErrorKind.INTERNAL;
    }
}
