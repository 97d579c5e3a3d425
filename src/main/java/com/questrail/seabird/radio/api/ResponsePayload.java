package com.questrail.seabird.radio.api;

import java.util.List;
import java.util.Objects;

/**
 * Result carried by a {@link ResponseEnvelope}: reply text lines on success,
 * or a structured error.
 */
public sealed interface ResponsePayload
        permits ResponsePayload.Success, ResponsePayload.Failure
{
    record Success(List<String> lines) implements ResponsePayload {
        public Success {
            lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        }
    }

    record Failure(ErrorKind kind, String message) implements ResponsePayload {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }
    }
}
