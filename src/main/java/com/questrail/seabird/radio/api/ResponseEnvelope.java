package com.questrail.seabird.radio.api;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * ResponseEnvelope
 * -----------------------------------------------------------------------------
 * The single answer to one {@link CommandEnvelope}. Built when a handler
 * completes (or the router short-circuits) and consumed exactly once by the
 * response emitter.
 */
public record ResponseEnvelope(
        String correlationId,
        String sessionId,
        String channelId,
        ResponsePayload payload,
        Instant emittedAt
) {
    public ResponseEnvelope {
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(emittedAt, "emittedAt");
    }

    public static ResponseEnvelope success(CommandEnvelope command, List<String> lines, Instant now) {
        return new ResponseEnvelope(
                command.correlationId(),
                command.sessionId(),
                command.source().channelId(),
                new ResponsePayload.Success(lines),
                now
        );
    }

    public static ResponseEnvelope failure(CommandEnvelope command, ErrorKind kind, String message, Instant now) {
        return new ResponseEnvelope(
                command.correlationId(),
                command.sessionId(),
                command.source().channelId(),
                new ResponsePayload.Failure(kind, message),
                now
        );
    }

    public boolean isFailure() {
        return payload instanceof ResponsePayload.Failure;
    }
}
