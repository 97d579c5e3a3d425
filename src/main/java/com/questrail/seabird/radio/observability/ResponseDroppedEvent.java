package com.questrail.seabird.radio.observability;

import java.time.Instant;

/**
 * A completed response that was not written because the session that carried
 * its command is gone or refused the write. Responses are never re-sent.
 */
public record ResponseDroppedEvent(
    Instant timestamp,
    String correlationId,
    String sessionId,
    String reason
) {
}
