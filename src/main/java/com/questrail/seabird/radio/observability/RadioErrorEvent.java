package com.questrail.seabird.radio.observability;

import java.time.Instant;

/**
 * Unexpected fault inside the plugin (a pump thread failure, a listener that
 * threw). Expected outcomes such as upstream outages are not reported here.
 */
public record RadioErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
