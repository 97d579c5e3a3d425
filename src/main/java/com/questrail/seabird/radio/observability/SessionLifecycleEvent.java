package com.questrail.seabird.radio.observability;

import com.questrail.seabird.radio.session.SessionState;

import java.time.Instant;

/**
 * Record of one transport session state change.
 */
public record SessionLifecycleEvent(
    Instant timestamp,
    String sessionId,
    SessionState oldState,
    SessionState newState
) {
}
