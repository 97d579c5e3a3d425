package com.questrail.seabird.radio.session;

/**
 * Lifecycle of one {@link CoreSession}.
 *
 * <p>Transitions only move forward in declaration order. States may be skipped
 * (a failed handshake goes straight from CONNECTING to CLOSED) but a session
 * never re-enters a state it has left.</p>
 */
public enum SessionState {
    CONNECTING,
    AUTHENTICATED,
    DRAINING,
    CLOSED;

    public boolean canTransitionTo(SessionState next) {
        return next.ordinal() > ordinal();
    }
}
