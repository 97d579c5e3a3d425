package com.questrail.seabird.radio.observability;

import com.questrail.seabird.radio.supervisor.SupervisorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of RadioObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jRadioObservabilitySink implements RadioObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jRadioObservabilitySink.class);

    @Override
    public void onSupervisorTransition(SupervisorTransitionEvent event) {
        if (event.newState() == SupervisorState.BACKOFF) {
            log.warn("Supervisor: {} -> BACKOFF (attempt {}, retry in {} ms): {}",
                event.oldState(),
                event.attempt(),
                event.backoffDelay().toMillis(),
                event.cause() != null ? event.cause().getMessage() : "disconnected");
        } else if (event.newState() == SupervisorState.FATAL) {
            log.error("Supervisor: {} -> FATAL: {}",
                event.oldState(),
                event.cause() != null ? event.cause().getMessage() : "unknown cause");
        } else {
            log.info("Supervisor: {} -> {}", event.oldState(), event.newState());
        }
    }

    @Override
    public void onSessionEvent(SessionLifecycleEvent event) {
        log.info("Session {}: {} -> {}", event.sessionId(), event.oldState(), event.newState());
    }

    @Override
    public void onResponseDropped(ResponseDroppedEvent event) {
        log.warn("Dropped response {} for session {}: {}",
            event.correlationId(), event.sessionId(), event.reason());
    }

    @Override
    public void onCommandFailure(CommandFailureEvent event) {
        if (event.isInternal()) {
            log.error("Command {} ({}) failed", event.command(), event.correlationId(), event.cause());
        } else {
            log.debug("Command {} ({}) answered with {}", event.command(), event.correlationId(), event.kind());
        }
    }

    @Override
    public void onError(RadioErrorEvent event) {
        log.error("seabird-radio error: {}", event.message(), event.cause());
    }
}
