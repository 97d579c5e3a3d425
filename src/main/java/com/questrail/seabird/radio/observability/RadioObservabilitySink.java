package com.questrail.seabird.radio.observability;

/**
 * Receives observability events from the supervisor, sessions, router and
 * emitter. Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive concurrently from handler, pump and scheduler
 * threads. Implementations must be thread-safe and must not block.</p>
 */
public interface RadioObservabilitySink {

    void onSupervisorTransition(SupervisorTransitionEvent event);

    void onSessionEvent(SessionLifecycleEvent event);

    void onResponseDropped(ResponseDroppedEvent event);

    void onCommandFailure(CommandFailureEvent event);

    void onError(RadioErrorEvent event);
}
