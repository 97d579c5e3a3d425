package com.questrail.seabird.radio.observability;

/**
 * No-op implementation of RadioObservabilitySink.
 */
public final class NullObservabilitySink implements RadioObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onSupervisorTransition(SupervisorTransitionEvent event) {}

    @Override
    public void onSessionEvent(SessionLifecycleEvent event) {}

    @Override
    public void onResponseDropped(ResponseDroppedEvent event) {}

    @Override
    public void onCommandFailure(CommandFailureEvent event) {}

    @Override
    public void onError(RadioErrorEvent event) {}
}
