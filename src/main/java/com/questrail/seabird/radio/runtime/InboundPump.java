package com.questrail.seabird.radio.runtime;

import com.questrail.seabird.radio.api.CommandEnvelope;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.observability.RadioErrorEvent;
import com.questrail.seabird.radio.observability.RadioObservabilitySink;
import com.questrail.seabird.radio.router.CommandRouter;
import com.questrail.seabird.radio.session.CoreSession;
import com.questrail.seabird.radio.supervisor.ReconnectionSupervisor;

import java.util.Objects;
import java.util.Optional;

/**
 * InboundPump
 * -----------------------------------------------------------------------------
 * Reads one live session's commands in order and hands each to the router.
 *
 * <p>There is exactly one pump per live session, on its own thread. When the
 * session's inbound sequence ends the pump reports it to the supervisor and
 * exits. Because {@link CommandRouter#dispatch} blocks while the in-flight
 * limit is reached, a slow handler pool slows reading from the core.</p>
 */
final class InboundPump implements Runnable {

    private final CoreSession session;
    private final CommandRouter router;
    private final ReconnectionSupervisor supervisor;
    private final RadioObservabilitySink observabilitySink;
    private final WallClock wallClock;

    InboundPump(CoreSession session,
                CommandRouter router,
                ReconnectionSupervisor supervisor,
                RadioObservabilitySink observabilitySink,
                WallClock wallClock) {
        this.session = Objects.requireNonNull(session, "session");
        this.router = Objects.requireNonNull(router, "router");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void run() {
        Throwable failure = null;
        try {
            while (true) {
                Optional<CommandEnvelope> next = session.receive();
                if (next.isEmpty()) {
                    break;
                }
                router.dispatch(next.get());
            }
        } catch (InterruptedException e) {
            // Runtime shutdown.
            Thread.currentThread().interrupt();
            return;
        } catch (RuntimeException e) {
            observabilitySink.onError(new RadioErrorEvent(
                    wallClock.now(), "inbound pump for session " + session.id() + " failed", e));
            session.close();
            failure = e;
        }

        supervisor.onSessionEnded(session, failure != null ? failure : session.closeCause().orElse(null));
    }
}
