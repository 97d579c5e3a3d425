package com.questrail.seabird.radio.emit;

import com.questrail.seabird.radio.api.ResponseEnvelope;
import com.questrail.seabird.radio.api.ResponseSink;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.observability.NullObservabilitySink;
import com.questrail.seabird.radio.observability.RadioObservabilitySink;
import com.questrail.seabird.radio.observability.ResponseDroppedEvent;
import com.questrail.seabird.radio.session.CoreSession;
import com.questrail.seabird.radio.session.TransportException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/**
 * ResponseEmitter
 * =============================================================================
 * Production {@link ResponseSink}: writes each completed response onto the
 * session its command arrived on, if that session is still the live one.
 *
 * <h2>Drop policy</h2>
 * A response is dropped, counted and reported when
 * <ul>
 *   <li>no session is live</li>
 *   <li>the live session is not the one the command arrived on</li>
 *   <li>the session refuses or fails the write</li>
 * </ul>
 * Dropped responses are never retried and never re-targeted at a newer
 * session; the core owns redelivery.
 *
 * <p>{@link #emit(ResponseEnvelope)} never throws and may be called from any
 * thread. Write ordering is the session's concern.</p>
 */
public final class ResponseEmitter implements ResponseSink {

    private final Supplier<Optional<CoreSession>> liveSession;
    private final RadioObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final LongAdder emitted = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    /**
     * @param liveSession supplies the supervisor's current live session
     */
    public ResponseEmitter(Supplier<Optional<CoreSession>> liveSession,
                           RadioObservabilitySink observabilitySink,
                           WallClock wallClock) {
        this.liveSession = Objects.requireNonNull(liveSession, "liveSession");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void emit(ResponseEnvelope response) {
        Objects.requireNonNull(response, "response");

        Optional<CoreSession> live = liveSession.get();
        if (live.isEmpty()) {
            drop(response, "no live session");
            return;
        }

        CoreSession session = live.get();
        if (!session.id().equals(response.sessionId())) {
            drop(response, "originating session replaced by " + session.id());
            return;
        }

        try {
            session.send(response);
            emitted.increment();
        } catch (TransportException e) {
            drop(response, e.getMessage());
        } catch (IllegalArgumentException e) {
            drop(response, e.getMessage());
        }
    }

    public long emittedCount() {
        return emitted.sum();
    }

    public long droppedCount() {
        return dropped.sum();
    }

    private void drop(ResponseEnvelope response, String reason) {
        dropped.increment();
        observabilitySink.onResponseDropped(new ResponseDroppedEvent(
                wallClock.now(),
                response.correlationId(),
                response.sessionId(),
                reason
        ));
    }
}
