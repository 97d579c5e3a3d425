package com.questrail.seabird.radio.supervisor;

import com.questrail.seabird.radio.internal.time.Cancellable;
import com.questrail.seabird.radio.internal.time.MonotonicClock;
import com.questrail.seabird.radio.internal.time.MonotonicScheduler;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.observability.NullObservabilitySink;
import com.questrail.seabird.radio.observability.RadioErrorEvent;
import com.questrail.seabird.radio.observability.RadioObservabilitySink;
import com.questrail.seabird.radio.observability.SupervisorTransitionEvent;
import com.questrail.seabird.radio.session.AuthException;
import com.questrail.seabird.radio.session.CoreSession;
import com.questrail.seabird.radio.session.TransportException;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * ReconnectionSupervisor
 * =============================================================================
 * Keeps exactly one live {@link CoreSession} for as long as the process runs,
 * so that nothing above it ever observes raw connection churn.
 *
 * <h2>State machine</h2>
 * See {@link SupervisorState}. Transitions:
 * <ul>
 *   <li>IDLE → CONNECTING on {@link #start()}</li>
 *   <li>CONNECTING → LIVE on a successful handshake; the attempt counter resets</li>
 *   <li>CONNECTING → BACKOFF on a transport failure or a transient credential
 *       refusal; the attempt counter increments</li>
 *   <li>CONNECTING → FATAL on an invalid-credential refusal; no retry</li>
 *   <li>LIVE → BACKOFF when the session ends or nothing is heard from the
 *       core for longer than the liveness threshold</li>
 *   <li>BACKOFF → CONNECTING when the scheduled delay elapses</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * State is guarded by a single monitor. Handshakes block, so they run on the
 * supplied connect executor; delays and liveness ticks are timers on the
 * {@link MonotonicScheduler}. No thread ever sleeps waiting for a backoff.
 * Listener callbacks are made outside the monitor.
 *
 * <h2>Delivery policy</h2>
 * When a session is replaced, commands already dispatched on it run to
 * completion but their responses are dropped by the emitter. Responses are
 * never replayed onto a newer session.
 */
public final class ReconnectionSupervisor {

    private final SessionFactory sessionFactory;
    private final SupervisorTimingPolicy timingPolicy;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final Executor connectExecutor;
    private final SupervisorListener listener;
    private final RadioObservabilitySink observabilitySink;
    private final DoubleSupplier jitter;

    private final Object lock = new Object();

    // Guarded by lock.
    private SupervisorState state = SupervisorState.IDLE;
    private int attempts;
    private CoreSession current;
    private Cancellable pendingRetry;
    private Cancellable livenessTick;

    public ReconnectionSupervisor(SessionFactory sessionFactory,
                                  SupervisorTimingPolicy timingPolicy,
                                  MonotonicClock clock,
                                  MonotonicScheduler scheduler,
                                  WallClock wallClock,
                                  Executor connectExecutor,
                                  SupervisorListener listener,
                                  RadioObservabilitySink observabilitySink,
                                  DoubleSupplier jitter) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.connectExecutor = Objects.requireNonNull(connectExecutor, "connectExecutor");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.jitter = Objects.requireNonNull(jitter, "jitter");
    }

    /**
     * Supervisor with uniformly random jitter.
     */
    public ReconnectionSupervisor(SessionFactory sessionFactory,
                                  SupervisorTimingPolicy timingPolicy,
                                  MonotonicClock clock,
                                  MonotonicScheduler scheduler,
                                  WallClock wallClock,
                                  Executor connectExecutor,
                                  SupervisorListener listener,
                                  RadioObservabilitySink observabilitySink) {
        this(sessionFactory, timingPolicy, clock, scheduler, wallClock, connectExecutor,
                listener, observabilitySink, () -> ThreadLocalRandom.current().nextDouble());
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Begin connecting. Only valid from IDLE.
     */
    public void start() {
        synchronized (lock) {
            if (state != SupervisorState.IDLE) {
                throw new IllegalStateException("supervisor is " + state);
            }
            transition(SupervisorState.CONNECTING, Duration.ZERO, null);
        }
        connectExecutor.execute(this::attemptConnect);
    }

    /**
     * Stop supervising: cancel timers, drain and close the live session and
     * return to IDLE. A FATAL supervisor stays FATAL.
     */
    public void stop() {
        CoreSession toClose;
        synchronized (lock) {
            cancelTimers();
            toClose = current;
            current = null;
            if (state != SupervisorState.FATAL && state != SupervisorState.IDLE) {
                transition(SupervisorState.IDLE, Duration.ZERO, null);
            }
        }
        if (toClose != null) {
            toClose.drain();
            toClose.close();
        }
    }

    public SupervisorState state() {
        synchronized (lock) {
            return state;
        }
    }

    /**
     * Failed connect attempts since the supervisor was last LIVE.
     */
    public int attempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    /**
     * The session currently LIVE, if any. Callers must not hold on to it.
     */
    public Optional<CoreSession> currentSession() {
        synchronized (lock) {
            return state == SupervisorState.LIVE ? Optional.ofNullable(current) : Optional.empty();
        }
    }

    // -------------------------------------------------------------------------
    // Session reports
    // -------------------------------------------------------------------------

    /**
     * Report that a session's inbound sequence ended. Stale reports for
     * sessions that were already replaced are ignored.
     */
    public void onSessionEnded(CoreSession session, Throwable cause) {
        Objects.requireNonNull(session, "session");
        sessionLost(session, cause != null
                ? cause
                : new TransportException("core ended session " + session.id()));
    }

    // -------------------------------------------------------------------------
    // Connect path
    // -------------------------------------------------------------------------

    private void attemptConnect() {
        CoreSession session;
        try {
            session = sessionFactory.newSession();
            session.connect(timingPolicy.handshakeTimeout());
        } catch (AuthException e) {
            if (e.isFatal()) {
                onFatal(e);
            } else {
                onConnectFailed(e);
            }
            return;
        } catch (TransportException | RuntimeException e) {
            onConnectFailed(e);
            return;
        }
        onConnected(session);
    }

    private void onConnected(CoreSession session) {
        synchronized (lock) {
            if (state != SupervisorState.CONNECTING) {
                // Stopped while the handshake was in flight.
                session.close();
                return;
            }
            current = session;
            attempts = 0;
            transition(SupervisorState.LIVE, Duration.ZERO, null);
            armLivenessTick();
        }

        try {
            listener.onSessionLive(session);
        } catch (RuntimeException e) {
            observabilitySink.onError(new RadioErrorEvent(wallClock.now(), "session listener failed", e));
            sessionLost(session, e);
        }
    }

    private void onConnectFailed(Throwable cause) {
        synchronized (lock) {
            if (state != SupervisorState.CONNECTING) {
                return;
            }
            Duration delay = timingPolicy.backoff().delayFor(attempts, jitter);
            attempts++;
            enterBackoff(delay, cause);
        }
    }

    private void onFatal(AuthException cause) {
        synchronized (lock) {
            if (state != SupervisorState.CONNECTING) {
                return;
            }
            cancelTimers();
            transition(SupervisorState.FATAL, Duration.ZERO, cause);
        }
        listener.onFatal(cause);
    }

    private void enterBackoff(Duration delay, Throwable cause) {
        transition(SupervisorState.BACKOFF, delay, cause);
        pendingRetry = scheduler.scheduleAfter(delay, clock, this::retry);
    }

    private void retry() {
        synchronized (lock) {
            if (state != SupervisorState.BACKOFF) {
                return;
            }
            pendingRetry = null;
            transition(SupervisorState.CONNECTING, Duration.ZERO, null);
        }
        connectExecutor.execute(this::attemptConnect);
    }

    // -------------------------------------------------------------------------
    // Liveness
    // -------------------------------------------------------------------------

    private void armLivenessTick() {
        livenessTick = scheduler.scheduleAfter(timingPolicy.livenessCheckInterval(), clock, this::checkLiveness);
    }

    private void checkLiveness() {
        CoreSession session;
        boolean heartbeatDue;
        synchronized (lock) {
            session = current;
            if (state != SupervisorState.LIVE || session == null) {
                return;
            }
            long now = clock.nowNanos();
            long silentNanos = now - session.lastInboundNanos();
            if (silentNanos >= timingPolicy.livenessThreshold().toNanos()) {
                livenessTick = null;
                loseCurrent(session, new TransportException(
                        "nothing heard on session " + session.id() + " for "
                                + Duration.ofNanos(silentNanos).toMillis() + " ms"));
                return;
            }
            heartbeatDue = now - session.lastActivityNanos() >= timingPolicy.heartbeatInterval().toNanos();
            armLivenessTick();
        }

        if (heartbeatDue) {
            try {
                session.sendHeartbeat();
            } catch (TransportException e) {
                sessionLost(session, e);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Loss handling
    // -------------------------------------------------------------------------

    private void sessionLost(CoreSession session, Throwable cause) {
        synchronized (lock) {
            loseCurrent(session, cause);
        }
    }

    // Caller holds lock.
    private void loseCurrent(CoreSession session, Throwable cause) {
        if (session != current || state != SupervisorState.LIVE) {
            return;
        }
        current = null;
        if (livenessTick != null) {
            livenessTick.cancel();
            livenessTick = null;
        }
        session.close();
        enterBackoff(timingPolicy.backoff().delayFor(attempts, jitter), cause);
    }

    // Caller holds lock.
    private void cancelTimers() {
        if (pendingRetry != null) {
            pendingRetry.cancel();
            pendingRetry = null;
        }
        if (livenessTick != null) {
            livenessTick.cancel();
            livenessTick = null;
        }
    }

    // Caller holds lock.
    private void transition(SupervisorState next, Duration backoffDelay, Throwable cause) {
        SupervisorState previous = state;
        state = next;
        observabilitySink.onSupervisorTransition(new SupervisorTransitionEvent(
                wallClock.now(),
                previous,
                next,
                attempts,
                backoffDelay,
                cause
        ));
    }
}
