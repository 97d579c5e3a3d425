package com.questrail.seabird.radio.supervisor;

import com.questrail.seabird.radio.api.CommandSpec;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.observability.RecordingObservabilitySink;
import com.questrail.seabird.radio.observability.SupervisorTransitionEvent;
import com.questrail.seabird.radio.session.AuthException;
import com.questrail.seabird.radio.session.CoreSession;
import com.questrail.seabird.radio.session.FakeCoreStreamConnector;
import com.questrail.seabird.radio.session.FakeCoreStreamConnector.Handshake;
import com.questrail.seabird.radio.session.SessionState;
import com.questrail.seabird.radio.session.TransportException;
import com.questrail.seabird.radio.time.DeterministicScheduler;
import com.questrail.seabird.radio.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReconnectionSupervisorTest
 * -----------------------------------------------------------------------------
 * Drives the supervisor with a manual clock, a deterministic scheduler and a
 * synchronous connect executor, so every transition is observable in order.
 */
class ReconnectionSupervisorTest {

    private static final WallClock WALL = () -> Instant.parse("2026-10-19T12:00:00Z");

    private static final SupervisorTimingPolicy TIMING = new SupervisorTimingPolicy(
            Duration.ofSeconds(1),
            new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(4)),
            Duration.ofSeconds(30),
            Duration.ofSeconds(90),
            Duration.ofSeconds(5)
    );

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeCoreStreamConnector connector;
    private RecordingObservabilitySink sink;
    private RecordingListener listener;
    private AtomicInteger sessionCounter;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        connector = new FakeCoreStreamConnector();
        sink = new RecordingObservabilitySink();
        listener = new RecordingListener();
        sessionCounter = new AtomicInteger();
    }

    private ReconnectionSupervisor supervisor(DoubleSupplier jitter) {
        SessionFactory factory = () -> new CoreSession(
                "s-" + sessionCounter.incrementAndGet(),
                "secret",
                "seabird-radio",
                List.of(new CommandSpec("bands", 0, 0, "bands", "bands")),
                connector,
                clock,
                WALL,
                sink);
        return new ReconnectionSupervisor(
                factory, TIMING, clock, scheduler, WALL, Runnable::run, listener, sink, jitter);
    }

    private ReconnectionSupervisor supervisor() {
        return supervisor(() -> 0.0);
    }

    private List<Duration> backoffDelays() {
        return sink.getSupervisorTransitions().stream()
                .filter(e -> e.newState() == SupervisorState.BACKOFF)
                .map(SupervisorTransitionEvent::backoffDelay)
                .collect(Collectors.toList());
    }

    @Test
    void startGoesLiveAndPublishesSession() {
        ReconnectionSupervisor supervisor = supervisor();

        supervisor.start();

        assertEquals(SupervisorState.LIVE, supervisor.state());
        assertEquals(0, supervisor.attempts());
        assertEquals(1, listener.live.size());
        assertSame(listener.live.get(0), supervisor.currentSession().orElseThrow());
        assertTrue(supervisor.currentSession().orElseThrow().isAuthenticated());
    }

    @Test
    void startTwiceIsRejected() {
        ReconnectionSupervisor supervisor = supervisor();
        supervisor.start();

        assertThrows(IllegalStateException.class, supervisor::start);
    }

    @Test
    void invalidTokenIsFatalAndNeverRetried() {
        connector.script(Handshake.REJECT_INVALID);
        ReconnectionSupervisor supervisor = supervisor();

        supervisor.start();
        scheduler.advance(Duration.ofMinutes(10));

        assertEquals(SupervisorState.FATAL, supervisor.state());
        assertEquals(1, connector.openAttempts());
        assertEquals(1, listener.fatal.size());
        assertTrue(listener.fatal.get(0).isFatal());
        assertTrue(supervisor.currentSession().isEmpty());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void transientFailuresBackOffExponentiallyThenResetOnLive() {
        connector.script(Handshake.REFUSE_OPEN, Handshake.REFUSE_OPEN, Handshake.REJECT_TRANSIENT);
        ReconnectionSupervisor supervisor = supervisor();

        supervisor.start();
        assertEquals(SupervisorState.BACKOFF, supervisor.state());
        assertEquals(1, supervisor.attempts());

        scheduler.advance(Duration.ofMillis(499));
        assertEquals(1, connector.openAttempts());

        scheduler.advance(Duration.ofMillis(1));
        assertEquals(2, connector.openAttempts());
        assertEquals(2, supervisor.attempts());

        scheduler.advance(Duration.ofMillis(1000));
        assertEquals(3, connector.openAttempts());
        assertEquals(SupervisorState.BACKOFF, supervisor.state());

        scheduler.advance(Duration.ofMillis(2000));
        assertEquals(SupervisorState.LIVE, supervisor.state());
        assertEquals(0, supervisor.attempts());

        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000), Duration.ofMillis(2000)),
                backoffDelays());
    }

    @Test
    void backoffNeverExceedsCapPlusJitter() {
        for (int i = 0; i < 10; i++) {
            connector.script(Handshake.REFUSE_OPEN);
        }
        ReconnectionSupervisor supervisor = supervisor(() -> 0.999);

        supervisor.start();
        for (int i = 0; i < 10; i++) {
            scheduler.advance(Duration.ofSeconds(5));
        }

        List<Duration> delays = backoffDelays();
        assertEquals(10, delays.size());
        Duration bound = Duration.ofSeconds(5);
        for (int i = 0; i < delays.size(); i++) {
            assertTrue(delays.get(i).compareTo(bound) <= 0, "delay " + i + " was " + delays.get(i));
            if (i > 0) {
                assertTrue(delays.get(i).compareTo(delays.get(i - 1)) >= 0, "delays must not shrink");
            }
        }
        assertEquals(SupervisorState.LIVE, supervisor.state());
    }

    @Test
    void endedSessionIsReplacedAfterBackoff() {
        ReconnectionSupervisor supervisor = supervisor();
        supervisor.start();
        CoreSession first = supervisor.currentSession().orElseThrow();

        supervisor.onSessionEnded(first, new TransportException("reset"));

        assertEquals(SupervisorState.BACKOFF, supervisor.state());
        assertTrue(supervisor.currentSession().isEmpty());
        assertEquals(SessionState.CLOSED, first.state());

        scheduler.advance(Duration.ofMillis(500));

        assertEquals(SupervisorState.LIVE, supervisor.state());
        CoreSession second = supervisor.currentSession().orElseThrow();
        assertNotSame(first, second);
        assertEquals(0, supervisor.attempts());
        assertEquals(List.of(first, second), listener.live);
    }

    @Test
    void staleSessionEndIsIgnored() {
        ReconnectionSupervisor supervisor = supervisor();
        supervisor.start();
        CoreSession first = supervisor.currentSession().orElseThrow();
        supervisor.onSessionEnded(first, null);
        scheduler.advance(Duration.ofMillis(500));

        supervisor.onSessionEnded(first, null);

        assertEquals(SupervisorState.LIVE, supervisor.state());
        assertEquals(2, connector.openAttempts());
    }

    @Test
    void quietSessionGetsHeartbeats() {
        ReconnectionSupervisor supervisor = supervisor();
        supervisor.start();

        scheduler.advance(Duration.ofSeconds(25));
        assertEquals(0, connector.lastStream().heartbeatCount());

        scheduler.advance(Duration.ofSeconds(5));
        assertEquals(1, connector.lastStream().heartbeatCount());
        assertEquals(SupervisorState.LIVE, supervisor.state());
    }

    @Test
    void silentCoreIsTreatedAsDisconnection() {
        ReconnectionSupervisor supervisor = supervisor();
        supervisor.start();
        CoreSession first = supervisor.currentSession().orElseThrow();

        for (int i = 0; i < 18; i++) {
            scheduler.advance(Duration.ofSeconds(5));
        }

        assertEquals(SessionState.CLOSED, first.state());
        assertEquals(SupervisorState.BACKOFF, supervisor.state());
        assertEquals(2, connector.lastStream().heartbeatCount());

        scheduler.advance(Duration.ofMillis(500));
        assertEquals(2, connector.openAttempts());
        assertEquals(SupervisorState.LIVE, supervisor.state());
    }

    @Test
    void echoedHeartbeatsKeepSessionAlive() {
        ReconnectionSupervisor supervisor = supervisor();
        supervisor.start();
        CoreSession first = supervisor.currentSession().orElseThrow();

        for (int i = 0; i < 60; i++) {
            scheduler.advance(Duration.ofSeconds(5));
            if (connector.lastStream().heartbeatCount() > 0) {
                connector.lastStream().deliverHeartbeat();
            }
        }

        assertSame(first, supervisor.currentSession().orElseThrow());
        assertEquals(1, connector.openAttempts());
    }

    @Test
    void stopClosesSessionAndCancelsTimers() {
        ReconnectionSupervisor supervisor = supervisor();
        supervisor.start();
        CoreSession session = supervisor.currentSession().orElseThrow();

        supervisor.stop();

        assertEquals(SupervisorState.IDLE, supervisor.state());
        assertEquals(SessionState.CLOSED, session.state());
        assertEquals(0, scheduler.pendingCount());
        scheduler.advance(Duration.ofMinutes(5));
        assertEquals(1, connector.openAttempts());
    }

    @Test
    void stopDuringBackoffPreventsRetry() {
        connector.script(Handshake.REFUSE_OPEN);
        ReconnectionSupervisor supervisor = supervisor();
        supervisor.start();

        supervisor.stop();
        scheduler.advance(Duration.ofMinutes(5));

        assertEquals(SupervisorState.IDLE, supervisor.state());
        assertEquals(1, connector.openAttempts());
    }

    private static final class RecordingListener implements SupervisorListener {
        final List<CoreSession> live = new CopyOnWriteArrayList<>();
        final List<AuthException> fatal = new CopyOnWriteArrayList<>();

        @Override
        public void onSessionLive(CoreSession session) {
            live.add(session);
        }

        @Override
        public void onFatal(AuthException cause) {
            fatal.add(cause);
        }
    }
}
