package com.questrail.seabird.radio.session;

import com.questrail.seabird.radio.api.CommandEnvelope;
import com.questrail.seabird.radio.api.CommandSpec;
import com.questrail.seabird.radio.api.ResponseEnvelope;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.observability.RecordingObservabilitySink;
import com.questrail.seabird.radio.observability.SessionLifecycleEvent;
import com.questrail.seabird.radio.session.FakeCoreStreamConnector.FakeCoreStream;
import com.questrail.seabird.radio.session.FakeCoreStreamConnector.Handshake;
import com.questrail.seabird.radio.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CoreSessionTest
 * -----------------------------------------------------------------------------
 * Handshake outcomes, inbound ordering, reply bookkeeping and teardown of a
 * single session against the in-memory connector.
 */
class CoreSessionTest {

    private static final Duration HANDSHAKE = Duration.ofSeconds(1);
    private static final WallClock WALL = () -> Instant.parse("2026-10-19T12:00:00Z");
    private static final List<CommandSpec> COMMANDS = List.of(
            new CommandSpec("bands", 0, 0, "show bands", "show HAM RF band conditions"));

    private FakeCoreStreamConnector connector;
    private ManualMonotonicClock clock;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        connector = new FakeCoreStreamConnector();
        clock = new ManualMonotonicClock();
        sink = new RecordingObservabilitySink();
    }

    private CoreSession newSession() {
        return new CoreSession("s-1", "secret", "seabird-radio", COMMANDS, connector, clock, WALL, sink);
    }

    private CoreSession connected() throws Exception {
        CoreSession session = newSession();
        session.connect(HANDSHAKE);
        return session;
    }

    @Test
    void welcomeAuthenticatesAndHelloAdvertisesCommands() throws Exception {
        CoreSession session = connected();

        assertEquals(SessionState.AUTHENTICATED, session.state());
        assertEquals(Optional.of("core-1"), session.coreSessionId());
        assertEquals(List.of("secret"), connector.tokens());

        OutboundFrame first = connector.lastStream().sentFrames().get(0);
        OutboundFrame.Hello hello = assertInstanceOf(OutboundFrame.Hello.class, first);
        assertEquals("seabird-radio", hello.pluginName());
        assertEquals(COMMANDS, hello.commands());
    }

    @Test
    void invalidCredentialRejectionIsFatalAndClosesSession() {
        connector.script(Handshake.REJECT_INVALID);
        CoreSession session = newSession();

        AuthException e = assertThrows(AuthException.class, () -> session.connect(HANDSHAKE));

        assertTrue(e.isFatal());
        assertEquals(SessionState.CLOSED, session.state());
        assertTrue(connector.lastStream().isClosed());
    }

    @Test
    void transientRejectionIsNotFatal() {
        connector.script(Handshake.REJECT_TRANSIENT);
        CoreSession session = newSession();

        AuthException e = assertThrows(AuthException.class, () -> session.connect(HANDSHAKE));

        assertFalse(e.isFatal());
    }

    @Test
    void refusedOpenIsTransportFailure() {
        connector.script(Handshake.REFUSE_OPEN);
        CoreSession session = newSession();

        assertThrows(TransportException.class, () -> session.connect(HANDSHAKE));
        assertEquals(SessionState.CLOSED, session.state());
    }

    @Test
    void missingWelcomeTimesOutAsTransportFailure() {
        connector.script(Handshake.SILENT);
        CoreSession session = newSession();

        assertThrows(TransportException.class, () -> session.connect(Duration.ofMillis(50)));
        assertEquals(SessionState.CLOSED, session.state());
    }

    @Test
    void sessionCannotBeConnectedTwice() throws Exception {
        CoreSession session = connected();

        assertThrows(IllegalStateException.class, () -> session.connect(HANDSHAKE));
    }

    @Test
    void commandRightBehindTheWelcomeIsDelivered() throws Exception {
        connector.script(Handshake.WELCOME_THEN_COMMAND);
        CoreSession session = connected();

        assertEquals(1, session.outstandingCount());

        CommandEnvelope early = session.receive().orElseThrow();
        assertEquals(FakeCoreStreamConnector.EARLY_CORRELATION_ID, early.correlationId());
        assertEquals("s-1", early.sessionId());

        session.send(ResponseEnvelope.success(early, List.of("ok"), WALL.now()));
        assertEquals(1, connector.lastStream().replies().size());
    }

    @Test
    void commandsAreReceivedInWireOrderThenEndOfStreamIsSticky() throws Exception {
        CoreSession session = connected();
        FakeCoreStream stream = connector.lastStream();

        stream.deliverCommand("c-1", "bands");
        stream.deliverCommand("c-2", "pota", "20m", "cw");
        stream.end(null);

        CommandEnvelope first = session.receive().orElseThrow();
        CommandEnvelope second = session.receive().orElseThrow();
        assertEquals("c-1", first.correlationId());
        assertEquals("s-1", first.sessionId());
        assertEquals("c-2", second.correlationId());
        assertEquals(List.of("20m", "cw"), second.args());

        assertTrue(session.receive().isEmpty());
        assertTrue(session.receive().isEmpty());
        assertEquals(SessionState.CLOSED, session.state());
    }

    @Test
    void duplicateCorrelationIdIsDeliveredOnce() throws Exception {
        CoreSession session = connected();
        FakeCoreStream stream = connector.lastStream();

        stream.deliverCommand("c-1", "bands");
        stream.deliverCommand("c-1", "bands");
        stream.end(null);

        assertTrue(session.receive().isPresent());
        assertTrue(session.receive().isEmpty());
    }

    @Test
    void replyIsWrittenOnceForAnOutstandingCommand() throws Exception {
        CoreSession session = connected();
        FakeCoreStream stream = connector.lastStream();
        stream.deliverCommand("c-1", "bands");
        CommandEnvelope command = session.receive().orElseThrow();

        ResponseEnvelope reply = ResponseEnvelope.success(command, List.of("ok"), WALL.now());
        session.send(reply);

        assertEquals(List.of(reply), stream.replies());
        assertEquals(0, session.outstandingCount());
        assertThrows(IllegalArgumentException.class, () -> session.send(reply));
    }

    @Test
    void replyForAnotherSessionIsRefused() throws Exception {
        CoreSession session = connected();
        connector.lastStream().deliverCommand("c-1", "bands");
        CommandEnvelope command = session.receive().orElseThrow();

        ResponseEnvelope foreign = new ResponseEnvelope(
                command.correlationId(), "s-other", "#radio",
                ResponseEnvelope.success(command, List.of("x"), WALL.now()).payload(), WALL.now());

        assertThrows(IllegalArgumentException.class, () -> session.send(foreign));
    }

    @Test
    void drainingSessionRefusesReplies() throws Exception {
        CoreSession session = connected();
        connector.lastStream().deliverCommand("c-1", "bands");
        CommandEnvelope command = session.receive().orElseThrow();

        session.drain();

        assertEquals(SessionState.DRAINING, session.state());
        assertThrows(TransportException.class,
                () -> session.send(ResponseEnvelope.success(command, List.of("late"), WALL.now())));
    }

    @Test
    void inboundFramesRefreshActivity() throws Exception {
        CoreSession session = connected();
        clock.advanceMillis(5_000);

        connector.lastStream().deliverHeartbeat();

        assertEquals(clock.nowNanos(), session.lastActivityNanos());
    }

    @Test
    void abnormalStreamEndIsRecordedAsCloseCause() throws Exception {
        CoreSession session = connected();
        TransportException cause = new TransportException("reset by peer");

        connector.lastStream().end(cause);

        assertEquals(SessionState.CLOSED, session.state());
        assertSame(cause, session.closeCause().orElseThrow());
        assertTrue(session.receive().isEmpty());
    }

    @Test
    void closeIsIdempotentAndReportsLifecycle() throws Exception {
        CoreSession session = connected();

        session.close();
        session.close();

        List<SessionLifecycleEvent> events = sink.eventsOfType(SessionLifecycleEvent.class);
        assertEquals(2, events.size());
        assertEquals(SessionState.AUTHENTICATED, events.get(0).newState());
        assertEquals(SessionState.CLOSED, events.get(1).newState());
        assertTrue(connector.lastStream().isClosed());
    }
}
