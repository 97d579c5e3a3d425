package com.questrail.seabird.radio.session;

import com.questrail.seabird.radio.api.CommandEnvelope;
import com.questrail.seabird.radio.api.CommandSpec;
import com.questrail.seabird.radio.api.ResponseEnvelope;
import com.questrail.seabird.radio.internal.time.MonotonicClock;
import com.questrail.seabird.radio.internal.time.WallClock;
import com.questrail.seabird.radio.observability.NullObservabilitySink;
import com.questrail.seabird.radio.observability.RadioObservabilitySink;
import com.questrail.seabird.radio.observability.SessionLifecycleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CoreSession
 * =============================================================================
 * One logical, authenticated connection to the core.
 *
 * <h2>Ownership</h2>
 * A session is created and exclusively owned by the reconnection supervisor.
 * It is single-use: after it reaches {@link SessionState#CLOSED} a new instance
 * is created for the next connection. The router and the emitter only borrow
 * the supervisor's <em>current</em> live session and never keep it across a
 * reconnect.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #connect(Duration)} performs the handshake and distinguishes
 *       credential refusals ({@link AuthException}) from network failures
 *       ({@link TransportException})</li>
 *   <li>{@link #send(ResponseEnvelope)} only succeeds while
 *       {@link SessionState#AUTHENTICATED}; writes are serialized so frames are
 *       never interleaved</li>
 *   <li>{@link #receive()} yields inbound commands in wire order and then
 *       end-of-stream; every command read off the wire is delivered</li>
 *   <li>each correlation id can be answered once, and only if it arrived on
 *       this session</li>
 * </ul>
 *
 * <h2>Liveness</h2>
 * Every frame read and every successful write refreshes
 * {@link #lastActivityNanos()}; only frames read refresh
 * {@link #lastInboundNanos()}. The supervisor sends keep-alives based on the
 * former and declares the connection half-open based on the latter.
 */
public final class CoreSession {

    private static final Logger log = LoggerFactory.getLogger(CoreSession.class);

    private static final Optional<CommandEnvelope> END_OF_STREAM = Optional.empty();

    private final String id;
    private final String token;
    private final String pluginName;
    private final List<CommandSpec> commands;
    private final CoreStreamConnector connector;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final RadioObservabilitySink observabilitySink;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CONNECTING);
    private final BlockingQueue<Optional<CommandEnvelope>> inbound = new LinkedBlockingQueue<>();
    private final Set<String> outstanding = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<String> handshake = new CompletableFuture<>();
    private final Object writeLock = new Object();

    private volatile CoreStream stream;
    private volatile long lastActivityNanos;
    private volatile long lastInboundNanos;
    private volatile String coreSessionId;
    private volatile Throwable closeCause;

    public CoreSession(String id,
                       String token,
                       String pluginName,
                       List<CommandSpec> commands,
                       CoreStreamConnector connector,
                       MonotonicClock clock,
                       WallClock wallClock,
                       RadioObservabilitySink observabilitySink) {
        this.id = Objects.requireNonNull(id, "id");
        this.token = Objects.requireNonNull(token, "token");
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
        this.connector = Objects.requireNonNull(connector, "connector");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.lastActivityNanos = clock.nowNanos();
        this.lastInboundNanos = lastActivityNanos;
    }

    public String id() {
        return id;
    }

    public SessionState state() {
        return state.get();
    }

    public boolean isAuthenticated() {
        return state.get() == SessionState.AUTHENTICATED;
    }

    public long lastActivityNanos() {
        return lastActivityNanos;
    }

    /**
     * Monotonic time of the last frame read from the core.
     */
    public long lastInboundNanos() {
        return lastInboundNanos;
    }

    /**
     * Session id assigned by the core in its welcome, once authenticated.
     */
    public Optional<String> coreSessionId() {
        return Optional.ofNullable(coreSessionId);
    }

    /**
     * Why the stream ended, if it ended abnormally.
     */
    public Optional<Throwable> closeCause() {
        return Optional.ofNullable(closeCause);
    }

    /**
     * Commands received on this session that have not been answered yet.
     */
    public int outstandingCount() {
        return outstanding.size();
    }

    // -------------------------------------------------------------------------
    // Handshake
    // -------------------------------------------------------------------------

    /**
     * Open the stream, introduce the plugin and wait for the core's verdict.
     *
     * <p>On any failure the session is closed before the exception is thrown.</p>
     *
     * @param timeout how long to wait for the welcome
     * @throws AuthException      if the core refused the token
     * @throws TransportException if the stream failed or the welcome did not
     *                            arrive in time
     */
    public void connect(Duration timeout) throws AuthException, TransportException {
        Objects.requireNonNull(timeout, "timeout");
        if (state.get() != SessionState.CONNECTING || stream != null) {
            throw new IllegalStateException("session " + id + " has already been used");
        }

        try {
            stream = connector.open(token, new StreamListener());
            write(new OutboundFrame.Hello(pluginName, commands));

            handshake.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TransportException e) {
            close();
            throw e;
        } catch (ExecutionException e) {
            close();
            Throwable cause = e.getCause();
            if (cause instanceof AuthException auth) {
                throw auth;
            }
            if (cause instanceof TransportException transport) {
                throw transport;
            }
            throw new TransportException("handshake failed", cause);
        } catch (TimeoutException e) {
            close();
            throw new TransportException("no welcome from core within " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            close();
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted during handshake", e);
        }

        if (state.get() != SessionState.AUTHENTICATED) {
            // Stream ended between the welcome and this point.
            close();
            throw new TransportException("session " + id + " closed during handshake");
        }
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Write the answer to a command received on this session.
     *
     * @throws TransportException       if the session is not authenticated or
     *                                  the write fails
     * @throws IllegalArgumentException if the response belongs to another
     *                                  session or its correlation id is not
     *                                  outstanding here
     */
    public void send(ResponseEnvelope response) throws TransportException {
        Objects.requireNonNull(response, "response");

        SessionState current = state.get();
        if (current != SessionState.AUTHENTICATED) {
            throw new TransportException("session " + id + " is " + current);
        }
        if (!id.equals(response.sessionId())) {
            throw new IllegalArgumentException(
                    "response for session " + response.sessionId() + " offered to session " + id);
        }
        if (!outstanding.remove(response.correlationId())) {
            throw new IllegalArgumentException(
                    "no outstanding command " + response.correlationId() + " on session " + id);
        }

        write(new OutboundFrame.Reply(response));
    }

    /**
     * Send a keep-alive. The core echoes it, which refreshes liveness.
     */
    public void sendHeartbeat() throws TransportException {
        SessionState current = state.get();
        if (current != SessionState.AUTHENTICATED) {
            throw new TransportException("session " + id + " is " + current);
        }
        write(new OutboundFrame.Heartbeat(wallClock.now()));
    }

    private void write(OutboundFrame frame) throws TransportException {
        CoreStream s = stream;
        if (s == null) {
            throw new TransportException("session " + id + " has no stream");
        }
        synchronized (writeLock) {
            s.send(frame);
        }
        touch();
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    /**
     * Block until the next inbound command is available.
     *
     * @return the next command, or empty once the stream has ended and every
     *         received command has been handed out; end-of-stream is sticky
     */
    public Optional<CommandEnvelope> receive() throws InterruptedException {
        Optional<CommandEnvelope> next = inbound.take();
        if (next.isEmpty()) {
            inbound.offer(END_OF_STREAM);
        }
        return next;
    }

    // -------------------------------------------------------------------------
    // Teardown
    // -------------------------------------------------------------------------

    /**
     * Stop answering. In-flight commands may still complete, but their
     * responses are refused from here on.
     */
    public void drain() {
        transitionTo(SessionState.DRAINING);
    }

    /**
     * Close the stream and end the inbound sequence. Idempotent.
     */
    public void close() {
        if (transitionTo(SessionState.CLOSED)) {
            CoreStream s = stream;
            if (s != null) {
                s.close();
            }
            inbound.offer(END_OF_STREAM);
            handshake.completeExceptionally(new TransportException("session " + id + " closed"));
        }
    }

    private boolean transitionTo(SessionState next) {
        while (true) {
            SessionState current = state.get();
            if (!current.canTransitionTo(next)) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                observabilitySink.onSessionEvent(new SessionLifecycleEvent(
                        wallClock.now(), id, current, next));
                return true;
            }
        }
    }

    private void touch() {
        lastActivityNanos = clock.nowNanos();
    }

    private void touchInbound() {
        long now = clock.nowNanos();
        lastInboundNanos = now;
        lastActivityNanos = now;
    }

    @Override
    public String toString() {
        return "CoreSession[" + id + ", " + state.get() + "]";
    }

    /**
     * Translates stream callbacks into session state. Callbacks arrive
     * serially from the transport.
     */
    private final class StreamListener implements CoreStreamListener {

        @Override
        public void onFrame(InboundFrame frame) {
            touchInbound();

            if (frame instanceof InboundFrame.Welcome welcome) {
                // Authenticate before the next frame is read: the core may
                // send commands right behind its welcome.
                coreSessionId = welcome.coreSessionId();
                if (transitionTo(SessionState.AUTHENTICATED)) {
                    handshake.complete(welcome.coreSessionId());
                }
            } else if (frame instanceof InboundFrame.Rejected rejected) {
                handshake.completeExceptionally(new AuthException(rejected.kind(), rejected.detail()));
            } else if (frame instanceof InboundFrame.Command command) {
                accept(command);
            }
            // Heartbeat: activity already recorded.
        }

        @Override
        public void onClosed(Throwable cause) {
            closeCause = cause;
            if (cause instanceof AuthException auth) {
                handshake.completeExceptionally(auth);
            } else {
                handshake.completeExceptionally(cause != null
                        ? new TransportException("core stream failed", cause)
                        : new TransportException("core closed the stream"));
            }
            close();
        }

        private void accept(InboundFrame.Command command) {
            SessionState current = state.get();
            if (current == SessionState.CONNECTING) {
                log.warn("Session {}: command {} arrived before the welcome; ignoring",
                        id, command.correlationId());
                return;
            }
            if (current == SessionState.CLOSED) {
                log.warn("Session {}: command {} arrived after close; ignoring",
                        id, command.correlationId());
                return;
            }
            if (!outstanding.add(command.correlationId())) {
                log.warn("Session {}: duplicate correlation id {} from core; ignoring",
                        id, command.correlationId());
                return;
            }
            inbound.offer(Optional.of(new CommandEnvelope(
                    command.correlationId(),
                    id,
                    command.command(),
                    command.args(),
                    command.source()
            )));
        }
    }
}
