package com.questrail.seabird.radio.session;

import com.questrail.seabird.radio.api.ChannelSource;
import com.questrail.seabird.radio.api.ChatUser;
import com.questrail.seabird.radio.api.ResponseEnvelope;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory {@link CoreStreamConnector} for tests.
 *
 * <p>Each {@link #open} consumes the next scripted {@link Handshake}; with an
 * empty script the core welcomes every stream. Tests then play the core's
 * side through the returned {@link FakeCoreStream}.</p>
 */
public final class FakeCoreStreamConnector implements CoreStreamConnector {

    public enum Handshake {
        WELCOME,
        WELCOME_THEN_COMMAND,
        REJECT_INVALID,
        REJECT_TRANSIENT,
        SILENT,
        REFUSE_OPEN
    }

    public static final String EARLY_CORRELATION_ID = "early-1";

    public static final ChannelSource DEFAULT_SOURCE = ChannelSource.of("#radio", new ChatUser("u-1", "alice"));

    private final Deque<Handshake> script = new ArrayDeque<>();
    private final List<FakeCoreStream> streams = new CopyOnWriteArrayList<>();
    private final List<String> tokens = new CopyOnWriteArrayList<>();

    public synchronized FakeCoreStreamConnector script(Handshake... steps) {
        for (Handshake step : steps) {
            script.addLast(step);
        }
        return this;
    }

    @Override
    public CoreStream open(String token, CoreStreamListener listener) throws TransportException {
        Handshake handshake;
        synchronized (this) {
            handshake = script.isEmpty() ? Handshake.WELCOME : script.removeFirst();
        }
        tokens.add(token);
        if (handshake == Handshake.REFUSE_OPEN) {
            throw new TransportException("connection refused");
        }
        FakeCoreStream stream = new FakeCoreStream(listener, handshake, "core-" + (streams.size() + 1));
        streams.add(stream);
        return stream;
    }

    public int openAttempts() {
        return tokens.size();
    }

    public List<String> tokens() {
        return List.copyOf(tokens);
    }

    public List<FakeCoreStream> streams() {
        return List.copyOf(streams);
    }

    public FakeCoreStream lastStream() {
        if (streams.isEmpty()) {
            throw new IllegalStateException("no stream opened yet");
        }
        return streams.get(streams.size() - 1);
    }

    public static final class FakeCoreStream implements CoreStream {
        private final CoreStreamListener listener;
        private final Handshake handshake;
        private final String coreSessionId;
        private final List<OutboundFrame> sent = new CopyOnWriteArrayList<>();
        private volatile boolean closed;
        private volatile boolean failWrites;

        private FakeCoreStream(CoreStreamListener listener, Handshake handshake, String coreSessionId) {
            this.listener = listener;
            this.handshake = handshake;
            this.coreSessionId = coreSessionId;
        }

        @Override
        public void send(OutboundFrame frame) throws TransportException {
            if (closed) {
                throw new TransportException("stream closed");
            }
            if (failWrites) {
                throw new TransportException("write failed");
            }
            sent.add(frame);

            if (frame instanceof OutboundFrame.Hello) {
                switch (handshake) {
                    case WELCOME -> listener.onFrame(new InboundFrame.Welcome(coreSessionId));
                    case WELCOME_THEN_COMMAND -> {
                        // Same callback, as a core flushing queued commands on connect would.
                        listener.onFrame(new InboundFrame.Welcome(coreSessionId));
                        listener.onFrame(new InboundFrame.Command(
                                EARLY_CORRELATION_ID, "bands", List.of(), DEFAULT_SOURCE));
                    }
                    case REJECT_INVALID -> listener.onFrame(
                            new InboundFrame.Rejected(AuthException.Kind.INVALID_CREDENTIAL, "bad token"));
                    case REJECT_TRANSIENT -> listener.onFrame(
                            new InboundFrame.Rejected(AuthException.Kind.TRANSIENT, "auth backend down"));
                    default -> { }
                }
            }
        }

        @Override
        public void close() {
            closed = true;
        }

        // ---------------------------------------------------------------------
        // Core side
        // ---------------------------------------------------------------------

        public void deliverCommand(String correlationId, String command, String... args) {
            deliverCommand(correlationId, command, DEFAULT_SOURCE, args);
        }

        public void deliverCommand(String correlationId, String command, ChannelSource source, String... args) {
            listener.onFrame(new InboundFrame.Command(correlationId, command, List.of(args), source));
        }

        public void deliverHeartbeat() {
            listener.onFrame(new InboundFrame.Heartbeat(Instant.EPOCH));
        }

        public void end(Throwable cause) {
            listener.onClosed(cause);
        }

        public void failWrites(boolean fail) {
            this.failWrites = fail;
        }

        public boolean isClosed() {
            return closed;
        }

        public List<OutboundFrame> sentFrames() {
            return new ArrayList<>(sent);
        }

        public List<ResponseEnvelope> replies() {
            return sent.stream()
                    .filter(f -> f instanceof OutboundFrame.Reply)
                    .map(f -> ((OutboundFrame.Reply) f).response())
                    .collect(Collectors.toList());
        }

        public long heartbeatCount() {
            return sent.stream().filter(f -> f instanceof OutboundFrame.Heartbeat).count();
        }
    }
}
