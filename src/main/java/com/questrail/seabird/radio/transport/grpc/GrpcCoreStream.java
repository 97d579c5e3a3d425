package com.questrail.seabird.radio.transport.grpc;

import com.questrail.seabird.radio.session.AuthException;
import com.questrail.seabird.radio.session.CoreStream;
import com.questrail.seabird.radio.session.CoreStreamListener;
import com.questrail.seabird.radio.session.OutboundFrame;
import com.questrail.seabird.radio.session.TransportException;
import com.questrail.seabird.radio.transport.grpc.proto.CoreFrame;
import com.questrail.seabird.radio.transport.grpc.proto.PluginFrame;
import io.grpc.Status;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * GrpcCoreStream
 * =============================================================================
 * One {@code PluginStream/Connect} call, exposed as a {@link CoreStream}.
 *
 * <p>Inbound messages are decoded by {@link CoreFrameCodec} and forwarded to
 * the {@link CoreStreamListener} on the gRPC callback thread, which delivers
 * them serially. Outbound writes honour gRPC flow control: {@link #send}
 * waits for the call to become ready, up to the write-ready timeout.</p>
 *
 * <h2>Status mapping</h2>
 * UNAUTHENTICATED and PERMISSION_DENIED end the stream with an
 * {@link AuthException} of kind INVALID_CREDENTIAL. Every other status ends
 * it with a {@link TransportException}.
 */
final class GrpcCoreStream implements ClientResponseObserver<PluginFrame, CoreFrame>, CoreStream {

    private static final Logger log = LoggerFactory.getLogger(GrpcCoreStream.class);

    private final CoreStreamListener listener;
    private final Duration writeReadyTimeout;

    private final Object readyLock = new Object();
    private final AtomicBoolean ended = new AtomicBoolean();

    private volatile ClientCallStreamObserver<PluginFrame> requestStream;

    GrpcCoreStream(CoreStreamListener listener, Duration writeReadyTimeout) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.writeReadyTimeout = Objects.requireNonNull(writeReadyTimeout, "writeReadyTimeout");
    }

    // -------------------------------------------------------------------------
    // gRPC callbacks
    // -------------------------------------------------------------------------

    @Override
    public void beforeStart(ClientCallStreamObserver<PluginFrame> requestStream) {
        this.requestStream = requestStream;
        requestStream.setOnReadyHandler(() -> {
            synchronized (readyLock) {
                readyLock.notifyAll();
            }
        });
    }

    @Override
    public void onNext(CoreFrame frame) {
        if (ended.get()) {
            return;
        }
        CoreFrameCodec.decode(frame).ifPresentOrElse(
                listener::onFrame,
                () -> log.debug("Ignoring core frame without payload"));
    }

    @Override
    public void onError(Throwable t) {
        if (ended.compareAndSet(false, true)) {
            wakeWriters();
            listener.onClosed(translate(t));
        }
    }

    @Override
    public void onCompleted() {
        if (ended.compareAndSet(false, true)) {
            wakeWriters();
            listener.onClosed(null);
        }
    }

    // -------------------------------------------------------------------------
    // CoreStream
    // -------------------------------------------------------------------------

    @Override
    public void send(OutboundFrame frame) throws TransportException {
        Objects.requireNonNull(frame, "frame");

        ClientCallStreamObserver<PluginFrame> rs = requestStream;
        if (rs == null) {
            throw new TransportException("core stream has not started");
        }
        awaitReady(rs);

        try {
            rs.onNext(CoreFrameCodec.encode(frame));
        } catch (RuntimeException e) {
            throw new TransportException("write to core stream failed", e);
        }
    }

    @Override
    public void close() {
        // Closed from our side: the session already knows, so no callback.
        if (ended.compareAndSet(false, true)) {
            wakeWriters();
            ClientCallStreamObserver<PluginFrame> rs = requestStream;
            if (rs != null) {
                rs.cancel("closed by plugin", null);
            }
        }
    }

    private void awaitReady(ClientCallStreamObserver<PluginFrame> rs) throws TransportException {
        long deadline = System.nanoTime() + writeReadyTimeout.toNanos();
        synchronized (readyLock) {
            while (!rs.isReady()) {
                if (ended.get()) {
                    throw new TransportException("core stream has ended");
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    throw new TransportException("core stream not writable within "
                            + writeReadyTimeout.toMillis() + " ms");
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(readyLock, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TransportException("interrupted waiting for core stream", e);
                }
            }
        }
        if (ended.get()) {
            throw new TransportException("core stream has ended");
        }
    }

    private void wakeWriters() {
        synchronized (readyLock) {
            readyLock.notifyAll();
        }
    }

    static Throwable translate(Throwable t) {
        Status status = Status.fromThrowable(t);
        switch (status.getCode()) {
            case UNAUTHENTICATED:
            case PERMISSION_DENIED:
                return new AuthException(AuthException.Kind.INVALID_CREDENTIAL,
                        status.getDescription() != null ? status.getDescription() : status.getCode().name());
            default:
                return new TransportException("core stream failed with " + status.getCode()
                        + (status.getDescription() != null ? ": " + status.getDescription() : ""), t);
        }
    }
}
