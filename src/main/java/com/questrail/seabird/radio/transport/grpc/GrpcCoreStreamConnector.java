package com.questrail.seabird.radio.transport.grpc;

import com.questrail.seabird.radio.session.CoreStream;
import com.questrail.seabird.radio.session.CoreStreamConnector;
import com.questrail.seabird.radio.session.CoreStreamListener;
import com.questrail.seabird.radio.session.TransportException;
import com.questrail.seabird.radio.transport.grpc.proto.PluginStreamGrpc;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.netty.NettyChannelBuilder;
import io.grpc.stub.MetadataUtils;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * GrpcCoreStreamConnector
 * =============================================================================
 * gRPC implementation of the {@link CoreStreamConnector} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT:
 * <ul>
 *   <li>retry or reconnect</li>
 *   <li>interpret commands or responses</li>
 *   <li>time out handshakes or track liveness</li>
 * </ul>
 * Those belong to the session and the supervisor.
 *
 * <h2>Netty containment rule</h2>
 * Netty and gRPC types MUST NOT escape this package. The session layer only
 * sees {@link CoreStream} and the frame types.
 *
 * <h2>Lifecycle</h2>
 * One {@link ManagedChannel} serves every stream this connector opens, so a
 * reconnect reuses the channel's connection management. {@link #close()}
 * shuts the channel down and, when this connector created it, the event loop
 * group.
 */
public final class GrpcCoreStreamConnector implements CoreStreamConnector, AutoCloseable {

    static final Metadata.Key<String> AUTHORIZATION =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);

    static final Duration DEFAULT_WRITE_READY_TIMEOUT = Duration.ofSeconds(10);

    private final ManagedChannel channel;
    private final EventLoopGroup group;
    private final Duration writeReadyTimeout;

    /**
     * Connector over a caller-supplied channel, which it will shut down on
     * {@link #close()}.
     */
    public GrpcCoreStreamConnector(ManagedChannel channel, Duration writeReadyTimeout) {
        this(channel, null, writeReadyTimeout);
    }

    private GrpcCoreStreamConnector(ManagedChannel channel, EventLoopGroup group, Duration writeReadyTimeout) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.group = group;
        this.writeReadyTimeout = Objects.requireNonNull(writeReadyTimeout, "writeReadyTimeout");
    }

    /**
     * Connector for a core URL. {@code http} selects plaintext; any other
     * scheme uses TLS. The port defaults to 80 or 443 accordingly.
     *
     * <p>A dedicated single-threaded {@link NioEventLoopGroup} keeps the
     * adapter self-contained.</p>
     */
    public static GrpcCoreStreamConnector forUri(URI uri) {
        Objects.requireNonNull(uri, "uri");
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("core URL has no host: " + uri);
        }

        boolean plaintext = "http".equals(uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT));
        int port = uri.getPort() != -1 ? uri.getPort() : (plaintext ? 80 : 443);

        EventLoopGroup group = new NioEventLoopGroup(1);
        NettyChannelBuilder builder = NettyChannelBuilder.forAddress(uri.getHost(), port)
                .eventLoopGroup(group)
                .channelType(NioSocketChannel.class);
        if (plaintext) {
            builder.usePlaintext();
        } else {
            builder.useTransportSecurity();
        }

        return new GrpcCoreStreamConnector(builder.build(), group, DEFAULT_WRITE_READY_TIMEOUT);
    }

    @Override
    public CoreStream open(String token, CoreStreamListener listener) throws TransportException {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(listener, "listener");

        if (channel.isShutdown()) {
            throw new TransportException("gRPC channel is shut down");
        }

        Metadata headers = new Metadata();
        headers.put(AUTHORIZATION, "Bearer " + token);

        PluginStreamGrpc.PluginStreamStub stub = PluginStreamGrpc.newStub(channel)
                .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers));

        GrpcCoreStream stream = new GrpcCoreStream(listener, writeReadyTimeout);
        try {
            stub.connect(stream);
        } catch (RuntimeException e) {
            throw new TransportException("could not open core stream", e);
        }
        return stream;
    }

    @Override
    public void close() {
        channel.shutdownNow();
        try {
            channel.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (group != null) {
            group.shutdownGracefully();
        }
    }
}
