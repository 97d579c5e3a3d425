package com.questrail.seabird.radio.transport.grpc;

import com.questrail.seabird.radio.api.ChannelSource;
import com.questrail.seabird.radio.api.ChatUser;
import com.questrail.seabird.radio.api.CommandSpec;
import com.questrail.seabird.radio.api.ErrorKind;
import com.questrail.seabird.radio.api.ResponseEnvelope;
import com.questrail.seabird.radio.api.ResponsePayload;
import com.questrail.seabird.radio.session.AuthException;
import com.questrail.seabird.radio.session.InboundFrame;
import com.questrail.seabird.radio.session.OutboundFrame;
import com.questrail.seabird.radio.transport.grpc.proto.AuthRejected;
import com.questrail.seabird.radio.transport.grpc.proto.CommandEvent;
import com.questrail.seabird.radio.transport.grpc.proto.CommandMetadata;
import com.questrail.seabird.radio.transport.grpc.proto.CommandReply;
import com.questrail.seabird.radio.transport.grpc.proto.CoreFrame;
import com.questrail.seabird.radio.transport.grpc.proto.Heartbeat;
import com.questrail.seabird.radio.transport.grpc.proto.Hello;
import com.questrail.seabird.radio.transport.grpc.proto.PluginFrame;
import com.questrail.seabird.radio.transport.grpc.proto.ReplyError;
import com.questrail.seabird.radio.transport.grpc.proto.ReplyErrorKind;
import com.questrail.seabird.radio.transport.grpc.proto.ReplyText;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * CoreFrameCodec
 * =============================================================================
 * Maps between the protobuf wire messages and the session's frame types.
 *
 * <p>This is the only place that knows the wire schema. Stateless.</p>
 *
 * <h2>Decoding rules</h2>
 * <ul>
 *   <li>the command argument string is split on runs of whitespace; a blank
 *       string yields no arguments</li>
 *   <li>a missing user on the channel source is preserved as absent</li>
 *   <li>INVALID_TOKEN and REVOKED_TOKEN rejections are invalid credentials;
 *       any other reason is transient</li>
 *   <li>a frame with no payload set decodes to nothing</li>
 * </ul>
 */
public final class CoreFrameCodec {

    private CoreFrameCodec() {}

    public static Optional<InboundFrame> decode(CoreFrame frame) {
        switch (frame.getInnerCase()) {
            case WELCOME:
                return Optional.of(new InboundFrame.Welcome(frame.getWelcome().getSessionId()));
            case REJECTED:
                AuthRejected rejected = frame.getRejected();
                return Optional.of(new InboundFrame.Rejected(kindOf(rejected.getReason()), rejected.getDetail()));
            case COMMAND:
                return Optional.of(decodeCommand(frame.getCommand()));
            case HEARTBEAT:
                return Optional.of(new InboundFrame.Heartbeat(
                        Instant.ofEpochMilli(frame.getHeartbeat().getSentAtMillis())));
            case INNER_NOT_SET:
            default:
                return Optional.empty();
        }
    }

    public static PluginFrame encode(OutboundFrame frame) {
        if (frame instanceof OutboundFrame.Hello hello) {
            return PluginFrame.newBuilder().setHello(encodeHello(hello)).build();
        }
        if (frame instanceof OutboundFrame.Reply reply) {
            return PluginFrame.newBuilder().setReply(encodeReply(reply.response())).build();
        }
        if (frame instanceof OutboundFrame.Heartbeat heartbeat) {
            return PluginFrame.newBuilder()
                    .setHeartbeat(Heartbeat.newBuilder().setSentAtMillis(heartbeat.sentAt().toEpochMilli()))
                    .build();
        }
        throw new IllegalArgumentException("unsupported frame: " + frame);
    }

    static List<String> splitArgs(String arg) {
        String trimmed = arg.strip();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return List.of(trimmed.split("\\s+"));
    }

    static AuthException.Kind kindOf(AuthRejected.Reason reason) {
        switch (reason) {
            case INVALID_TOKEN:
            case REVOKED_TOKEN:
                return AuthException.Kind.INVALID_CREDENTIAL;
            default:
                return AuthException.Kind.TRANSIENT;
        }
    }

    static ReplyErrorKind wireKind(ErrorKind kind) {
        switch (kind) {
            case UNKNOWN_COMMAND:
                return ReplyErrorKind.UNKNOWN_COMMAND;
            case BAD_ARGUMENTS:
                return ReplyErrorKind.BAD_ARGUMENTS;
            case RATE_LIMITED:
                return ReplyErrorKind.RATE_LIMITED;
            case UPSTREAM_UNAVAILABLE:
                return ReplyErrorKind.UPSTREAM_UNAVAILABLE;
            case TIMEOUT:
                return ReplyErrorKind.TIMEOUT;
            case INTERNAL:
            default:
                return ReplyErrorKind.INTERNAL;
        }
    }

    private static InboundFrame.Command decodeCommand(CommandEvent event) {
        ChatUser user = null;
        if (event.getSource().hasUser()) {
            user = new ChatUser(
                    event.getSource().getUser().getId(),
                    event.getSource().getUser().getDisplayName());
        }
        ChannelSource source = ChannelSource.of(event.getSource().getChannelId(), user);
        return new InboundFrame.Command(
                event.getCorrelationId(),
                event.getCommand(),
                splitArgs(event.getArg()),
                source
        );
    }

    private static Hello encodeHello(OutboundFrame.Hello hello) {
        Hello.Builder builder = Hello.newBuilder().setPluginName(hello.pluginName());
        for (CommandSpec spec : hello.commands()) {
            builder.putCommands(spec.name(), CommandMetadata.newBuilder()
                    .setName(spec.name())
                    .setShortHelp(spec.shortHelp())
                    .setFullHelp(spec.fullHelp())
                    .build());
        }
        return builder.build();
    }

    private static CommandReply encodeReply(ResponseEnvelope response) {
        CommandReply.Builder builder = CommandReply.newBuilder()
                .setCorrelationId(response.correlationId())
                .setChannelId(response.channelId())
                .setEmittedAtMillis(response.emittedAt().toEpochMilli());

        ResponsePayload payload = response.payload();
        if (payload instanceof ResponsePayload.Success success) {
            builder.setText(ReplyText.newBuilder().addAllLines(success.lines()));
        } else if (payload instanceof ResponsePayload.Failure failure) {
            builder.setError(ReplyError.newBuilder()
                    .setKind(wireKind(failure.kind()))
                    .setMessage(failure.message()));
        }
        return builder.build();
    }
}
