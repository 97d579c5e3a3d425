package com.questrail.seabird.radio.transport.grpc;

import com.questrail.seabird.radio.api.ChannelSource;
import com.questrail.seabird.radio.api.ChatUser;
import com.questrail.seabird.radio.api.CommandEnvelope;
import com.questrail.seabird.radio.api.CommandSpec;
import com.questrail.seabird.radio.api.ErrorKind;
import com.questrail.seabird.radio.api.ResponseEnvelope;
import com.questrail.seabird.radio.session.AuthException;
import com.questrail.seabird.radio.session.InboundFrame;
import com.questrail.seabird.radio.session.OutboundFrame;
import com.questrail.seabird.radio.transport.grpc.proto.AuthRejected;
import com.questrail.seabird.radio.transport.grpc.proto.CommandEvent;
import com.questrail.seabird.radio.transport.grpc.proto.CommandReply;
import com.questrail.seabird.radio.transport.grpc.proto.CoreFrame;
import com.questrail.seabird.radio.transport.grpc.proto.Heartbeat;
import com.questrail.seabird.radio.transport.grpc.proto.PluginFrame;
import com.questrail.seabird.radio.transport.grpc.proto.ReplyErrorKind;
import com.questrail.seabird.radio.transport.grpc.proto.User;
import com.questrail.seabird.radio.transport.grpc.proto.Welcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CoreFrameCodecTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private static CoreFrame commandFrame(String arg, boolean withUser) {
        com.questrail.seabird.radio.transport.grpc.proto.ChannelSource.Builder source =
                com.questrail.seabird.radio.transport.grpc.proto.ChannelSource.newBuilder().setChannelId("#radio");
        if (withUser) {
            source.setUser(User.newBuilder().setId("u-1").setDisplayName("alice"));
        }
        return CoreFrame.newBuilder()
                .setCommand(CommandEvent.newBuilder()
                        .setCorrelationId("c-1")
                        .setCommand("pota")
                        .setArg(arg)
                        .setSource(source))
                .build();
    }

    @Test
    void decodesWelcome() {
        CoreFrame frame = CoreFrame.newBuilder().setWelcome(Welcome.newBuilder().setSessionId("core-9")).build();

        assertEquals(Optional.of(new InboundFrame.Welcome("core-9")), CoreFrameCodec.decode(frame));
    }

    @Test
    void decodesCommandWithSplitArguments() {
        InboundFrame.Command command = assertInstanceOf(InboundFrame.Command.class,
                CoreFrameCodec.decode(commandFrame("  20m   ssb ", true)).orElseThrow());

        assertEquals("c-1", command.correlationId());
        assertEquals("pota", command.command());
        assertEquals(List.of("20m", "ssb"), command.args());
        assertEquals(ChannelSource.of("#radio", new ChatUser("u-1", "alice")), command.source());
    }

    @Test
    void blankArgumentAndMissingUser() {
        InboundFrame.Command command = assertInstanceOf(InboundFrame.Command.class,
                CoreFrameCodec.decode(commandFrame("   ", false)).orElseThrow());

        assertEquals(List.of(), command.args());
        assertTrue(command.source().user().isEmpty());
    }

    @Test
    void rejectionReasonsMapToCredentialKinds() {
        assertEquals(AuthException.Kind.INVALID_CREDENTIAL, CoreFrameCodec.kindOf(AuthRejected.Reason.INVALID_TOKEN));
        assertEquals(AuthException.Kind.INVALID_CREDENTIAL, CoreFrameCodec.kindOf(AuthRejected.Reason.REVOKED_TOKEN));
        assertEquals(AuthException.Kind.TRANSIENT,
                CoreFrameCodec.kindOf(AuthRejected.Reason.TEMPORARILY_UNAVAILABLE));
        assertEquals(AuthException.Kind.TRANSIENT, CoreFrameCodec.kindOf(AuthRejected.Reason.REASON_UNSPECIFIED));

        CoreFrame frame = CoreFrame.newBuilder()
                .setRejected(AuthRejected.newBuilder()
                        .setReason(AuthRejected.Reason.INVALID_TOKEN)
                        .setDetail("unknown token"))
                .build();
        assertEquals(Optional.of(new InboundFrame.Rejected(AuthException.Kind.INVALID_CREDENTIAL, "unknown token")),
                CoreFrameCodec.decode(frame));
    }

    @Test
    void emptyFrameDecodesToNothing() {
        assertTrue(CoreFrameCodec.decode(CoreFrame.getDefaultInstance()).isEmpty());
    }

    @Test
    void heartbeatKeepsItsTimestamp() {
        CoreFrame frame = CoreFrame.newBuilder()
                .setHeartbeat(Heartbeat.newBuilder().setSentAtMillis(NOW.toEpochMilli()))
                .build();

        assertEquals(Optional.of(new InboundFrame.Heartbeat(NOW)), CoreFrameCodec.decode(frame));
    }

    @Test
    void encodesHelloWithCommandMetadata() {
        PluginFrame frame = CoreFrameCodec.encode(new OutboundFrame.Hello("seabird-radio", List.of(
                new CommandSpec("bands", 0, 0, "show bands", "show HAM RF band conditions"))));

        assertEquals("seabird-radio", frame.getHello().getPluginName());
        assertEquals("show HAM RF band conditions", frame.getHello().getCommandsOrThrow("bands").getFullHelp());
    }

    @Test
    void encodesSuccessAndFailureReplies() {
        CommandEnvelope command = new CommandEnvelope("c-1", "session-1", "bands", List.of(),
                ChannelSource.of("#radio", null));

        CommandReply ok = CoreFrameCodec.encode(new OutboundFrame.Reply(
                ResponseEnvelope.success(command, List.of("line 1", "line 2"), NOW))).getReply();
        assertEquals("c-1", ok.getCorrelationId());
        assertEquals("#radio", ok.getChannelId());
        assertEquals(List.of("line 1", "line 2"), ok.getText().getLinesList());
        assertEquals(NOW.toEpochMilli(), ok.getEmittedAtMillis());

        CommandReply failed = CoreFrameCodec.encode(new OutboundFrame.Reply(
                ResponseEnvelope.failure(command, ErrorKind.RATE_LIMITED, "try later", NOW))).getReply();
        assertEquals(CommandReply.ResultCase.ERROR, failed.getResultCase());
        assertEquals(ReplyErrorKind.RATE_LIMITED, failed.getError().getKind());
        assertEquals("try later", failed.getError().getMessage());
    }

    @Test
    void everyErrorKindHasAWireKind() {
        for (ErrorKind kind : ErrorKind.values()) {
            assertEquals(kind.name(), CoreFrameCodec.wireKind(kind).name());
        }
    }
}
