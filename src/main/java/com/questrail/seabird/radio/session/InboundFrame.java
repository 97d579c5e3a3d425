package com.questrail.seabird.radio.session;

import com.questrail.seabird.radio.api.ChannelSource;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * InboundFrame
 * -----------------------------------------------------------------------------
 * Decoded frames the core sends to the plugin. Produced by a wire codec below
 * the {@link CoreStreamConnector} port; the session never sees wire types.
 */
public sealed interface InboundFrame
        permits InboundFrame.Welcome, InboundFrame.Rejected, InboundFrame.Command, InboundFrame.Heartbeat
{
    /** Handshake accepted. */
    record Welcome(String coreSessionId) implements InboundFrame {
        public Welcome {
            Objects.requireNonNull(coreSessionId, "coreSessionId");
        }
    }

    /** Handshake refused. */
    record Rejected(AuthException.Kind kind, String detail) implements InboundFrame {
        public Rejected {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(detail, "detail");
        }
    }

    /** Command invocation, not yet bound to a session. */
    record Command(String correlationId, String command, List<String> args, ChannelSource source)
            implements InboundFrame {
        public Command {
            Objects.requireNonNull(correlationId, "correlationId");
            Objects.requireNonNull(command, "command");
            Objects.requireNonNull(source, "source");
            args = List.copyOf(Objects.requireNonNull(args, "args"));
        }
    }

    /** Keep-alive echo. */
    record Heartbeat(Instant sentAt) implements InboundFrame {
        public Heartbeat {
            Objects.requireNonNull(sentAt, "sentAt");
        }
    }
}
