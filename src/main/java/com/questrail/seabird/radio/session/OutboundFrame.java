package com.questrail.seabird.radio.session;

import com.questrail.seabird.radio.api.CommandSpec;
import com.questrail.seabird.radio.api.ResponseEnvelope;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Frames the plugin sends to the core.
 */
public sealed interface OutboundFrame
        permits OutboundFrame.Hello, OutboundFrame.Reply, OutboundFrame.Heartbeat
{
    /** First frame on every stream: who we are and which commands we serve. */
    record Hello(String pluginName, List<CommandSpec> commands) implements OutboundFrame {
        public Hello {
            Objects.requireNonNull(pluginName, "pluginName");
            commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
        }
    }

    record Reply(ResponseEnvelope response) implements OutboundFrame {
        public Reply {
            Objects.requireNonNull(response, "response");
        }
    }

    record Heartbeat(Instant sentAt) implements OutboundFrame {
        public Heartbeat {
            Objects.requireNonNull(sentAt, "sentAt");
        }
    }
}
