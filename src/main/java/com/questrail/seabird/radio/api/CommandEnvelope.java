package com.questrail.seabird.radio.api;

import java.util.List;
import java.util.Objects;

/**
 * CommandEnvelope
 * -----------------------------------------------------------------------------
 * One inbound command invocation, immutable once read off the wire.
 *
 * <ul>
 *   <li>{@code correlationId} is supplied by the core and must be echoed on
 *       exactly one {@link ResponseEnvelope}</li>
 *   <li>{@code sessionId} names the session the command arrived on; a reply is
 *       only ever written back onto that same session</li>
 *   <li>{@code args} preserves wire order</li>
 * </ul>
 */
public record CommandEnvelope(
        String correlationId,
        String sessionId,
        String command,
        List<String> args,
        ChannelSource source
) {
    public CommandEnvelope {
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(source, "source");
        args = List.copyOf(Objects.requireNonNull(args, "args"));
    }

    public int argCount() {
        return args.size();
    }

    public String arg(int index) {
        return args.get(index);
    }
}
