package com.questrail.seabird.radio.api;

import java.util.Objects;

/**
 * CommandSpec
 * -----------------------------------------------------------------------------
 * Static description of a registered command: its unique name, the accepted
 * argument count range, and the help text advertised to the core during the
 * handshake.
 */
public record CommandSpec(
        String name,
        int minArgs,
        int maxArgs,
        String shortHelp,
        String fullHelp
) {
    public CommandSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(shortHelp, "shortHelp");
        Objects.requireNonNull(fullHelp, "fullHelp");

        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (minArgs < 0) {
            throw new IllegalArgumentException("minArgs must be >= 0");
        }
        if (maxArgs < minArgs) {
            throw new IllegalArgumentException("maxArgs must be >= minArgs");
        }
    }

    public boolean acceptsArgCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }
}
