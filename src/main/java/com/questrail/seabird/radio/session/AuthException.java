package com.questrail.seabird.radio.session;

import java.util.Objects;

/**
 * The core refused the plugin's credentials during the handshake.
 *
 * <p>{@link Kind#INVALID_CREDENTIAL} means retrying cannot help and the
 * process must stop; {@link Kind#TRANSIENT} means the core could not check the
 * token right now and the normal backoff applies.</p>
 */
public final class AuthException extends Exception
{
    public enum Kind {
        TRANSIENT,
        INVALID_CREDENTIAL
    }

    private final Kind kind;

    public AuthException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFatal() {
        return kind == Kind.INVALID_CREDENTIAL;
    }
}
