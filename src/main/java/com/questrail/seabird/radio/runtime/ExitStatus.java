package com.questrail.seabird.radio.runtime;

/**
 * Process exit codes.
 */
public enum ExitStatus {
    /** Orderly shutdown. */
    OK(0),
    /** Unexpected failure. */
    CRASH(1),
    /** The core rejected the token; restarting will not help. */
    INVALID_CREDENTIALS(77),
    /** The environment does not describe a usable configuration. */
    CONFIG_ERROR(78);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
