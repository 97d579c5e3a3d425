package com.questrail.seabird.radio.router;

/**
 * Two handlers were registered under the same command name. Raised while the
 * registry is built, so it aborts startup.
 */
public final class DuplicateCommandException extends RuntimeException
{
    private final String commandName;

    public DuplicateCommandException(String commandName) {
        super("command already registered: " + commandName);
        this.commandName = commandName;
    }

    public String commandName() {
        return commandName;
    }
}
