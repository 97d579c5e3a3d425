package com.questrail.seabird.radio.api;

/**
 * Raised by a handler when its arguments have the right count but cannot be
 * interpreted (an unknown band, for example). The message is shown to the user.
 */
public final class CommandUsageException extends RuntimeException
{
    public CommandUsageException(String message) {
        super(message);
    }
}
