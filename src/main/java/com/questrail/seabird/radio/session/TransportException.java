package com.questrail.seabird.radio.session;

/**
 * The stream to the core could not be opened, broke, or is not in a state
 * that allows the requested operation. Always recoverable by reconnecting.
 */
public final class TransportException extends Exception
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
