package com.questrail.seabird.radio.session;

/**
 * One open bidirectional stream to the core, as returned by
 * {@link CoreStreamConnector#open(String, CoreStreamListener)}.
 *
 * <p>{@link #send(OutboundFrame)} is not required to be thread-safe; the
 * owning {@link CoreSession} serializes writes.</p>
 */
public interface CoreStream
{
    /**
     * Write one frame. May wait for transport flow control.
     */
    void send(OutboundFrame frame) throws TransportException;

    /**
     * Tear the stream down. Idempotent.
     */
    void close();
}
