package com.questrail.seabird.radio.session;

/**
 * CoreStreamListener
 * -----------------------------------------------------------------------------
 * Callback sink for a {@link CoreStream}.
 *
 * <p>Implementations of the port must deliver callbacks serially, in wire
 * order. {@link #onClosed(Throwable)} is delivered at most once and no frame
 * follows it.</p>
 */
public interface CoreStreamListener
{
    /**
     * Called for every decoded frame, in the order it was read.
     */
    void onFrame(InboundFrame frame);

    /**
     * Called when the stream ends.
     *
     * @param cause {@code null} when the core completed the stream normally;
     *              an {@link AuthException} when the core refused credentials
     *              at the transport level; otherwise the transport failure
     */
    void onClosed(Throwable cause);
}
