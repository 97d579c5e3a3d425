package com.questrail.seabird.radio.session;

/**
 * CoreStreamConnector
 * -----------------------------------------------------------------------------
 * Port for opening streams to the core.
 *
 * <p>The wire schema and framing belong entirely to the implementation (gRPC in
 * production, an in-memory fake in tests). Implementations MUST:</p>
 * <ul>
 *   <li>present {@code token} as the bearer credential of the stream</li>
 *   <li>translate wire messages to {@link InboundFrame} and back</li>
 *   <li>not retry, reconnect or time anything out on their own</li>
 * </ul>
 */
public interface CoreStreamConnector
{
    /**
     * Open a new stream.
     *
     * @throws TransportException if the stream cannot be started at all
     */
    CoreStream open(String token, CoreStreamListener listener) throws TransportException;
}
