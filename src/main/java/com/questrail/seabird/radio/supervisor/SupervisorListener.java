package com.questrail.seabird.radio.supervisor;

import com.questrail.seabird.radio.session.AuthException;
import com.questrail.seabird.radio.session.CoreSession;

/**
 * Lifecycle callbacks raised by the {@link ReconnectionSupervisor}, outside its
 * internal lock.
 */
public interface SupervisorListener
{
    /**
     * A new session reached LIVE. The listener is expected to start reading
     * from it and to report its end via
     * {@link ReconnectionSupervisor#onSessionEnded(CoreSession, Throwable)}.
     */
    void onSessionLive(CoreSession session);

    /**
     * The core rejected the credentials. The supervisor is FATAL and will not
     * retry; the process should shut down.
     */
    void onFatal(AuthException cause);
}
