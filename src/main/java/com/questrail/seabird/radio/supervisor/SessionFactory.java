package com.questrail.seabird.radio.supervisor;

import com.questrail.seabird.radio.session.CoreSession;

/**
 * Creates a fresh, unconnected {@link CoreSession} for each connect attempt.
 */
@FunctionalInterface
public interface SessionFactory
{
    CoreSession newSession();
}
