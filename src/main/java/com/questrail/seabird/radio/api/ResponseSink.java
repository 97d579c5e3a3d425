package com.questrail.seabird.radio.api;

/**
 * Destination for completed responses. The router depends on this seam only;
 * the production implementation writes onto the current live session.
 */
@FunctionalInterface
public interface ResponseSink
{
    void emit(ResponseEnvelope response);
}
