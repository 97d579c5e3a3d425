package com.questrail.seabird.radio.internal.time;

import java.time.Instant;

/**
 * Wall-clock source for timestamps that leave the process: the emitted-at
 * time on replies, heartbeat payloads and observability events. It MUST NOT
 * drive timeouts or backoff.
 */
public interface WallClock
{
    Instant now();
}
