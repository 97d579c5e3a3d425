package com.questrail.seabird.radio.supervisor;

/**
 * States of the {@link ReconnectionSupervisor}.
 *
 * <pre>
 *   IDLE --start--> CONNECTING --welcome--> LIVE
 *                      |   ^                  |
 *        recoverable   |   | delay elapsed    | disconnect / idle timeout
 *                      v   |                  v
 *                     BACKOFF <---------------+
 *
 *   CONNECTING --invalid credentials--> FATAL (terminal)
 * </pre>
 */
public enum SupervisorState {
    IDLE,
    CONNECTING,
    LIVE,
    BACKOFF,
    FATAL
}
