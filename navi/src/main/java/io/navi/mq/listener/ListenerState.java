package io.navi.mq.listener;

/**
 * Lifecycle states of a {@link NaviListener}.
 *
 * <pre>
 * CREATED → CONNECTING → DECLARING_TOPOLOGY → CONSUMING → STOPPING → STOPPED
 *                 └────────────┴──────────────────┴──→ FAILED
 * </pre>
 */
public enum ListenerState {
    CREATED,
    CONNECTING,
    DECLARING_TOPOLOGY,
    CONSUMING,
    STOPPING,
    STOPPED,
    FAILED;

    /**
     * @return true once the listener has released its connection for good
     */
    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }

    /**
     * @return true for the states in which the listener holds (or is acquiring) a connection
     */
    public boolean isActive() {
        return this == CONNECTING || this == DECLARING_TOPOLOGY || this == CONSUMING;
    }
}
