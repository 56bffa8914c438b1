package com.streamfirst.canvas.sync.domain;

/**
 * Lifecycle of one change-feed subscription.
 */
public enum SubscriptionStatus {
    /** Created but not yet registered with the backend */
    IDLE,
    /** Channel registered, waiting for the backend acknowledgement */
    SUBSCRIBING,
    /** Acknowledged; row changes are flowing */
    SUBSCRIBED,
    /** Channel failed; a backoff timer will tear it down and open a new one */
    RECONNECTING,
    /** Reconnect attempts used up; the subscriber has been told and nothing else will happen */
    EXHAUSTED,
    /** Explicitly unsubscribed */
    CLOSED;

    public boolean isTerminal() {
        return this == EXHAUSTED || this == CLOSED;
    }
}
