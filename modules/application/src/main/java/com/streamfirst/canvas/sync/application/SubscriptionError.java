package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.domain.SyncErrorKind;

/**
 * Reported to a subscriber when its channel is permanently lost or its handler failed.
 *
 * @param channelKey the subscription's channel key
 * @param kind what went wrong
 * @param message human-readable detail
 * @param cause the exception thrown by the handler, or null
 */
public record SubscriptionError(String channelKey, SyncErrorKind kind, String message, Throwable cause) {

    public boolean isTerminal() {
        return kind == SyncErrorKind.CHANNEL_EXHAUSTED;
    }
}
