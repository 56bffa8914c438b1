package com.streamfirst.canvas.sync.application;

import com.streamfirst.canvas.sync.domain.SubscriptionStatus;

/**
 * Returned by {@link ChangeFeedSubscriptionManager#subscribe}; closing it ends the subscription.
 */
public interface SubscriptionHandle extends AutoCloseable {

    String channelKey();

    SubscriptionStatus status();

    /**
     * Unsubscribes. Idempotent, and never affects a newer subscription on the same channel key.
     */
    @Override
    void close();
}
