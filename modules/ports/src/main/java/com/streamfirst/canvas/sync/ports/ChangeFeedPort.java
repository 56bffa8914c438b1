package com.streamfirst.canvas.sync.ports;

import com.streamfirst.canvas.sync.domain.ChangeEvent;

import java.util.function.Consumer;

/**
 * Port for the backend's publish/subscribe change feed. A channel delivers row changes for one
 * table, filtered by column equality, and reports its connection status separately.
 */
public interface ChangeFeedPort {

    /**
     * Connection states reported by a channel.
     */
    enum ChannelStatus {
        /** The backend acknowledged the channel */
        SUBSCRIBED,
        /** The channel failed and will not deliver further events */
        CHANNEL_ERROR,
        /** The backend did not acknowledge in time */
        TIMED_OUT,
        /** The channel was closed, by either side */
        CLOSED
    }

    /**
     * Registers a channel. Status and row callbacks may arrive on any thread and may arrive before
     * this method returns.
     *
     * @param request the channel name, table and filter
     * @param onChange receives each matching row change
     * @param onStatus receives status transitions, starting with SUBSCRIBED or an error
     * @return a handle used to remove the channel
     */
    ChannelHandle open(ChannelRequest request, Consumer<ChangeEvent> onChange, Consumer<ChannelStatus> onStatus);

    /**
     * A registered channel.
     */
    interface ChannelHandle {

        String channelName();

        /**
         * Removes the channel from the backend. Safe to call more than once.
         */
        void close();
    }
}
