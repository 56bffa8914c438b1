package com.streamfirst.canvas.sync.application;

import java.util.List;

/**
 * Snapshot of the subscription manager's live channels.
 */
public record ConnectionStatus(int activeChannels, List<String> channels) {
    public ConnectionStatus {
        channels = List.copyOf(channels);
    }
}
