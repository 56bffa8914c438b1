package com.streamfirst.canvas.sync.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * What a subscriber wants to observe: one channel, filtered to one owner and optionally to one
 * sub-resource (a presentation, a scene, a conversation).
 *
 * @param name the channel, which determines the table
 * @param ownerId owner filter, may be null for channels that are not owner-scoped
 * @param additionalId sub-resource id, may be null
 */
public record ChannelSpec(ChannelName name, OwnerId ownerId, String additionalId) {
    public ChannelSpec {
        Objects.requireNonNull(name, "Channel name cannot be null");
        if (additionalId != null && additionalId.isBlank()) {
            additionalId = null;
        }
    }

    public static ChannelSpec forOwner(ChannelName name, OwnerId ownerId) {
        return new ChannelSpec(name, ownerId, null);
    }

    /**
     * Key under which the subscription is tracked and the channel is named on the backend:
     * {@code name[:owner][:additionalId]}.
     */
    public String channelKey() {
        StringBuilder key = new StringBuilder(name.wireName());
        if (ownerId != null) {
            key.append(':').append(ownerId.value());
        }
        if (additionalId != null) {
            key.append(':').append(additionalId);
        }
        return key.toString();
    }

    public String tableName() {
        return name.tableName();
    }

    public Optional<OwnerId> owner() {
        return Optional.ofNullable(ownerId);
    }

    public Optional<String> subResourceId() {
        return Optional.ofNullable(additionalId);
    }

    @Override
    public String toString() {
        return channelKey();
    }
}
