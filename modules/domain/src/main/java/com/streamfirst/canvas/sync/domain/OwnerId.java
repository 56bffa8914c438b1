package com.streamfirst.canvas.sync.domain;

import java.util.Objects;

/**
 * Identifier of the user whose workspace state is being synchronized. Every remote record and every
 * change-feed filter is scoped to exactly one owner.
 *
 * @param value the owner identifier as issued by the authentication provider
 */
public record OwnerId(String value) {
    public OwnerId {
        Objects.requireNonNull(value, "Owner ID cannot be null");
        if (value.trim().isEmpty()) {
            throw new IllegalArgumentException("Owner ID cannot be empty");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
