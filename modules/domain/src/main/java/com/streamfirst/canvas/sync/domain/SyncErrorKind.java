package com.streamfirst.canvas.sync.domain;

/**
 * Classification of everything that can go wrong on the sync path. None of these are fatal to the
 * host application; each degrades to working locally without sync.
 */
public enum SyncErrorKind {
    /** Backend endpoint/key missing or a placeholder, or no owner id. Sync is silently disabled. */
    CONFIGURATION_ABSENT,
    /** The backend has no record for the requested key. Callers treat this as "no remote state yet". */
    NOT_FOUND,
    /** Network blip, timeout or any other backend failure. The next mutation retries. */
    TRANSIENT_BACKEND,
    /** A stored or pushed row could not be decoded into a typed record. */
    MALFORMED_PAYLOAD,
    /** A change-feed channel ran out of reconnect attempts and is permanently closed. */
    CHANNEL_EXHAUSTED
}
