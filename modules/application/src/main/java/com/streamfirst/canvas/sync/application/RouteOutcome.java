package com.streamfirst.canvas.sync.application;

/**
 * What the router did with one remote change.
 */
public enum RouteOutcome {
    APPLIED,
    /** Written by this device; the local state already has it */
    ECHO_DROPPED,
    MALFORMED_DROPPED,
    /** Deletes and tables the router does not handle */
    IGNORED
}
