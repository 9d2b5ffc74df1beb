package com.truthlens.entity;

/**
 * Lifecycle state of a user's monitoring session.
 */
public enum SessionState {
    /** No session has been started yet. */
    INACTIVE,
    ACTIVE,
    /** Closed; never reopened. A new start begins a fresh accumulator. */
    ENDED
}
