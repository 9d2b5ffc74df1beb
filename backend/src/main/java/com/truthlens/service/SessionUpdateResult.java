package com.truthlens.service;

import com.truthlens.entity.ContentSession;
import com.truthlens.entity.SessionState;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of {@link SessionCoordinator#update}.
 */
@Value
@Builder
public class SessionUpdateResult {

    public enum Outcome {
        /** Applied to the active session. */
        RECORDED,
        /** Applied to a session that had just ended; its state stays ENDED. */
        LATE_ARRIVAL,
        /** No active session existed; a fresh one was started first. */
        STARTED_AND_RECORDED,
        /** Non-positive time; nothing was written. */
        DROPPED
    }

    Outcome outcome;
    UUID recordId;
    SessionState state;
    int sessionNumber;
    long accumulatedSeconds;

    public boolean isRecorded() {
        return outcome != Outcome.DROPPED;
    }

    static SessionUpdateResult dropped() {
        return SessionUpdateResult.builder()
                .outcome(Outcome.DROPPED)
                .build();
    }

    static SessionUpdateResult of(Outcome outcome, UUID recordId, ContentSession session) {
        return SessionUpdateResult.builder()
                .outcome(outcome)
                .recordId(recordId)
                .state(session.getState())
                .sessionNumber(session.getSessionNumber())
                .accumulatedSeconds(session.getAccumulatedSeconds())
                .build();
    }
}
