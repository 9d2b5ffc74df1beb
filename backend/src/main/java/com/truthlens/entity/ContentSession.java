package com.truthlens.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Monitoring session of a user. There is exactly one row per user; the row
 * is reused across sessions and {@code sessionNumber} identifies the current one.
 *
 * The row doubles as the per-user lock: every session mutation reads it with
 * {@code SELECT ... FOR UPDATE} first.
 */
@Entity
@Table(name = "content_sessions", indexes = {
    @Index(name = "idx_session_state_heartbeat", columnList = "state, last_heartbeat_at")
})
@Data
@NoArgsConstructor
public class ContentSession {

    @Id
    @Column(name = "user_id", updatable = false, nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private SessionState state = SessionState.INACTIVE;

    @Column(name = "session_number", nullable = false)
    private int sessionNumber;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "last_heartbeat_at")
    private Instant lastHeartbeatAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "accumulated_seconds", nullable = false)
    private long accumulatedSeconds;

    @Column(name = "content_count", nullable = false)
    private int contentCount;

    /** Accumulated seconds at the last break reminder of this session. */
    @Column(name = "break_cursor_seconds", nullable = false)
    private long breakCursorSeconds;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public ContentSession(UUID userId) {
        this.userId = userId;
        this.state = SessionState.INACTIVE;
    }

    public boolean isActive() {
        return state == SessionState.ACTIVE;
    }

    /**
     * Begin a fresh session with zeroed counters.
     */
    public void begin(Instant now) {
        this.state = SessionState.ACTIVE;
        this.sessionNumber++;
        this.startedAt = now;
        this.lastHeartbeatAt = now;
        this.endedAt = null;
        this.accumulatedSeconds = 0;
        this.contentCount = 0;
        this.breakCursorSeconds = 0;
    }

    /**
     * Credit one consumption record to the session.
     *
     * @param refreshHeartbeat false for late arrivals on an ended session
     */
    public void recordConsumption(long timeSpentSeconds, Instant now, boolean refreshHeartbeat) {
        this.accumulatedSeconds += timeSpentSeconds;
        this.contentCount++;
        if (refreshHeartbeat) {
            this.lastHeartbeatAt = now;
        }
    }

    public void end(Instant now) {
        this.state = SessionState.ENDED;
        this.endedAt = now;
    }

    /**
     * Whether an update received at {@code now} still belongs to the session
     * that just ended.
     */
    public boolean acceptsLateArrival(Instant now, Duration window) {
        return state == SessionState.ENDED
                && endedAt != null
                && !now.isAfter(endedAt.plus(window));
    }

    public long secondsSinceLastBreak() {
        return accumulatedSeconds - breakCursorSeconds;
    }

    public void markBreakReminded() {
        this.breakCursorSeconds = accumulatedSeconds;
    }
}
