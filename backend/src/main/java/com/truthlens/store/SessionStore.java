package com.truthlens.store;

import com.truthlens.entity.ContentSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage of per-user session rows.
 */
public interface SessionStore {

    /**
     * Return the user's session row, creating an INACTIVE one if needed, and
     * hold a lock on it until the surrounding transaction ends. All session
     * mutations of a user are serialised through this call.
     */
    ContentSession lockForUpdate(UUID userId);

    Optional<ContentSession> find(UUID userId);

    ContentSession save(ContentSession session);

    List<ContentSession> findActive();

    List<ContentSession> findActiveWithHeartbeatBefore(Instant cutoff);
}
