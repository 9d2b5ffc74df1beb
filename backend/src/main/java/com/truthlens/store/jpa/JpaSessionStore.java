package com.truthlens.store.jpa;

import com.truthlens.entity.ContentSession;
import com.truthlens.entity.SessionState;
import com.truthlens.repository.ContentSessionRepository;
import com.truthlens.store.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link SessionStore} on PostgreSQL. The lock is an
 * {@code INSERT ... ON CONFLICT DO NOTHING} followed by {@code SELECT ... FOR UPDATE}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaSessionStore implements SessionStore {

    private final ContentSessionRepository repository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public ContentSession lockForUpdate(UUID userId) {
        if (repository.insertIfAbsent(userId) > 0) {
            log.debug("Created session row: userId={}", userId);
        }
        return repository.findForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("Session row missing after insert: " + userId));
    }

    @Override
    public Optional<ContentSession> find(UUID userId) {
        return repository.findById(userId);
    }

    @Override
    public ContentSession save(ContentSession session) {
        return repository.save(session);
    }

    @Override
    public List<ContentSession> findActive() {
        return repository.findByState(SessionState.ACTIVE);
    }

    @Override
    public List<ContentSession> findActiveWithHeartbeatBefore(Instant cutoff) {
        return repository.findActiveWithHeartbeatBefore(cutoff);
    }
}
