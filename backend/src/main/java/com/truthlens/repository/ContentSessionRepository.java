package com.truthlens.repository;

import com.truthlens.entity.ContentSession;
import com.truthlens.entity.SessionState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for per-user session rows.
 */
@Repository
public interface ContentSessionRepository extends JpaRepository<ContentSession, UUID> {

    /**
     * Create the user's INACTIVE session row unless it exists. Concurrent
     * first requests race on the primary key, not on application code.
     *
     * @return 1 when a row was inserted, 0 otherwise
     */
    @Modifying
    @Query(value = "INSERT INTO content_sessions " +
                   "(user_id, state, session_number, accumulated_seconds, content_count, break_cursor_seconds, updated_at) " +
                   "VALUES (:userId, 'INACTIVE', 0, 0, 0, 0, now()) ON CONFLICT (user_id) DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("userId") UUID userId);

    /**
     * Read the user's session row with a row lock held until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ContentSession s WHERE s.userId = :userId")
    Optional<ContentSession> findForUpdate(@Param("userId") UUID userId);

    List<ContentSession> findByState(SessionState state);

    @Query("SELECT s FROM ContentSession s WHERE s.state = 'ACTIVE' AND s.lastHeartbeatAt < :cutoff")
    List<ContentSession> findActiveWithHeartbeatBefore(@Param("cutoff") Instant cutoff);
}
