package com.truthlens.repository;

import com.truthlens.entity.Notification;
import com.truthlens.entity.NotificationType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for user notifications.
 *
 * "Visible" means not expired at the given instant.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    @Query("SELECT n FROM Notification n WHERE n.userId = :userId " +
           "AND (n.expiresAt IS NULL OR n.expiresAt > :now) " +
           "AND (:unreadOnly = false OR n.read = false) " +
           "AND (:type IS NULL OR n.type = :type)")
    Page<Notification> findVisible(@Param("userId") UUID userId,
                                   @Param("unreadOnly") boolean unreadOnly,
                                   @Param("type") NotificationType type,
                                   @Param("now") Instant now,
                                   Pageable pageable);

    @Query("SELECT COUNT(n) FROM Notification n WHERE n.userId = :userId AND n.read = false " +
           "AND (n.expiresAt IS NULL OR n.expiresAt > :now)")
    long countUnread(@Param("userId") UUID userId, @Param("now") Instant now);

    Optional<Notification> findByIdAndUserId(UUID id, UUID userId);

    @Modifying
    @Query("UPDATE Notification n SET n.read = true, n.updatedAt = :now " +
           "WHERE n.userId = :userId AND n.id IN :ids AND n.read = false")
    int markRead(@Param("userId") UUID userId, @Param("ids") Collection<UUID> ids, @Param("now") Instant now);

    @Modifying
    @Query("UPDATE Notification n SET n.read = true, n.updatedAt = :now WHERE n.userId = :userId AND n.read = false")
    int markAllRead(@Param("userId") UUID userId, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM Notification n WHERE n.expiresAt IS NOT NULL AND n.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
