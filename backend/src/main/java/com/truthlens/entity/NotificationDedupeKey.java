package com.truthlens.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Marks that the check {@code checkKey} already notified a user on a local date.
 *
 * Written alongside the notification and never deleted with it. Indexed but
 * not unique: emission is check-then-insert.
 */
@Entity
@Table(name = "notification_dedupe_keys", indexes = {
    @Index(name = "idx_dedupe_user_key_date", columnList = "user_id, check_key, local_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NotificationDedupeKey {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "check_key", nullable = false, length = 120)
    private String checkKey;

    @Column(name = "local_date", nullable = false)
    private LocalDate localDate;

    @Column(name = "notification_id")
    private UUID notificationId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public NotificationDedupeKey(UUID userId, String checkKey, LocalDate localDate, UUID notificationId) {
        this.userId = userId;
        this.checkKey = checkKey;
        this.localDate = localDate;
        this.notificationId = notificationId;
    }
}
