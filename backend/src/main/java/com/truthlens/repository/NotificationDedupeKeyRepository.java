package com.truthlens.repository;

import com.truthlens.entity.NotificationDedupeKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.UUID;

@Repository
public interface NotificationDedupeKeyRepository extends JpaRepository<NotificationDedupeKey, UUID> {

    boolean existsByUserIdAndCheckKeyAndLocalDate(UUID userId, String checkKey, LocalDate localDate);
}
