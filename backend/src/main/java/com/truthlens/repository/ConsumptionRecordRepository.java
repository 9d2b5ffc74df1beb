package com.truthlens.repository;

import com.truthlens.entity.ConsumptionRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the append-only consumption log.
 */
@Repository
public interface ConsumptionRecordRepository extends JpaRepository<ConsumptionRecord, UUID> {

    /**
     * Records of a user in the half-open window [from, to), oldest first.
     */
    @Query("SELECT r FROM ConsumptionRecord r WHERE r.userId = :userId " +
           "AND r.consumedAt >= :from AND r.consumedAt < :to ORDER BY r.consumedAt ASC")
    List<ConsumptionRecord> findInWindow(@Param("userId") UUID userId,
                                         @Param("from") Instant from,
                                         @Param("to") Instant to);

    /**
     * Scored records of a user in [from, to), newest first.
     */
    @Query("SELECT r FROM ConsumptionRecord r WHERE r.userId = :userId " +
           "AND r.consumedAt >= :from AND r.consumedAt < :to " +
           "AND (r.credibilityScore IS NOT NULL OR r.biasScore IS NOT NULL) ORDER BY r.consumedAt DESC")
    List<ConsumptionRecord> findRecentScoredInWindow(@Param("userId") UUID userId,
                                                     @Param("from") Instant from,
                                                     @Param("to") Instant to,
                                                     Pageable pageable);
}
