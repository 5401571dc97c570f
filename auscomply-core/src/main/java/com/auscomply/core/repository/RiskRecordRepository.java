package com.auscomply.core.repository;

import com.auscomply.core.domain.RiskRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for AML risk records.
 * Regulator submission flags are only changed through the conditional updates below.
 */
@Repository
public interface RiskRecordRepository extends JpaRepository<RiskRecord, UUID> {

    Optional<RiskRecord> findByTransactionId(String transactionId);

    boolean existsByTransactionId(String transactionId);

    /**
     * The user's transactions inside a rolling window, oldest first.
     */
    @Query("SELECT r FROM RiskRecord r WHERE r.userId = :userId " +
           "AND r.transactionDate >= :from AND r.transactionDate <= :to ORDER BY r.transactionDate ASC")
    List<RiskRecord> findUserHistory(
            @Param("userId") String userId,
            @Param("from") Instant from,
            @Param("to") Instant to);

    /**
     * Alerts awaiting analyst review, highest score first.
     */
    @Query("SELECT r FROM RiskRecord r WHERE r.requiresReview = true AND r.reviewedAt IS NULL " +
           "AND r.falsePositive = false ORDER BY r.riskScore DESC, r.createdAt ASC")
    List<RiskRecord> findPendingAlerts(Pageable pageable);

    @Query("SELECT r FROM RiskRecord r WHERE r.queuedForReport = true AND r.reportedToRegulator = false " +
           "AND r.falsePositive = false AND r.submissionAttempts < :maxAttempts ORDER BY r.createdAt ASC")
    List<RiskRecord> findAwaitingSubmission(@Param("maxAttempts") int maxAttempts, Pageable pageable);

    @Query("SELECT r FROM RiskRecord r WHERE r.transactionDate >= :start AND r.transactionDate < :end")
    List<RiskRecord> findInPeriod(@Param("start") Instant start, @Param("end") Instant end);

    /**
     * Flags a record as reported. Returns 0 when another worker already reported it.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RiskRecord r SET r.reportedToRegulator = true, r.reportReference = :reference, " +
           "r.reportedAt = :now, r.submissionAttempts = r.submissionAttempts + 1, " +
           "r.lastSubmissionError = null, r.version = r.version + 1 " +
           "WHERE r.id = :id AND r.reportedToRegulator = false")
    int markReported(@Param("id") UUID id, @Param("reference") String reference, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE RiskRecord r SET r.submissionAttempts = r.submissionAttempts + 1, " +
           "r.lastSubmissionError = :error, r.version = r.version + 1 " +
           "WHERE r.id = :id AND r.reportedToRegulator = false")
    int recordSubmissionFailure(@Param("id") UUID id, @Param("error") String error);
}
