package com.auscomply.core.repository;

import com.auscomply.core.domain.ConsentRecord;
import com.auscomply.core.domain.ConsentRecord.ConsentStatus;
import com.auscomply.core.domain.ConsentRecord.ConsentType;
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
 * Repository for consent records.
 * Status changes are compare-and-swap updates guarded on the expected prior status.
 */
@Repository
public interface ConsentRecordRepository extends JpaRepository<ConsentRecord, UUID> {

    List<ConsentRecord> findByUserIdOrderByGrantedAtDesc(String userId);

    Optional<ConsentRecord> findFirstByUserIdAndConsentTypeAndStatusOrderByGrantedAtDesc(
            String userId, ConsentType consentType, ConsentStatus status);

    @Query("SELECT c FROM ConsentRecord c WHERE c.grantedAt >= :start AND c.grantedAt < :end")
    List<ConsentRecord> findGrantedInPeriod(@Param("start") Instant start, @Param("end") Instant end);

    /**
     * Withdraws a consent only if it is still GRANTED. Returns the number of rows changed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ConsentRecord c SET c.status = :withdrawn, c.withdrawnAt = :now, " +
           "c.withdrawalReason = :reason, c.version = c.version + 1 " +
           "WHERE c.id = :id AND c.status = :granted")
    int withdrawIfGranted(
            @Param("id") UUID id,
            @Param("reason") String reason,
            @Param("now") Instant now,
            @Param("granted") ConsentStatus granted,
            @Param("withdrawn") ConsentStatus withdrawn);

    /**
     * Expires every GRANTED consent whose expiry has passed. Already expired rows are untouched.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ConsentRecord c SET c.status = :expired, c.version = c.version + 1 " +
           "WHERE c.status = :granted AND c.expiresAt IS NOT NULL AND c.expiresAt < :now")
    int expireGrantedBefore(
            @Param("now") Instant now,
            @Param("granted") ConsentStatus granted,
            @Param("expired") ConsentStatus expired);

    long countByStatus(ConsentStatus status);
}
