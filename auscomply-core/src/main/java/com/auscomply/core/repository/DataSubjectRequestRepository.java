package com.auscomply.core.repository;

import com.auscomply.core.domain.DataSubjectRequest;
import com.auscomply.core.domain.DataSubjectRequest.RequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for data-subject requests. Every status change is conditional on the
 * current status so concurrent processors cannot both succeed.
 */
@Repository
public interface DataSubjectRequestRepository extends JpaRepository<DataSubjectRequest, UUID> {

    List<DataSubjectRequest> findByUserIdOrderByRequestDateDesc(String userId);

    @Query("SELECT r FROM DataSubjectRequest r WHERE r.dueDate < :now AND r.status IN :open ORDER BY r.dueDate ASC")
    List<DataSubjectRequest> findOverdue(@Param("now") Instant now, @Param("open") Collection<RequestStatus> open);

    @Query("SELECT r FROM DataSubjectRequest r WHERE r.requestDate >= :start AND r.requestDate < :end")
    List<DataSubjectRequest> findRequestedInPeriod(@Param("start") Instant start, @Param("end") Instant end);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DataSubjectRequest r SET r.status = :processing, r.processedBy = :processedBy, " +
           "r.processedAt = :now, r.version = r.version + 1 " +
           "WHERE r.id = :id AND r.status = :pending")
    int startProcessing(
            @Param("id") UUID id,
            @Param("processedBy") String processedBy,
            @Param("now") Instant now,
            @Param("pending") RequestStatus pending,
            @Param("processing") RequestStatus processing);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DataSubjectRequest r SET r.status = :completed, r.completedAt = :now, " +
           "r.exportUrl = :exportUrl, r.exportExpiresAt = :exportExpiresAt, " +
           "r.resolutionNotes = :notes, r.version = r.version + 1 " +
           "WHERE r.id = :id AND r.status = :processing")
    int complete(
            @Param("id") UUID id,
            @Param("exportUrl") String exportUrl,
            @Param("exportExpiresAt") Instant exportExpiresAt,
            @Param("notes") String notes,
            @Param("now") Instant now,
            @Param("processing") RequestStatus processing,
            @Param("completed") RequestStatus completed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DataSubjectRequest r SET r.status = :rejected, r.completedAt = :now, " +
           "r.rejectionReason = :reason, r.processedBy = :processedBy, " +
           "r.processedAt = COALESCE(r.processedAt, :now), r.version = r.version + 1 " +
           "WHERE r.id = :id AND r.status IN :expected")
    int reject(
            @Param("id") UUID id,
            @Param("processedBy") String processedBy,
            @Param("reason") String reason,
            @Param("now") Instant now,
            @Param("expected") Collection<RequestStatus> expected,
            @Param("rejected") RequestStatus rejected);
}
