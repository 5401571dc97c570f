package com.auscomply.core.repository;

import com.auscomply.core.domain.GstTransactionDetail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GstTransactionDetailRepository extends JpaRepository<GstTransactionDetail, UUID> {

    boolean existsByTransactionId(String transactionId);

    Optional<GstTransactionDetail> findByTransactionId(String transactionId);

    List<GstTransactionDetail> findByTaxPeriodOrderByTransactionDateAsc(String taxPeriod);

    @Query("SELECT g FROM GstTransactionDetail g WHERE g.transactionDate >= :start AND g.transactionDate < :end")
    List<GstTransactionDetail> findInPeriod(@Param("start") Instant start, @Param("end") Instant end);

    /**
     * One-way BAS flag. Returns 0 if the detail was already flagged.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GstTransactionDetail g SET g.reportedInBas = true, g.reportedInBasAt = :now, " +
           "g.version = g.version + 1 WHERE g.id = :id AND g.reportedInBas = false")
    int markReportedInBas(@Param("id") UUID id, @Param("now") Instant now);
}
