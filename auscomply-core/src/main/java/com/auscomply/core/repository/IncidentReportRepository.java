package com.auscomply.core.repository;

import com.auscomply.core.domain.IncidentReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface IncidentReportRepository extends JpaRepository<IncidentReport, UUID> {

    @Query("SELECT i FROM IncidentReport i WHERE i.detectedAt >= :start AND i.detectedAt < :end ORDER BY i.detectedAt ASC")
    List<IncidentReport> findDetectedInPeriod(@Param("start") Instant start, @Param("end") Instant end);
}
