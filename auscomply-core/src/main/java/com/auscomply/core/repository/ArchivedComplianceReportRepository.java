package com.auscomply.core.repository;

import com.auscomply.core.domain.ArchivedComplianceReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ArchivedComplianceReportRepository extends JpaRepository<ArchivedComplianceReport, UUID> {

    Optional<ArchivedComplianceReport> findByPeriodKey(String periodKey);
}
