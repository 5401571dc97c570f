package com.auscomply.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable archive of a generated periodic compliance report, one per period key.
 */
@Entity
@Table(name = "archived_compliance_reports", uniqueConstraints = {
    @UniqueConstraint(name = "uk_archived_report_period", columnNames = "period_key")
})
public class ArchivedComplianceReport {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "period_key", nullable = false, updatable = false, length = 16)
    private String periodKey;

    @NotNull
    @Column(name = "period_start", nullable = false, updatable = false)
    private Instant periodStart;

    @NotNull
    @Column(name = "period_end", nullable = false, updatable = false)
    private Instant periodEnd;

    @NotNull
    @Column(name = "report_json", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String reportJson;

    @NotNull
    @Column(name = "generated_by", nullable = false, updatable = false)
    private String generatedBy;

    @NotNull
    @Column(name = "generated_at", nullable = false, updatable = false)
    private Instant generatedAt;

    protected ArchivedComplianceReport() {}

    public static ArchivedComplianceReport archive(
            String periodKey,
            Instant periodStart,
            Instant periodEnd,
            String reportJson,
            String generatedBy,
            Instant generatedAt) {
        var archived = new ArchivedComplianceReport();
        archived.periodKey = periodKey;
        archived.periodStart = periodStart;
        archived.periodEnd = periodEnd;
        archived.reportJson = reportJson;
        archived.generatedBy = generatedBy;
        archived.generatedAt = generatedAt;
        return archived;
    }

    @PreUpdate
    void rejectUpdate() {
        throw new IllegalStateException("Archived compliance reports are immutable");
    }

    public UUID getId() { return id; }
    public String getPeriodKey() { return periodKey; }
    public Instant getPeriodStart() { return periodStart; }
    public Instant getPeriodEnd() { return periodEnd; }
    public String getReportJson() { return reportJson; }
    public String getGeneratedBy() { return generatedBy; }
    public Instant getGeneratedAt() { return generatedAt; }
}
