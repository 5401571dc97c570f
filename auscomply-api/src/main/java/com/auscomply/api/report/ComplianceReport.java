package com.auscomply.api.report;

import com.auscomply.api.apra.DataResidencyChecker.ResidencyStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Periodic compliance report. Sections that were not requested are null and marked
 * NOT_ASSESSED in the executive summary.
 */
public record ComplianceReport(
        Instant periodStart,
        Instant periodEnd,
        Instant asOf,
        Instant generatedAt,
        String generatedBy,
        Set<ReportSection> sections,
        ExecutiveSummary executiveSummary,
        AmlSection aml,
        PrivacySection privacy,
        ApraSection apra,
        GstSection gst
) {

    public static final String NOT_ASSESSED = "NOT_ASSESSED";

    public ComplianceReport {
        // Declaration order, also after reading an archived copy back
        sections = sections == null || sections.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(sections));
    }

    public record ExecutiveSummary(
            String amlRiskLevel,
            String privacyStatus,
            String apraStatus,
            String gstStatus,
            Map<String, Object> keyMetrics,
            List<String> actionItems
    ) {}

    public record AmlSection(
            long totalTransactions,
            BigDecimal totalAmount,
            BigDecimal averageRiskScore,
            long highRisk,
            long mediumRisk,
            long lowRisk,
            long totalAlerts,
            long pendingReview,
            long reviewed,
            long falsePositives,
            long reportedToRegulator,
            long awaitingSubmission,
            Map<String, Long> byMonitoringType
    ) {}

    public record PrivacySection(
            long consentsGranted,
            Map<String, Long> consentsByStatus,
            Map<String, Long> consentsByType,
            long totalRequests,
            Map<String, Long> requestsByType,
            Map<String, Long> requestsByStatus,
            long overdueRequests,
            BigDecimal averageProcessingDays
    ) {}

    public record ApraSection(
            long totalIncidents,
            long criticalIncidents,
            long dataBreaches,
            BigDecimal averageResolutionHours,
            BigDecimal reportingCompliancePercent,
            ResidencyStatus dataResidency
    ) {}

    public record GstSection(
            long totalTransactions,
            BigDecimal totalBaseAmount,
            BigDecimal totalGstAmount,
            BigDecimal effectiveRate,
            Map<String, Long> byTreatment,
            long validated,
            long unvalidated,
            long withErrors,
            long reportedInBas,
            long pendingBas
    ) {}
}
