package com.auscomply.api.report;

import com.auscomply.api.apra.DataResidencyChecker;
import com.auscomply.api.apra.DataResidencyChecker.ResidencyStatus;
import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.config.AmlProperties;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.report.ComplianceReport.AmlSection;
import com.auscomply.api.report.ComplianceReport.ApraSection;
import com.auscomply.api.report.ComplianceReport.ExecutiveSummary;
import com.auscomply.api.report.ComplianceReport.GstSection;
import com.auscomply.api.report.ComplianceReport.PrivacySection;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.ConsentRecord;
import com.auscomply.core.domain.ConsentRecord.ConsentStatus;
import com.auscomply.core.domain.DataSubjectRequest;
import com.auscomply.core.domain.DataSubjectRequest.RequestStatus;
import com.auscomply.core.domain.GstTransactionDetail;
import com.auscomply.core.domain.IncidentReport;
import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.repository.ConsentRecordRepository;
import com.auscomply.core.repository.DataSubjectRequestRepository;
import com.auscomply.core.repository.GstTransactionDetailRepository;
import com.auscomply.core.repository.IncidentReportRepository;
import com.auscomply.core.repository.RiskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Aggregates AML, privacy, APRA and GST records into a periodic compliance report.
 *
 * All reads happen in one read-only repeatable-read transaction, which ends before the
 * generation is audited, and every time-dependent
 * predicate is evaluated at {@code asOf = min(now, period end)}, so a report for a
 * closed period comes out the same each time it is generated. Source records are
 * never modified.
 */
@Service
public class ComplianceReportService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceReportService.class);

    static final String RESOURCE_TYPE = "ComplianceReport";

    static final BigDecimal MEDIUM_RISK_LEVEL = new BigDecimal("0.5");
    static final BigDecimal HIGH_RISK_LEVEL = new BigDecimal("0.75");

    private static final BigDecimal SECONDS_PER_DAY = BigDecimal.valueOf(Duration.ofDays(1).toSeconds());
    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(Duration.ofHours(1).toSeconds());
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskRecordRepository riskRepository;
    private final ConsentRecordRepository consentRepository;
    private final DataSubjectRequestRepository requestRepository;
    private final IncidentReportRepository incidentRepository;
    private final GstTransactionDetailRepository gstRepository;
    private final DataResidencyChecker residencyChecker;
    private final AmlProperties amlProperties;
    private final AuditTrailService auditTrailService;
    private final TransactionTemplate readTemplate;
    private final Clock clock;

    public ComplianceReportService(
            RiskRecordRepository riskRepository,
            ConsentRecordRepository consentRepository,
            DataSubjectRequestRepository requestRepository,
            IncidentReportRepository incidentRepository,
            GstTransactionDetailRepository gstRepository,
            DataResidencyChecker residencyChecker,
            AmlProperties amlProperties,
            AuditTrailService auditTrailService,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.riskRepository = riskRepository;
        this.consentRepository = consentRepository;
        this.requestRepository = requestRepository;
        this.incidentRepository = incidentRepository;
        this.gstRepository = gstRepository;
        this.residencyChecker = residencyChecker;
        this.amlProperties = amlProperties;
        this.auditTrailService = auditTrailService;
        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_REPEATABLE_READ);
        this.clock = clock;
    }

    public ComplianceReport generate(ReportPeriod period, Set<ReportSection> sections,
                                     String generatedBy, ActorContext actor) {
        if (period == null) {
            throw new ComplianceValidationException("Report period is required");
        }
        if (sections == null || sections.isEmpty()) {
            throw new ComplianceValidationException("At least one report section is required");
        }
        if (generatedBy == null || generatedBy.isBlank()) {
            throw new ComplianceValidationException("generatedBy is required");
        }

        Instant now = clock.instant();
        Instant asOf = now.isBefore(period.end()) ? now : period.end();
        Set<ReportSection> requested = Collections.unmodifiableSet(EnumSet.copyOf(sections));

        ComplianceReport report = readTemplate.execute(status -> {
            AmlSection aml = requested.contains(ReportSection.AML) ? amlSection(period, asOf) : null;
            PrivacySection privacy = requested.contains(ReportSection.PRIVACY) ? privacySection(period, asOf) : null;
            ApraSection apra = requested.contains(ReportSection.APRA) ? apraSection(period, asOf) : null;
            GstSection gst = requested.contains(ReportSection.GST) ? gstSection(period, asOf) : null;
            return new ComplianceReport(
                    period.start(), period.end(), asOf, now, generatedBy, requested,
                    executiveSummary(aml, privacy, apra, gst),
                    aml, privacy, apra, gst);
        });

        log.info("Compliance report generated for [{}, {}) sections={} by {}",
                period.start(), period.end(), requested, generatedBy);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("periodStart", period.start());
        summary.put("periodEnd", period.end());
        summary.put("sections", requested.stream().map(Enum::name).toList());
        summary.put("actionItems", report.executiveSummary().actionItems().size());
        auditTrailService.record(AuditEvent.of(actor, OperationType.REPORT_GENERATED, RESOURCE_TYPE,
                        period.start() + "/" + period.end())
                .withData(null, summary));
        return report;
    }

    private AmlSection amlSection(ReportPeriod period, Instant asOf) {
        List<RiskRecord> records = riskRepository.findInPeriod(period.start(), period.end());

        BigDecimal totalAmount = BigDecimal.ZERO.setScale(2);
        BigDecimal scoreSum = BigDecimal.ZERO;
        long high = 0;
        long medium = 0;
        long alerts = 0;
        long pending = 0;
        long reviewed = 0;
        long falsePositives = 0;
        long reported = 0;
        long awaiting = 0;
        Map<String, Long> byType = new TreeMap<>();

        for (RiskRecord record : records) {
            totalAmount = totalAmount.add(record.getAmount());
            scoreSum = scoreSum.add(record.getRiskScore());
            if (record.getRiskScore().compareTo(amlProperties.getHighRiskThreshold()) >= 0) {
                high++;
            } else if (record.getRiskScore().compareTo(amlProperties.getReviewThreshold()) >= 0) {
                medium++;
            }
            byType.merge(record.getMonitoringType().name(), 1L, Long::sum);

            boolean reviewedByAsOf = atOrBefore(record.getReviewedAt(), asOf);
            if (record.isRequiresReview()) {
                alerts++;
                if (reviewedByAsOf) {
                    reviewed++;
                } else {
                    pending++;
                }
            }
            if (reviewedByAsOf && record.isFalsePositive()) {
                falsePositives++;
            }
            boolean reportedByAsOf = record.isReportedToRegulator() && atOrBefore(record.getReportedAt(), asOf);
            if (reportedByAsOf) {
                reported++;
            } else if (record.isQueuedForReport()) {
                awaiting++;
            }
        }

        long total = records.size();
        BigDecimal averageScore = total == 0
                ? BigDecimal.ZERO.setScale(3)
                : scoreSum.divide(BigDecimal.valueOf(total), 3, RoundingMode.HALF_UP);
        return new AmlSection(total, totalAmount, averageScore, high, medium, total - high - medium,
                alerts, pending, reviewed, falsePositives, reported, awaiting, byType);
    }

    private PrivacySection privacySection(ReportPeriod period, Instant asOf) {
        List<ConsentRecord> consents = consentRepository.findGrantedInPeriod(period.start(), period.end());
        Map<String, Long> consentsByStatus = new TreeMap<>();
        Map<String, Long> consentsByType = new TreeMap<>();
        for (ConsentRecord consent : consents) {
            consentsByStatus.merge(consentStatusAt(consent, asOf).name(), 1L, Long::sum);
            consentsByType.merge(consent.getConsentType().name(), 1L, Long::sum);
        }

        List<DataSubjectRequest> requests = requestRepository.findRequestedInPeriod(period.start(), period.end());
        Map<String, Long> requestsByType = new TreeMap<>();
        Map<String, Long> requestsByStatus = new TreeMap<>();
        long overdue = 0;
        long completedCount = 0;
        BigDecimal processingSeconds = BigDecimal.ZERO;
        for (DataSubjectRequest request : requests) {
            RequestStatus status = requestStatusAt(request, asOf);
            requestsByType.merge(request.getRequestType().name(), 1L, Long::sum);
            requestsByStatus.merge(status.name(), 1L, Long::sum);
            if (!status.isTerminal() && request.getDueDate().isBefore(asOf)) {
                overdue++;
            }
            if (status == RequestStatus.COMPLETED) {
                completedCount++;
                processingSeconds = processingSeconds.add(BigDecimal.valueOf(
                        Duration.between(request.getRequestDate(), request.getCompletedAt()).toSeconds()));
            }
        }
        BigDecimal averageDays = completedCount == 0
                ? BigDecimal.ZERO.setScale(1)
                : processingSeconds.divide(SECONDS_PER_DAY.multiply(BigDecimal.valueOf(completedCount)), 1, RoundingMode.HALF_UP);

        return new PrivacySection(consents.size(), consentsByStatus, consentsByType,
                requests.size(), requestsByType, requestsByStatus, overdue, averageDays);
    }

    private ApraSection apraSection(ReportPeriod period, Instant asOf) {
        List<IncidentReport> incidents = incidentRepository.findDetectedInPeriod(period.start(), period.end());
        long critical = 0;
        long breaches = 0;
        long resolvedCount = 0;
        BigDecimal resolutionSeconds = BigDecimal.ZERO;
        long notifiable = 0;
        long reportedInTime = 0;
        for (IncidentReport incident : incidents) {
            if (incident.getSeverity() == IncidentReport.Severity.CRITICAL) {
                critical++;
            }
            if (incident.getIncidentType() == IncidentReport.IncidentType.DATA_BREACH) {
                breaches++;
            }
            if (atOrBefore(incident.getResolvedAt(), asOf)) {
                resolvedCount++;
                resolutionSeconds = resolutionSeconds.add(BigDecimal.valueOf(
                        Duration.between(incident.getDetectedAt(), incident.getResolvedAt()).toSeconds()));
            }
            if (incident.requiresRegulatorNotification()) {
                notifiable++;
                if (atOrBefore(incident.getReportedAt(), asOf) && incident.isReportedWithinWindow()) {
                    reportedInTime++;
                }
            }
        }
        BigDecimal averageHours = resolvedCount == 0
                ? BigDecimal.ZERO.setScale(1)
                : resolutionSeconds.divide(SECONDS_PER_HOUR.multiply(BigDecimal.valueOf(resolvedCount)), 1, RoundingMode.HALF_UP);
        BigDecimal compliancePercent = notifiable == 0
                ? HUNDRED.setScale(1)
                : BigDecimal.valueOf(reportedInTime).multiply(HUNDRED)
                        .divide(BigDecimal.valueOf(notifiable), 1, RoundingMode.HALF_UP);

        return new ApraSection(incidents.size(), critical, breaches, averageHours, compliancePercent,
                residencyChecker.check());
    }

    private GstSection gstSection(ReportPeriod period, Instant asOf) {
        List<GstTransactionDetail> details = gstRepository.findInPeriod(period.start(), period.end());
        BigDecimal base = BigDecimal.ZERO.setScale(2);
        BigDecimal gst = BigDecimal.ZERO.setScale(2);
        Map<String, Long> byTreatment = new TreeMap<>();
        long validated = 0;
        long withErrors = 0;
        long reported = 0;
        for (GstTransactionDetail detail : details) {
            base = base.add(detail.getBaseAmount());
            gst = gst.add(detail.getGstAmount());
            byTreatment.merge(detail.getTreatment().name(), 1L, Long::sum);
            if (detail.isValidated()) {
                validated++;
            }
            if (!detail.getValidationErrors().isEmpty()) {
                withErrors++;
            }
            if (detail.isReportedInBas() && atOrBefore(detail.getReportedInBasAt(), asOf)) {
                reported++;
            }
        }
        BigDecimal effectiveRate = base.signum() == 0
                ? BigDecimal.ZERO.setScale(4)
                : gst.divide(base, 4, RoundingMode.HALF_UP);
        long total = details.size();
        return new GstSection(total, base, gst, effectiveRate, byTreatment,
                validated, total - validated, withErrors, reported, total - reported);
    }

    private ExecutiveSummary executiveSummary(AmlSection aml, PrivacySection privacy,
                                              ApraSection apra, GstSection gst) {
        Map<String, Object> keyMetrics = new LinkedHashMap<>();
        List<String> actionItems = new ArrayList<>();

        String amlRiskLevel = ComplianceReport.NOT_ASSESSED;
        if (aml != null) {
            amlRiskLevel = riskLevel(aml.averageRiskScore());
            keyMetrics.put("totalTransactions", aml.totalTransactions());
            keyMetrics.put("highRiskTransactions", aml.highRisk());
            keyMetrics.put("pendingAlerts", aml.pendingReview());
            if (aml.pendingReview() > 0) {
                actionItems.add("Review " + aml.pendingReview() + " pending AML alerts");
            }
        }

        String privacyStatus = ComplianceReport.NOT_ASSESSED;
        if (privacy != null) {
            privacyStatus = privacy.overdueRequests() == 0 ? "COMPLIANT" : "ISSUES";
            keyMetrics.put("privacyRequests", privacy.totalRequests());
            keyMetrics.put("overdueRequests", privacy.overdueRequests());
            if (privacy.overdueRequests() > 0) {
                actionItems.add("Process " + privacy.overdueRequests() + " overdue privacy requests");
            }
        }

        String apraStatus = ComplianceReport.NOT_ASSESSED;
        if (apra != null) {
            ResidencyStatus residency = apra.dataResidency();
            apraStatus = residency.compliant() ? "COMPLIANT" : "NON_COMPLIANT";
            keyMetrics.put("incidents", apra.totalIncidents());
            keyMetrics.put("dataResidencyCompliant", residency.compliant());
            if (!residency.compliant()) {
                actionItems.add("Address data residency compliance issues");
            }
        }

        String gstStatus = ComplianceReport.NOT_ASSESSED;
        if (gst != null) {
            gstStatus = gst.withErrors() == 0 ? "COMPLIANT" : "ISSUES";
            keyMetrics.put("gstTransactions", gst.totalTransactions());
            keyMetrics.put("gstValidationErrors", gst.withErrors());
            if (gst.withErrors() > 0) {
                actionItems.add("Fix GST validation errors in " + gst.withErrors() + " transactions");
            }
        }

        if (aml != null && aml.awaitingSubmission() > 0) {
            actionItems.add("Submit " + aml.awaitingSubmission() + " high-risk transactions to AUSTRAC");
        }

        return new ExecutiveSummary(amlRiskLevel, privacyStatus, apraStatus, gstStatus,
                Collections.unmodifiableMap(keyMetrics), List.copyOf(actionItems));
    }

    static String riskLevel(BigDecimal averageScore) {
        if (averageScore.compareTo(MEDIUM_RISK_LEVEL) < 0) {
            return "LOW";
        }
        if (averageScore.compareTo(HIGH_RISK_LEVEL) < 0) {
            return "MEDIUM";
        }
        return "HIGH";
    }

    static ConsentStatus consentStatusAt(ConsentRecord consent, Instant asOf) {
        if (atOrBefore(consent.getWithdrawnAt(), asOf)) {
            return ConsentStatus.WITHDRAWN;
        }
        if (consent.getExpiresAt() != null && !consent.getExpiresAt().isAfter(asOf)) {
            return ConsentStatus.EXPIRED;
        }
        return ConsentStatus.GRANTED;
    }

    static RequestStatus requestStatusAt(DataSubjectRequest request, Instant asOf) {
        if (request.getStatus().isTerminal() && atOrBefore(request.getCompletedAt(), asOf)) {
            return request.getStatus();
        }
        if (atOrBefore(request.getProcessedAt(), asOf)) {
            return RequestStatus.PROCESSING;
        }
        return RequestStatus.PENDING;
    }

    private static boolean atOrBefore(Instant instant, Instant asOf) {
        return instant != null && !instant.isAfter(asOf);
    }
}
