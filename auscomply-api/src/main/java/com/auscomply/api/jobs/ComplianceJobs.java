package com.auscomply.api.jobs;

import com.auscomply.api.aml.RegulatorSubmissionService;
import com.auscomply.api.aml.RegulatorSubmissionService.SubmissionRun;
import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.consent.ConsentService;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.report.ComplianceReport;
import com.auscomply.api.report.ComplianceReportService;
import com.auscomply.api.report.ReportPeriod;
import com.auscomply.api.report.ReportSection;
import com.auscomply.core.domain.ArchivedComplianceReport;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.repository.ArchivedComplianceReportRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;

/**
 * The periodic compliance jobs. They hold no schedule of their own: an external
 * scheduler, the job endpoints or {@link ScheduledComplianceJobs} trigger them.
 */
@Service
public class ComplianceJobs {

    private static final Logger log = LoggerFactory.getLogger(ComplianceJobs.class);

    static final String MONTHLY_REPORT_ACTOR = "monthly-report";

    private final ConsentService consentService;
    private final ComplianceReportService reportService;
    private final RegulatorSubmissionService submissionService;
    private final ArchivedComplianceReportRepository archiveRepository;
    private final AuditTrailService auditTrailService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ComplianceJobs(
            ConsentService consentService,
            ComplianceReportService reportService,
            RegulatorSubmissionService submissionService,
            ArchivedComplianceReportRepository archiveRepository,
            AuditTrailService auditTrailService,
            ObjectMapper objectMapper,
            Clock clock) {
        this.consentService = consentService;
        this.reportService = reportService;
        this.submissionService = submissionService;
        this.archiveRepository = archiveRepository;
        this.auditTrailService = auditTrailService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public int expireConsents() {
        int expired = consentService.expireOldConsents(ActorContext.system("consent-expiry"));
        log.info("Consent expiry job finished: {} expired", expired);
        return expired;
    }

    /**
     * Generates and archives the full report for a finished month. Consents past their
     * expiry are expired first, so the job also changes consent state. Running again
     * for an archived month returns the archived report without regenerating it.
     */
    public MonthlyReportRun runMonthlyReport(YearMonth month) {
        if (month == null) {
            throw new ComplianceValidationException("Report month is required");
        }
        ReportPeriod period = ReportPeriod.ofMonth(month);
        if (clock.instant().isBefore(period.end())) {
            throw new ComplianceValidationException("Month " + month + " has not ended yet");
        }
        String periodKey = month.toString();

        Optional<ArchivedComplianceReport> archived = archiveRepository.findByPeriodKey(periodKey);
        if (archived.isPresent()) {
            log.info("Monthly report for {} already archived at {}", periodKey, archived.get().getGeneratedAt());
            return new MonthlyReportRun(periodKey, false, read(archived.get()));
        }

        ActorContext actor = ActorContext.system(MONTHLY_REPORT_ACTOR);
        expireConsents();
        ComplianceReport report = reportService.generate(
                period, EnumSet.allOf(ReportSection.class), actor.actorUserId(), actor);

        ArchivedComplianceReport saved;
        try {
            saved = archiveRepository.saveAndFlush(ArchivedComplianceReport.archive(
                    periodKey, period.start(), period.end(), write(report), actor.actorUserId(), report.generatedAt()));
        } catch (DataIntegrityViolationException e) {
            ArchivedComplianceReport winner = archiveRepository.findByPeriodKey(periodKey).orElseThrow(() -> e);
            log.warn("Monthly report for {} was archived concurrently; returning the archived copy", periodKey);
            return new MonthlyReportRun(periodKey, false, read(winner));
        }

        log.info("Monthly report for {} archived as {}", periodKey, saved.getId());
        auditTrailService.record(AuditEvent.of(actor, OperationType.REPORT_ARCHIVED, "ArchivedComplianceReport", saved.getId())
                .withData(null, Map.of("periodKey", periodKey,
                        "actionItems", report.executiveSummary().actionItems().size())));
        return new MonthlyReportRun(periodKey, true, report);
    }

    public SubmissionRun submitRegulatorReports() {
        return submissionService.submitPending(ActorContext.system("regulator-submission"));
    }

    private String write(ComplianceReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Compliance report could not be serialised", e);
        }
    }

    private ComplianceReport read(ArchivedComplianceReport archived) {
        try {
            return objectMapper.readValue(archived.getReportJson(), ComplianceReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Archived report " + archived.getPeriodKey() + " could not be read", e);
        }
    }

    public record MonthlyReportRun(String periodKey, boolean generated, ComplianceReport report) {}
}
