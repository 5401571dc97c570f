package com.auscomply.api.aml;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.config.AmlProperties;
import com.auscomply.api.error.AuditPersistenceException;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.repository.RiskRecordRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Submits queued high-risk records to the regulator, independently of scoring.
 * Failures are recorded on the record and retried on the next run until the
 * attempt limit is reached. An audit entry that cannot be written is counted in the
 * run result and does not stop the remaining records from being submitted.
 */
@Service
public class RegulatorSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(RegulatorSubmissionService.class);

    private final RiskRecordRepository riskRepository;
    private final RegulatorGateway regulatorGateway;
    private final AuditTrailService auditTrailService;
    private final AmlProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Counter submissionFailures;

    public RegulatorSubmissionService(
            RiskRecordRepository riskRepository,
            RegulatorGateway regulatorGateway,
            AuditTrailService auditTrailService,
            AmlProperties properties,
            PlatformTransactionManager transactionManager,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.riskRepository = riskRepository;
        this.regulatorGateway = regulatorGateway;
        this.auditTrailService = auditTrailService;
        this.properties = properties;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.submissionFailures = Counter.builder("auscomply.aml.submission.failures")
                .description("Failed suspicious matter report submissions")
                .register(meterRegistry);
    }

    public SubmissionRun submitPending(ActorContext actor) {
        List<RiskRecord> queued = riskRepository.findAwaitingSubmission(
                properties.getMaxSubmissionAttempts(), PageRequest.of(0, properties.getSubmissionBatchSize()));

        int submitted = 0;
        int failed = 0;
        int auditFailures = 0;
        for (RiskRecord record : queued) {
            Outcome outcome = submit(record, actor);
            if (outcome.submitted()) {
                submitted++;
            } else {
                failed++;
            }
            if (!outcome.audited()) {
                auditFailures++;
            }
        }
        if (!queued.isEmpty()) {
            log.info("Regulator submission run: {} attempted, {} submitted, {} failed, {} unaudited",
                    queued.size(), submitted, failed, auditFailures);
        }
        return new SubmissionRun(queued.size(), submitted, failed, auditFailures);
    }

    private Outcome submit(RiskRecord record, ActorContext actor) {
        String reference;
        try {
            reference = regulatorGateway.submitSuspiciousMatter(record);
        } catch (RuntimeException e) {
            submissionFailures.increment();
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Submission of risk record {} failed (attempt {}): {}",
                    record.getId(), record.getSubmissionAttempts() + 1, error);
            transactionTemplate.executeWithoutResult(status ->
                    riskRepository.recordSubmissionFailure(record.getId(), error));
            boolean audited = audit(record, AuditEvent.of(actor, OperationType.REGULATOR_REPORT_FAILED,
                            RiskScoringService.RESOURCE_TYPE, record.getId())
                    .withData(null, Map.of("attempt", record.getSubmissionAttempts() + 1))
                    .failed(error));
            return new Outcome(false, audited);
        }

        Integer updated = transactionTemplate.execute(status ->
                riskRepository.markReported(record.getId(), reference, clock.instant()));
        if (updated == null || updated == 0) {
            log.warn("Risk record {} was already reported by another worker; reference {} not stored",
                    record.getId(), reference);
            return new Outcome(false, true);
        }
        boolean audited = audit(record, AuditEvent.of(actor, OperationType.REGULATOR_REPORT_SUBMITTED,
                        RiskScoringService.RESOURCE_TYPE, record.getId())
                .withData(null, Map.of("reportReference", reference))
                .withAmounts(record.getAmount(), null));
        return new Outcome(true, audited);
    }

    private boolean audit(RiskRecord record, AuditEvent event) {
        try {
            auditTrailService.record(event);
            return true;
        } catch (AuditPersistenceException e) {
            log.error("Audit entry {} for risk record {} was not written; continuing with the batch",
                    event.operationType(), record.getId(), e);
            return false;
        }
    }

    private record Outcome(boolean submitted, boolean audited) {}

    public record SubmissionRun(int attempted, int submitted, int failed, int auditFailures) {}
}
