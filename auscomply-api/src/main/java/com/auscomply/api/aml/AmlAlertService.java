package com.auscomply.api.aml;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.RecordNotFoundException;
import com.auscomply.api.error.StateConflictException;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.domain.RiskRecord.ReviewDecision;
import com.auscomply.core.repository.RiskRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Analyst review of flagged risk records.
 */
@Service
public class AmlAlertService {

    private static final Logger log = LoggerFactory.getLogger(AmlAlertService.class);

    private static final int MAX_PENDING_PAGE = 500;

    private final RiskRecordRepository riskRepository;
    private final AuditTrailService auditTrailService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public AmlAlertService(RiskRecordRepository riskRepository, AuditTrailService auditTrailService,
                           PlatformTransactionManager transactionManager, Clock clock) {
        this.riskRepository = riskRepository;
        this.auditTrailService = auditTrailService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Unreviewed alerts, highest risk first.
     */
    @Transactional(readOnly = true)
    public List<RiskRecord> getPendingAlerts(int limit) {
        if (limit < 1 || limit > MAX_PENDING_PAGE) {
            throw new ComplianceValidationException("Limit must be between 1 and " + MAX_PENDING_PAGE);
        }
        return riskRepository.findPendingAlerts(PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public RiskRecord getRecord(UUID id) {
        return riskRepository.findById(id).orElseThrow(() -> RecordNotFoundException.of("Risk record", id));
    }

    @Transactional(readOnly = true)
    public RiskRecord getByTransactionId(String transactionId) {
        return riskRepository.findByTransactionId(transactionId)
                .orElseThrow(() -> RecordNotFoundException.of("Risk record for transaction", transactionId));
    }

    /**
     * Records the review decision. REPORT queues the record for regulator submission,
     * FALSE_POSITIVE removes it from the pending queue. A record is reviewed once.
     */
    public RiskRecord reviewAlert(UUID id, String reviewer, ReviewDecision decision, String notes, ActorContext actor) {
        if (reviewer == null || reviewer.isBlank()) {
            throw new ComplianceValidationException("Reviewer is required");
        }
        if (decision == null) {
            throw new ComplianceValidationException("Review decision is required");
        }
        Review review = transactionTemplate.execute(status -> {
            RiskRecord record = getRecord(id);
            Map<String, Object> before = RiskScoringService.snapshot(record);
            try {
                record.review(reviewer, decision, notes, clock.instant());
            } catch (IllegalStateException e) {
                throw new StateConflictException(e.getMessage());
            }
            return new Review(before, riskRepository.saveAndFlush(record));
        });
        log.info("Risk record {} reviewed by {}: {}", id, reviewer, decision);

        auditTrailService.record(AuditEvent.of(actor, OperationType.ALERT_REVIEWED, RiskScoringService.RESOURCE_TYPE, id)
                .withData(review.before(), RiskScoringService.snapshot(review.record())));
        return review.record();
    }

    private record Review(Map<String, Object> before, RiskRecord record) {}
}
