package com.auscomply.api.aml;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.config.AmlProperties;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.RiskEvaluationException;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.domain.UserRiskWindow;
import com.auscomply.core.repository.RiskRecordRepository;
import com.auscomply.core.repository.UserRiskWindowRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * AML/CTF risk scoring engine.
 *
 * Scoring for one user is serialised on the user's window row, so the history each
 * evaluation sees includes every transaction committed before it. Lost races on that
 * row are retried. If an evaluation still cannot complete, a fail-safe record flagged
 * for review is persisted instead: a transaction is never silently passed.
 */
@Service
public class RiskScoringService {

    private static final Logger log = LoggerFactory.getLogger(RiskScoringService.class);

    static final String RESOURCE_TYPE = "RiskRecord";

    private final RiskRecordRepository riskRepository;
    private final UserRiskWindowRepository windowRepository;
    private final List<RiskRuleEvaluator> primaryEvaluators;
    private final List<RiskRuleEvaluator> compositeEvaluators;
    private final AmlProperties properties;
    private final AuditTrailService auditTrailService;
    private final RetryTemplate scoringRetryTemplate;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate failSafeTransaction;
    private final Clock clock;
    private final Counter failSafeCounter;

    public RiskScoringService(
            RiskRecordRepository riskRepository,
            UserRiskWindowRepository windowRepository,
            List<RiskRuleEvaluator> evaluators,
            AmlProperties properties,
            AuditTrailService auditTrailService,
            @Qualifier("scoringRetryTemplate") RetryTemplate scoringRetryTemplate,
            PlatformTransactionManager transactionManager,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.riskRepository = riskRepository;
        this.windowRepository = windowRepository;
        this.primaryEvaluators = evaluators.stream().filter(e -> !e.isComposite()).toList();
        this.compositeEvaluators = evaluators.stream().filter(RiskRuleEvaluator::isComposite).toList();
        this.properties = properties;
        this.auditTrailService = auditTrailService;
        this.scoringRetryTemplate = scoringRetryTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.failSafeTransaction = new TransactionTemplate(transactionManager);
        this.failSafeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.failSafeCounter = Counter.builder("auscomply.aml.fail_safe")
                .description("Transactions recorded for review because scoring could not complete")
                .register(meterRegistry);
    }

    /**
     * Scores a transaction and persists its risk record. Evaluating the same
     * transaction id again returns the existing record.
     *
     * @throws ComplianceValidationException for malformed input
     * @throws RiskEvaluationException if neither the evaluation nor the fail-safe record could be stored
     */
    public RiskRecord evaluate(TransactionEvent transaction, ActorContext actor) {
        validate(transaction);

        Scored scored;
        try {
            scored = scoringRetryTemplate.execute(context ->
                    transactionTemplate.execute(status -> scoreWithinTransaction(transaction)));
        } catch (RuntimeException e) {
            return recordFailSafe(transaction, actor, e);
        }

        RiskRecord record = scored.record();
        if (!scored.alreadyEvaluated()) {
            if (record.isRequiresReview()) {
                log.info("Transaction {} for user {} flagged for review: score={}, type={}",
                        record.getTransactionId(), record.getUserId(), record.getRiskScore(),
                        record.getMonitoringType());
            }
            auditTrailService.record(AuditEvent.of(actor, OperationType.RISK_EVALUATED, RESOURCE_TYPE, record.getId())
                    .withData(null, snapshot(record))
                    .withAmounts(record.getAmount(), null));
        }
        return record;
    }

    private Scored scoreWithinTransaction(TransactionEvent transaction) {
        Optional<RiskRecord> existing = riskRepository.findByTransactionId(transaction.transactionId());
        if (existing.isPresent()) {
            return new Scored(existing.get(), true);
        }

        Instant now = clock.instant();
        UserRiskWindow window = windowRepository.findForUpdate(transaction.userId())
                .orElseGet(() -> windowRepository.saveAndFlush(UserRiskWindow.open(transaction.userId(), now)));

        Instant historyStart = transaction.transactionDate().minus(longestWindow());
        List<RiskRecord> history = riskRepository.findUserHistory(
                transaction.userId(), historyStart, transaction.transactionDate());

        EvaluationContext context = new EvaluationContext(
                history, window.getLastActivityAt(), properties, List.of());

        List<RuleOutcome> primary = new ArrayList<>();
        for (RiskRuleEvaluator evaluator : primaryEvaluators) {
            primary.add(evaluator.evaluate(transaction, context));
        }
        List<RuleOutcome> outcomes = new ArrayList<>(primary);
        EvaluationContext compositeContext = context.withPrimaryOutcomes(primary);
        for (RiskRuleEvaluator evaluator : compositeEvaluators) {
            outcomes.add(evaluator.evaluate(transaction, compositeContext));
        }

        RiskScoreCombiner.CombinedScore combined = RiskScoreCombiner.combine(outcomes);
        RiskRecord record = RiskRecord.assessed(
                transaction.toFacts(),
                combined.score(),
                combined.monitoringType(),
                combined.factors(),
                properties.getReviewThreshold(),
                properties.getReportingThreshold(),
                now);
        RiskRecord saved = riskRepository.saveAndFlush(record);

        window.recordActivity(saved.getAmount(), transaction.transactionDate(), now);
        windowRepository.save(window);
        return new Scored(saved, false);
    }

    private RiskRecord recordFailSafe(TransactionEvent transaction, ActorContext actor, RuntimeException cause) {
        failSafeCounter.increment();
        log.error("Risk evaluation failed for transaction {}; recording fail-safe review record",
                transaction.transactionId(), cause);

        RiskRecord record;
        try {
            record = failSafeTransaction.execute(status ->
                    riskRepository.findByTransactionId(transaction.transactionId())
                            .orElseGet(() -> riskRepository.saveAndFlush(RiskRecord.failSafe(
                                    transaction.toFacts(),
                                    properties.getReviewThreshold(),
                                    describe(cause),
                                    clock.instant()))));
        } catch (RuntimeException e) {
            log.error("Fail-safe record for transaction {} could not be stored", transaction.transactionId(), e);
            e.addSuppressed(cause);
            throw new RiskEvaluationException(
                    "Transaction " + transaction.transactionId() + " could not be evaluated or recorded", e);
        }

        auditTrailService.record(AuditEvent.of(actor, OperationType.RISK_EVALUATION_FAILED, RESOURCE_TYPE, record.getId())
                .withData(null, snapshot(record))
                .withAmounts(record.getAmount(), null)
                .failed(describe(cause)));
        return record;
    }

    private Duration longestWindow() {
        Duration structuring = Duration.ofDays(properties.getStructuringWindowDays());
        Duration day = VelocityRuleEvaluator.DAY;
        Duration burst = Duration.ofMinutes(properties.getBurstWindowMinutes());
        Duration longest = structuring.compareTo(day) > 0 ? structuring : day;
        return longest.compareTo(burst) > 0 ? longest : burst;
    }

    private void validate(TransactionEvent transaction) {
        if (transaction == null) {
            throw new ComplianceValidationException("Transaction is required");
        }
        if (transaction.transactionId() == null || transaction.transactionId().isBlank()) {
            throw new ComplianceValidationException("Transaction ID is required");
        }
        if (transaction.userId() == null || transaction.userId().isBlank()) {
            throw new ComplianceValidationException("User ID is required");
        }
        if (transaction.amount() == null || transaction.amount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new ComplianceValidationException("Amount must be positive");
        }
        if (transaction.transactionDate() == null) {
            throw new ComplianceValidationException("Transaction date is required");
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    static Map<String, Object> snapshot(RiskRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("transactionId", record.getTransactionId());
        data.put("userId", record.getUserId());
        data.put("riskScore", record.getRiskScore());
        data.put("monitoringType", record.getMonitoringType().name());
        data.put("requiresReview", record.isRequiresReview());
        data.put("queuedForReport", record.isQueuedForReport());
        data.put("evaluationFailed", record.isEvaluationFailed());
        data.put("reviewDecision", record.getReviewDecision() == null ? null : record.getReviewDecision().name());
        data.put("falsePositive", record.isFalsePositive());
        data.put("reportedToRegulator", record.isReportedToRegulator());
        return data;
    }

    private record Scored(RiskRecord record, boolean alreadyEvaluated) {}
}
