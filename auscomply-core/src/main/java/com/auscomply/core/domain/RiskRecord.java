package com.auscomply.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AML/CTF risk assessment of a single transaction.
 * Created once per evaluated transaction; afterwards only the review and
 * regulator-submission fields change.
 */
@Entity
@Table(name = "risk_records", indexes = {
    @Index(name = "idx_risk_user_date", columnList = "user_id, transaction_date"),
    @Index(name = "idx_risk_review", columnList = "requires_review, reviewed_at"),
    @Index(name = "idx_risk_created", columnList = "created_at")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uk_risk_transaction", columnNames = "transaction_id")
})
public class RiskRecord {

    public static final int SCORE_SCALE = 3;

    /** Scores at or above this always go to manual review, whatever the configured threshold. */
    public static final BigDecimal HIGH_RISK_SCORE = new BigDecimal("0.75");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "transaction_id", nullable = false, updatable = false)
    private String transactionId;

    @NotNull
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @NotNull
    @Column(nullable = false, precision = 19, scale = 2, updatable = false)
    private BigDecimal amount;

    @NotNull
    @Column(nullable = false, length = 3, updatable = false)
    private String currency;

    @NotNull
    @Column(name = "transaction_date", nullable = false, updatable = false)
    private Instant transactionDate;

    @Column(updatable = false)
    private String category;

    @Column(name = "merchant_name", updatable = false)
    private String merchantName;

    @Column(nullable = false, updatable = false)
    private boolean international;

    @NotNull
    @Column(name = "risk_score", nullable = false, precision = 4, scale = 3, updatable = false)
    private BigDecimal riskScore;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "monitoring_type", nullable = false, updatable = false)
    private MonitoringType monitoringType;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "risk_factors", columnDefinition = "TEXT", updatable = false)
    private List<String> riskFactors = new ArrayList<>();

    @Column(name = "requires_review", nullable = false, updatable = false)
    private boolean requiresReview;

    @Column(name = "evaluation_failed", nullable = false, updatable = false)
    private boolean evaluationFailed;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "reviewed_by")
    private String reviewedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "review_decision")
    private ReviewDecision reviewDecision;

    @Column(name = "review_notes", columnDefinition = "TEXT")
    private String reviewNotes;

    @Column(name = "false_positive", nullable = false)
    private boolean falsePositive;

    @Column(name = "queued_for_report", nullable = false)
    private boolean queuedForReport;

    @Column(name = "reported_to_regulator", nullable = false)
    private boolean reportedToRegulator;

    @Column(name = "report_reference")
    private String reportReference;

    @Column(name = "reported_at")
    private Instant reportedAt;

    @Column(name = "submission_attempts", nullable = false)
    private int submissionAttempts;

    @Column(name = "last_submission_error", columnDefinition = "TEXT")
    private String lastSubmissionError;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    protected RiskRecord() {}

    /**
     * Creates an assessed record. The score is clamped to [0,1]; review and
     * regulator-queue flags are derived from it so they can never disagree. A score
     * of {@link #HIGH_RISK_SCORE} or more, or one queued for the regulator, is always
     * reviewed even when {@code reviewThreshold} is set higher.
     */
    public static RiskRecord assessed(
            TransactionFacts facts,
            BigDecimal rawScore,
            MonitoringType monitoringType,
            List<String> riskFactors,
            BigDecimal reviewThreshold,
            BigDecimal reportingThreshold,
            Instant now) {

        var record = fromFacts(facts, now);
        record.riskScore = clampScore(rawScore);
        record.monitoringType = monitoringType;
        record.riskFactors = new ArrayList<>(riskFactors);
        record.queuedForReport = record.riskScore.compareTo(reportingThreshold) >= 0;
        record.requiresReview = record.riskScore.compareTo(reviewThreshold.min(HIGH_RISK_SCORE)) >= 0
                || record.queuedForReport;
        return record;
    }

    /**
     * Creates the fail-safe record used when evaluation could not complete.
     * The transaction is always routed to manual review.
     */
    public static RiskRecord failSafe(
            TransactionFacts facts,
            BigDecimal reviewThreshold,
            String failure,
            Instant now) {

        var record = fromFacts(facts, now);
        record.riskScore = clampScore(reviewThreshold);
        record.monitoringType = MonitoringType.SUSPICIOUS_ACTIVITY;
        record.riskFactors = new ArrayList<>(List.of("Evaluation failed: " + failure));
        record.requiresReview = true;
        record.evaluationFailed = true;
        return record;
    }

    private static RiskRecord fromFacts(TransactionFacts facts, Instant now) {
        var record = new RiskRecord();
        record.transactionId = facts.transactionId();
        record.userId = facts.userId();
        record.amount = facts.amount().setScale(2, RoundingMode.HALF_UP);
        record.currency = facts.currency();
        record.transactionDate = facts.transactionDate();
        record.category = facts.category();
        record.merchantName = facts.merchantName();
        record.international = facts.international();
        record.createdAt = now;
        return record;
    }

    public static BigDecimal clampScore(BigDecimal score) {
        if (score == null || score.signum() < 0) {
            return BigDecimal.ZERO.setScale(SCORE_SCALE);
        }
        if (score.compareTo(BigDecimal.ONE) > 0) {
            return BigDecimal.ONE.setScale(SCORE_SCALE);
        }
        return score.setScale(SCORE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Records the analyst decision. A record can be reviewed once.
     */
    public void review(String reviewer, ReviewDecision decision, String notes, Instant now) {
        if (this.reviewedAt != null) {
            throw new IllegalStateException("Risk record already reviewed at " + reviewedAt);
        }
        this.reviewedAt = now;
        this.reviewedBy = reviewer;
        this.reviewDecision = decision;
        this.reviewNotes = notes;
        if (decision == ReviewDecision.FALSE_POSITIVE) {
            this.falsePositive = true;
        } else if (decision == ReviewDecision.REPORT) {
            this.queuedForReport = true;
        }
    }

    public boolean isPendingReview() {
        return requiresReview && reviewedAt == null && !falsePositive;
    }

    // Getters
    public UUID getId() { return id; }
    public String getTransactionId() { return transactionId; }
    public String getUserId() { return userId; }
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public Instant getTransactionDate() { return transactionDate; }
    public String getCategory() { return category; }
    public String getMerchantName() { return merchantName; }
    public boolean isInternational() { return international; }
    public BigDecimal getRiskScore() { return riskScore; }
    public MonitoringType getMonitoringType() { return monitoringType; }
    public List<String> getRiskFactors() { return List.copyOf(riskFactors); }
    public boolean isRequiresReview() { return requiresReview; }
    public boolean isEvaluationFailed() { return evaluationFailed; }
    public Instant getReviewedAt() { return reviewedAt; }
    public String getReviewedBy() { return reviewedBy; }
    public ReviewDecision getReviewDecision() { return reviewDecision; }
    public String getReviewNotes() { return reviewNotes; }
    public boolean isFalsePositive() { return falsePositive; }
    public boolean isQueuedForReport() { return queuedForReport; }
    public boolean isReportedToRegulator() { return reportedToRegulator; }
    public String getReportReference() { return reportReference; }
    public Instant getReportedAt() { return reportedAt; }
    public int getSubmissionAttempts() { return submissionAttempts; }
    public String getLastSubmissionError() { return lastSubmissionError; }
    public Instant getCreatedAt() { return createdAt; }

    public enum MonitoringType {
        THRESHOLD_EXCEEDED,
        VELOCITY_CHECK,
        PATTERN_DETECTION,
        SUSPICIOUS_ACTIVITY
    }

    public enum ReviewDecision {
        CLEAR,
        REPORT,
        FALSE_POSITIVE
    }

    /**
     * Immutable transaction attributes copied onto the record.
     */
    public record TransactionFacts(
            String transactionId,
            String userId,
            BigDecimal amount,
            String currency,
            Instant transactionDate,
            String category,
            String merchantName,
            boolean international
    ) {}
}
