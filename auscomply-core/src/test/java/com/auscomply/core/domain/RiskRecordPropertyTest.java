package com.auscomply.core.domain;

import com.auscomply.core.domain.RiskRecord.MonitoringType;
import com.auscomply.core.domain.RiskRecord.ReviewDecision;
import com.auscomply.core.domain.RiskRecord.TransactionFacts;
import net.jqwik.api.*;
import net.jqwik.api.constraints.BigRange;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for risk score clamping and the flags derived from it.
 */
class RiskRecordPropertyTest {

    private static final BigDecimal REVIEW = new BigDecimal("0.5");
    private static final BigDecimal REPORTING = new BigDecimal("0.85");
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Property
    void clampedScoreStaysWithinUnitInterval(@ForAll @BigRange(min = "-5", max = "5") BigDecimal raw) {
        BigDecimal clamped = RiskRecord.clampScore(raw);
        assertThat(clamped).isBetween(BigDecimal.ZERO, BigDecimal.ONE);
        assertThat(clamped.scale()).isEqualTo(3);
    }

    @Property
    void flagsFollowTheScore(@ForAll @BigRange(min = "0", max = "1") BigDecimal raw) {
        RiskRecord record = RiskRecord.assessed(facts(), raw, MonitoringType.THRESHOLD_EXCEEDED,
                List.of("factor"), REVIEW, REPORTING, NOW);

        assertThat(record.isRequiresReview()).isEqualTo(record.getRiskScore().compareTo(REVIEW) >= 0);
        assertThat(record.isQueuedForReport()).isEqualTo(record.getRiskScore().compareTo(REPORTING) >= 0);
        if (record.isQueuedForReport()) {
            assertThat(record.isRequiresReview()).isTrue();
        }
    }

    @Property
    void highRiskScoresNeedReviewUnderAnyThreshold(@ForAll @BigRange(min = "0.75", max = "1") BigDecimal raw,
                                                  @ForAll @BigRange(min = "0", max = "1") BigDecimal reviewThreshold) {
        RiskRecord record = RiskRecord.assessed(facts(), raw, MonitoringType.PATTERN_DETECTION,
                List.of("factor"), reviewThreshold, BigDecimal.ONE, NOW);

        assertThat(record.isRequiresReview()).isTrue();
    }

    @Example
    void lenientReviewThresholdStillFlagsHighRisk() {
        RiskRecord flagged = RiskRecord.assessed(facts(), new BigDecimal("0.78"), MonitoringType.THRESHOLD_EXCEEDED,
                List.of(), new BigDecimal("0.8"), new BigDecimal("0.9"), NOW);
        RiskRecord belowBoth = RiskRecord.assessed(facts(), new BigDecimal("0.7"), MonitoringType.THRESHOLD_EXCEEDED,
                List.of(), new BigDecimal("0.8"), new BigDecimal("0.9"), NOW);

        assertThat(flagged.isRequiresReview()).isTrue();
        assertThat(belowBoth.isRequiresReview()).isFalse();
    }

    @Example
    void failSafeRecordAlwaysNeedsReview() {
        RiskRecord record = RiskRecord.failSafe(facts(), REVIEW, "timeout", NOW);

        assertThat(record.isRequiresReview()).isTrue();
        assertThat(record.isEvaluationFailed()).isTrue();
        assertThat(record.getRiskScore()).isEqualByComparingTo(REVIEW);
        assertThat(record.getRiskFactors()).containsExactly("Evaluation failed: timeout");
    }

    @Example
    void recordCanBeReviewedOnce() {
        RiskRecord record = RiskRecord.assessed(facts(), new BigDecimal("0.8"), MonitoringType.PATTERN_DETECTION,
                List.of(), REVIEW, REPORTING, NOW);
        record.review("analyst", ReviewDecision.FALSE_POSITIVE, "known payee", NOW);

        assertThat(record.isFalsePositive()).isTrue();
        assertThat(record.isPendingReview()).isFalse();
        assertThatThrownBy(() -> record.review("analyst", ReviewDecision.CLEAR, null, NOW))
                .isInstanceOf(IllegalStateException.class);
    }

    @Example
    void reportDecisionQueuesForRegulator() {
        RiskRecord record = RiskRecord.assessed(facts(), new BigDecimal("0.6"), MonitoringType.VELOCITY_CHECK,
                List.of(), REVIEW, REPORTING, NOW);
        assertThat(record.isQueuedForReport()).isFalse();

        record.review("analyst", ReviewDecision.REPORT, null, NOW);
        assertThat(record.isQueuedForReport()).isTrue();
    }

    private static TransactionFacts facts() {
        return new TransactionFacts("txn-1", "user-1", new BigDecimal("120.456"), "AUD", NOW,
                "GROCERIES", "Corner Store", false);
    }
}
