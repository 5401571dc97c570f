package com.auscomply.api.aml;

import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.domain.RiskRecord.MonitoringType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.BigRange;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for combining rule outcomes into one risk score.
 */
class RiskScoreCombinerPropertyTest {

    @Property
    void combinedScoreStaysWithinUnitInterval(@ForAll("outcomes") List<RuleOutcome> outcomes) {
        RiskScoreCombiner.CombinedScore combined = RiskScoreCombiner.combine(outcomes);

        assertThat(combined.score()).isBetween(BigDecimal.ZERO, BigDecimal.ONE);
    }

    @Property
    void combinedScoreIsNeverBelowTheStrongestRule(@ForAll("nonEmptyOutcomes") List<RuleOutcome> outcomes) {
        BigDecimal strongest = outcomes.stream().map(RuleOutcome::score).max(BigDecimal::compareTo).orElseThrow();

        assertThat(RiskScoreCombiner.combine(outcomes).score()).isGreaterThanOrEqualTo(strongest);
    }

    @Property
    void singleHighRiskRuleIsEnoughForReview(
            @ForAll MonitoringType type,
            @ForAll @BigRange(min = "0.75", max = "1") BigDecimal score) {

        RiskScoreCombiner.CombinedScore combined = RiskScoreCombiner.combine(List.of(
                new RuleOutcome(type, score, List.of("fired")),
                RuleOutcome.inactive(MonitoringType.VELOCITY_CHECK)));

        assertThat(combined.score()).isGreaterThanOrEqualTo(new BigDecimal("0.75"));
        assertThat(combined.monitoringType()).isEqualTo(type);
        assertThat(combined.factors()).containsExactly("fired");
    }

    @Property
    void eachAdditionalRuleAddsOneTenth(@ForAll @BigRange(min = "0.1", max = "0.5") BigDecimal top) {
        RiskScoreCombiner.CombinedScore combined = RiskScoreCombiner.combine(List.of(
                new RuleOutcome(MonitoringType.THRESHOLD_EXCEEDED, top, List.of("a")),
                new RuleOutcome(MonitoringType.VELOCITY_CHECK, new BigDecimal("0.05"), List.of("b"))));

        assertThat(combined.score())
                .isEqualByComparingTo(RiskRecord.clampScore(top).add(RiskScoreCombiner.ADDITIONAL_RULE_WEIGHT));
        assertThat(combined.factors()).containsExactly("a", "b");
    }

    @Example
    void noActiveRuleGivesZeroScore() {
        RiskScoreCombiner.CombinedScore combined = RiskScoreCombiner.combine(List.of(
                RuleOutcome.inactive(MonitoringType.THRESHOLD_EXCEEDED),
                RuleOutcome.inactive(MonitoringType.PATTERN_DETECTION)));

        assertThat(combined.score()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(combined.factors()).isEmpty();
    }

    @Example
    void tieGoesToTheMoreSpecificRule() {
        RiskScoreCombiner.CombinedScore combined = RiskScoreCombiner.combine(List.of(
                new RuleOutcome(MonitoringType.THRESHOLD_EXCEEDED, new BigDecimal("0.6"), List.of()),
                new RuleOutcome(MonitoringType.PATTERN_DETECTION, new BigDecimal("0.6"), List.of())));

        assertThat(combined.monitoringType()).isEqualTo(MonitoringType.PATTERN_DETECTION);
        assertThat(combined.score()).isEqualByComparingTo("0.7");
    }

    @Provide
    Arbitrary<List<RuleOutcome>> outcomes() {
        Arbitrary<RuleOutcome> outcome = Combinators.combine(
                Arbitraries.of(MonitoringType.class),
                Arbitraries.bigDecimals().between(BigDecimal.ZERO, BigDecimal.ONE).ofScale(3)
        ).as((type, score) -> new RuleOutcome(type, score, List.of(type.name())));
        return outcome.list().ofMaxSize(6);
    }

    @Provide
    Arbitrary<List<RuleOutcome>> nonEmptyOutcomes() {
        return outcomes().filter(list -> !list.isEmpty());
    }
}
