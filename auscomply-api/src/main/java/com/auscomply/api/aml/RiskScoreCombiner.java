package com.auscomply.api.aml;

import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.domain.RiskRecord.MonitoringType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Combines rule outcomes into one score: the strongest outcome plus 0.1 for every
 * additional rule that fired, clamped to [0,1]. The monitoring type is that of the
 * strongest outcome; ties go to the more specific rule.
 */
public final class RiskScoreCombiner {

    static final BigDecimal ADDITIONAL_RULE_WEIGHT = new BigDecimal("0.1");

    // Earlier wins a tie
    private static final List<MonitoringType> TIE_PRECEDENCE = List.of(
            MonitoringType.PATTERN_DETECTION,
            MonitoringType.SUSPICIOUS_ACTIVITY,
            MonitoringType.VELOCITY_CHECK,
            MonitoringType.THRESHOLD_EXCEEDED);

    private RiskScoreCombiner() {}

    public static CombinedScore combine(List<RuleOutcome> outcomes) {
        List<RuleOutcome> active = outcomes.stream().filter(RuleOutcome::isActive).toList();
        if (active.isEmpty()) {
            return new CombinedScore(RiskRecord.clampScore(BigDecimal.ZERO),
                    MonitoringType.THRESHOLD_EXCEEDED, List.of());
        }

        RuleOutcome dominant = active.stream()
                .max(Comparator.comparing(RuleOutcome::score)
                        .thenComparing(o -> -TIE_PRECEDENCE.indexOf(o.type())))
                .orElseThrow();

        BigDecimal raw = dominant.score()
                .add(ADDITIONAL_RULE_WEIGHT.multiply(BigDecimal.valueOf(active.size() - 1L)));

        List<String> factors = new ArrayList<>();
        active.forEach(o -> factors.addAll(o.factors()));
        return new CombinedScore(RiskRecord.clampScore(raw), dominant.type(), factors);
    }

    public record CombinedScore(BigDecimal score, MonitoringType monitoringType, List<String> factors) {}
}
