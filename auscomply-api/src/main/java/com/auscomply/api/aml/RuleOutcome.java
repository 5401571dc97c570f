package com.auscomply.api.aml;

import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.domain.RiskRecord.MonitoringType;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of one rule evaluator. A zero score means the rule did not fire.
 */
public record RuleOutcome(MonitoringType type, BigDecimal score, List<String> factors) {

    public RuleOutcome {
        score = RiskRecord.clampScore(score);
        factors = factors == null ? List.of() : List.copyOf(factors);
    }

    public static RuleOutcome inactive(MonitoringType type) {
        return new RuleOutcome(type, BigDecimal.ZERO, List.of());
    }

    public boolean isActive() {
        return score.signum() > 0;
    }
}
