package com.auscomply.api.aml;

import com.auscomply.api.config.AmlProperties;
import com.auscomply.core.domain.RiskRecord;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Everything a rule evaluator may look at besides the transaction: the user's prior
 * transactions inside the longest rolling window, their last activity before this one,
 * and, for composite rules, the outcomes of the primary rules.
 */
public record EvaluationContext(
        List<RiskRecord> history,
        Instant previousActivityAt,
        AmlProperties properties,
        List<RuleOutcome> primaryOutcomes
) {

    public EvaluationContext {
        history = List.copyOf(history);
        primaryOutcomes = primaryOutcomes == null ? List.of() : List.copyOf(primaryOutcomes);
    }

    public EvaluationContext withPrimaryOutcomes(List<RuleOutcome> outcomes) {
        return new EvaluationContext(history, previousActivityAt, properties, outcomes);
    }

    /**
     * Prior transactions with a date in (reference - window, reference].
     */
    public List<RiskRecord> within(Instant reference, Duration window) {
        Instant from = reference.minus(window);
        return history.stream()
                .filter(r -> r.getTransactionDate().isAfter(from) && !r.getTransactionDate().isAfter(reference))
                .toList();
    }

    public BigDecimal sumWithin(Instant reference, Duration window) {
        return within(reference, window).stream()
                .map(RiskRecord::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
