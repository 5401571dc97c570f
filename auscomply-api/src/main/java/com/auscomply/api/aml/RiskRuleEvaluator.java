package com.auscomply.api.aml;

import com.auscomply.core.domain.RiskRecord.MonitoringType;

/**
 * One AML monitoring rule. Implementations are stateless Spring beans.
 */
public interface RiskRuleEvaluator {

    /**
     * The monitoring type this evaluator reports under.
     */
    MonitoringType getMonitoringType();

    /**
     * Composite rules run after the primary ones and see their outcomes in the context.
     */
    default boolean isComposite() {
        return false;
    }

    RuleOutcome evaluate(TransactionEvent transaction, EvaluationContext context);
}
