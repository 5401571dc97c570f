package com.auscomply.api.aml;

import com.auscomply.core.domain.RiskRecord.MonitoringType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Absolute amount limits: the cash-equivalent threshold report limit and the
 * lower limit for international transfers.
 */
@Component
public class ThresholdRuleEvaluator implements RiskRuleEvaluator {

    static final BigDecimal CASH_THRESHOLD_SCORE = new BigDecimal("0.6");
    static final BigDecimal INTERNATIONAL_SCORE = new BigDecimal("0.5");

    @Override
    public MonitoringType getMonitoringType() {
        return MonitoringType.THRESHOLD_EXCEEDED;
    }

    @Override
    public RuleOutcome evaluate(TransactionEvent transaction, EvaluationContext context) {
        BigDecimal amount = transaction.amount();
        BigDecimal score = BigDecimal.ZERO;
        List<String> factors = new ArrayList<>();

        if (amount.compareTo(context.properties().getCashThreshold()) >= 0) {
            score = score.max(CASH_THRESHOLD_SCORE);
            factors.add("Amount " + amount.toPlainString() + " meets threshold transaction limit "
                    + context.properties().getCashThreshold().toPlainString());
        }
        if (transaction.international()
                && amount.compareTo(context.properties().getInternationalThreshold()) >= 0) {
            score = score.max(INTERNATIONAL_SCORE);
            factors.add("International transfer of " + amount.toPlainString());
        }
        return new RuleOutcome(getMonitoringType(), score, factors);
    }
}
