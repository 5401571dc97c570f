package com.auscomply.api.aml;

import com.auscomply.api.config.AmlProperties;
import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.domain.RiskRecord.MonitoringType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Structuring: repeated amounts just under the threshold transaction limit.
 * Fires when the current amount is inside [threshold - margin, threshold) and at least
 * one earlier transaction of the user in the structuring window is in the same band.
 */
@Component
public class StructuringPatternEvaluator implements RiskRuleEvaluator {

    static final BigDecimal REPEATED_SCORE = new BigDecimal("0.8");
    static final BigDecimal SUSTAINED_SCORE = new BigDecimal("0.95");
    static final int SUSTAINED_PRIOR_COUNT = 3;

    @Override
    public MonitoringType getMonitoringType() {
        return MonitoringType.PATTERN_DETECTION;
    }

    @Override
    public RuleOutcome evaluate(TransactionEvent transaction, EvaluationContext context) {
        AmlProperties props = context.properties();
        if (!isNearThreshold(transaction.amount(), props)) {
            return RuleOutcome.inactive(getMonitoringType());
        }

        Duration window = Duration.ofDays(props.getStructuringWindowDays());
        List<RiskRecord> nearThreshold = context.within(transaction.transactionDate(), window).stream()
                .filter(r -> isNearThreshold(r.getAmount(), props))
                .toList();
        if (nearThreshold.isEmpty()) {
            return RuleOutcome.inactive(getMonitoringType());
        }

        BigDecimal score = nearThreshold.size() >= SUSTAINED_PRIOR_COUNT ? SUSTAINED_SCORE : REPEATED_SCORE;
        String factor = "Possible structuring: " + (nearThreshold.size() + 1)
                + " transactions just below " + props.getCashThreshold().toPlainString()
                + " within " + props.getStructuringWindowDays() + " days";
        return new RuleOutcome(getMonitoringType(), score, List.of(factor));
    }

    static boolean isNearThreshold(BigDecimal amount, AmlProperties props) {
        BigDecimal threshold = props.getCashThreshold();
        BigDecimal lower = threshold.subtract(props.getStructuringMargin());
        return amount.compareTo(lower) >= 0 && amount.compareTo(threshold) < 0;
    }
}
