package com.auscomply.api.aml;

import com.auscomply.api.config.AmlProperties;
import com.auscomply.core.domain.RiskRecord.MonitoringType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Count and value of the user's transactions inside rolling windows, the current
 * transaction included.
 */
@Component
public class VelocityRuleEvaluator implements RiskRuleEvaluator {

    static final Duration DAY = Duration.ofHours(24);
    static final BigDecimal DAILY_COUNT_SCORE = new BigDecimal("0.5");
    static final BigDecimal BURST_SCORE = new BigDecimal("0.6");
    static final BigDecimal DAILY_AMOUNT_SCORE = new BigDecimal("0.6");

    @Override
    public MonitoringType getMonitoringType() {
        return MonitoringType.VELOCITY_CHECK;
    }

    @Override
    public RuleOutcome evaluate(TransactionEvent transaction, EvaluationContext context) {
        AmlProperties props = context.properties();
        BigDecimal score = BigDecimal.ZERO;
        List<String> factors = new ArrayList<>();

        int dailyCount = context.within(transaction.transactionDate(), DAY).size() + 1;
        if (dailyCount > props.getDailyTransactionLimit()) {
            score = score.max(DAILY_COUNT_SCORE);
            factors.add(dailyCount + " transactions in 24 hours");
        }

        Duration burstWindow = Duration.ofMinutes(props.getBurstWindowMinutes());
        int burstCount = context.within(transaction.transactionDate(), burstWindow).size() + 1;
        if (burstCount > props.getBurstTransactionLimit()) {
            score = score.max(BURST_SCORE);
            factors.add(burstCount + " transactions in " + props.getBurstWindowMinutes() + " minutes");
        }

        BigDecimal dailyAmount = context.sumWithin(transaction.transactionDate(), DAY).add(transaction.amount());
        if (dailyAmount.compareTo(props.getDailyAmountLimit()) > 0) {
            score = score.max(DAILY_AMOUNT_SCORE);
            factors.add("24 hour total " + dailyAmount.toPlainString() + " exceeds "
                    + props.getDailyAmountLimit().toPlainString());
        }
        return new RuleOutcome(getMonitoringType(), score, factors);
    }
}
