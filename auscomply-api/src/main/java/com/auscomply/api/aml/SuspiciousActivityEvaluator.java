package com.auscomply.api.aml;

import com.auscomply.api.config.AmlProperties;
import com.auscomply.core.domain.RiskRecord.MonitoringType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Composite heuristic over counterparty and category signals. Each signal adds 0.2;
 * when at least one signal is present, every other rule that fired adds 0.1.
 */
@Component
public class SuspiciousActivityEvaluator implements RiskRuleEvaluator {

    static final BigDecimal SIGNAL_WEIGHT = new BigDecimal("0.2");
    static final BigDecimal CORROBORATION_WEIGHT = new BigDecimal("0.1");
    static final BigDecimal ROUND_AMOUNT_MINIMUM = new BigDecimal("5000");
    static final BigDecimal ROUND_AMOUNT_UNIT = new BigDecimal("1000");

    @Override
    public MonitoringType getMonitoringType() {
        return MonitoringType.SUSPICIOUS_ACTIVITY;
    }

    @Override
    public boolean isComposite() {
        return true;
    }

    @Override
    public RuleOutcome evaluate(TransactionEvent transaction, EvaluationContext context) {
        AmlProperties props = context.properties();
        List<String> signals = new ArrayList<>();

        if (isLargeRoundAmount(transaction.amount())) {
            signals.add("Large round amount " + transaction.amount().toPlainString());
        }
        if (transaction.category() != null
                && props.getHighRiskCategories().contains(transaction.category().toUpperCase(Locale.ROOT))) {
            signals.add("High-risk category " + transaction.category());
        }
        if (transaction.international() || mentionsForeign(transaction.description())) {
            signals.add("International or foreign counterparty");
        }
        if (transaction.counterparty() != null && props.getWatchlistedCounterparties().stream()
                .anyMatch(w -> w.equalsIgnoreCase(transaction.counterparty()))) {
            signals.add("Watch-listed counterparty " + transaction.counterparty());
        }
        if (isDormant(transaction, context)) {
            signals.add("Activity on dormant account");
        }
        if (signals.isEmpty()) {
            return RuleOutcome.inactive(getMonitoringType());
        }

        long corroborating = context.primaryOutcomes().stream().filter(RuleOutcome::isActive).count();
        BigDecimal score = SIGNAL_WEIGHT.multiply(BigDecimal.valueOf(signals.size()))
                .add(CORROBORATION_WEIGHT.multiply(BigDecimal.valueOf(corroborating)));
        return new RuleOutcome(getMonitoringType(), score, signals);
    }

    static boolean isLargeRoundAmount(BigDecimal amount) {
        return amount.compareTo(ROUND_AMOUNT_MINIMUM) >= 0
                && amount.remainder(ROUND_AMOUNT_UNIT).signum() == 0;
    }

    private static boolean mentionsForeign(String description) {
        if (description == null) {
            return false;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        return lower.contains("international") || lower.contains("foreign");
    }

    private static boolean isDormant(TransactionEvent transaction, EvaluationContext context) {
        if (context.previousActivityAt() == null) {
            return false;
        }
        Duration idle = Duration.between(context.previousActivityAt(), transaction.transactionDate());
        return idle.compareTo(Duration.ofDays(context.properties().getDormantAfterDays())) > 0;
    }
}
