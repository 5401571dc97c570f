package com.auscomply.api.aml;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditQuery;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.support.MutableClock;
import com.auscomply.api.support.TestClockConfiguration;
import com.auscomply.core.domain.AuditLogEntry;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.domain.RiskRecord.MonitoringType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A rule that blows up must not let the transaction through unreviewed.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import({TestClockConfiguration.class, RiskScoringFailSafeTest.FaultyRuleConfiguration.class})
class RiskScoringFailSafeTest {

    static final String FAULTY_MERCHANT = "Faulty Merchant";

    @Autowired
    private RiskScoringService scoringService;

    @Autowired
    private AuditTrailService auditTrailService;

    @Autowired
    private MutableClock clock;

    @Test
    void failingRuleProducesReviewRecord() {
        clock.setInstant(Instant.parse("2024-04-02T00:00:00Z"));
        String transactionId = "tx-" + UUID.randomUUID();
        TransactionEvent event = new TransactionEvent(transactionId, "failsafe-" + UUID.randomUUID(),
                new BigDecimal("15.00"), "AUD", Instant.parse("2024-04-01T09:00:00Z"),
                null, FAULTY_MERCHANT, null, false, null);

        RiskRecord record = scoringService.evaluate(event, new ActorContext("aml-test", null, null));

        assertTrue(record.isEvaluationFailed());
        assertTrue(record.isRequiresReview());
        assertEquals(MonitoringType.SUSPICIOUS_ACTIVITY, record.getMonitoringType());
        assertTrue(record.getRiskFactors().get(0).contains("rule engine unavailable"));

        List<AuditLogEntry> audit = auditTrailService.query(new AuditQuery(null, null, null,
                Set.of(OperationType.RISK_EVALUATION_FAILED), "RiskRecord", record.getId().toString(), false),
                0, 10).getContent();
        assertEquals(1, audit.size());
    }

    @Test
    void otherTransactionsAreScoredNormally() {
        clock.setInstant(Instant.parse("2024-04-02T00:00:00Z"));
        TransactionEvent event = new TransactionEvent("tx-" + UUID.randomUUID(), "failsafe-" + UUID.randomUUID(),
                new BigDecimal("15.00"), "AUD", Instant.parse("2024-04-01T09:00:00Z"),
                null, "Cafe", null, false, null);

        RiskRecord record = scoringService.evaluate(event, new ActorContext("aml-test", null, null));

        assertFalse(record.isEvaluationFailed());
        assertFalse(record.isRequiresReview());
    }

    @TestConfiguration(proxyBeanMethods = false)
    static class FaultyRuleConfiguration {

        @Bean
        RiskRuleEvaluator faultyRuleEvaluator() {
            return new RiskRuleEvaluator() {
                @Override
                public MonitoringType getMonitoringType() {
                    return MonitoringType.SUSPICIOUS_ACTIVITY;
                }

                @Override
                public RuleOutcome evaluate(TransactionEvent transaction, EvaluationContext context) {
                    if (FAULTY_MERCHANT.equals(transaction.merchantName())) {
                        throw new IllegalStateException("rule engine unavailable");
                    }
                    return RuleOutcome.inactive(getMonitoringType());
                }
            };
        }
    }
}
