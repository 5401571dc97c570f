package com.auscomply.api.aml;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.config.AmlProperties;
import com.auscomply.api.error.AuditPersistenceException;
import com.auscomply.core.domain.RiskRecord;
import com.auscomply.core.domain.RiskRecord.MonitoringType;
import com.auscomply.core.domain.RiskRecord.TransactionFacts;
import com.auscomply.core.repository.RiskRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Batch behaviour when the audit trail is unavailable.
 */
class RegulatorSubmissionBatchTest {

    private static final Instant NOW = Instant.parse("2024-06-20T00:00:00Z");
    private static final ActorContext ACTOR = ActorContext.system("regulator-submission");

    private RiskRecordRepository riskRepository;
    private RegulatorGateway gateway;
    private AuditTrailService auditTrailService;
    private RegulatorSubmissionService submissionService;

    @BeforeEach
    void setUp() {
        riskRepository = mock(RiskRecordRepository.class);
        gateway = mock(RegulatorGateway.class);
        auditTrailService = mock(AuditTrailService.class);
        submissionService = new RegulatorSubmissionService(riskRepository, gateway, auditTrailService,
                new AmlProperties(), mock(PlatformTransactionManager.class),
                Clock.fixed(NOW, ZoneOffset.UTC), new SimpleMeterRegistry());
    }

    @Test
    void auditFailureDoesNotAbandonTheRestOfTheBatch() {
        List<RiskRecord> queued = List.of(queued("smr-1"), queued("smr-2"), queued("smr-3"));
        when(riskRepository.findAwaitingSubmission(anyInt(), any())).thenReturn(queued);
        when(riskRepository.markReported(any(), any(), any())).thenReturn(1);
        when(gateway.submitSuspiciousMatter(any())).thenReturn("SMR-1", "SMR-2", "SMR-3");
        when(auditTrailService.record(any(AuditEvent.class)))
                .thenThrow(new AuditPersistenceException("audit store down",
                        new DataAccessResourceFailureException("connection refused")))
                .thenReturn(null);

        RegulatorSubmissionService.SubmissionRun run = submissionService.submitPending(ACTOR);

        assertEquals(3, run.attempted());
        assertEquals(3, run.submitted());
        assertEquals(0, run.failed());
        assertEquals(1, run.auditFailures());
        verify(gateway, times(3)).submitSuspiciousMatter(any());
        verify(riskRepository, times(3)).markReported(any(), any(), eq(NOW));
    }

    @Test
    void auditFailureAfterGatewayErrorStillRecordsTheAttempt() {
        when(riskRepository.findAwaitingSubmission(anyInt(), any()))
                .thenReturn(List.of(queued("smr-4"), queued("smr-5")));
        when(gateway.submitSuspiciousMatter(any()))
                .thenThrow(new RegulatorGateway.RegulatorSubmissionException("timeout"))
                .thenReturn("SMR-5");
        when(riskRepository.markReported(any(), any(), any())).thenReturn(1);
        when(auditTrailService.record(any(AuditEvent.class)))
                .thenThrow(new AuditPersistenceException("audit store down",
                        new DataAccessResourceFailureException("connection refused")))
                .thenReturn(null);

        RegulatorSubmissionService.SubmissionRun run = submissionService.submitPending(ACTOR);

        assertEquals(1, run.submitted());
        assertEquals(1, run.failed());
        assertEquals(1, run.auditFailures());
        verify(riskRepository).recordSubmissionFailure(any(), contains("timeout"));
    }

    private static RiskRecord queued(String transactionId) {
        TransactionFacts facts = new TransactionFacts(transactionId, "smr-user", new BigDecimal("9900.00"), "AUD",
                NOW.minusSeconds(3600), null, "Branch deposit", false);
        return RiskRecord.assessed(facts, new BigDecimal("0.9"), MonitoringType.PATTERN_DETECTION,
                List.of("Possible structuring"), new BigDecimal("0.5"), new BigDecimal("0.85"), NOW);
    }
}
