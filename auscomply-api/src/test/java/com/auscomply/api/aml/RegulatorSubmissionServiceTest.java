package com.auscomply.api.aml;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.support.MutableClock;
import com.auscomply.api.support.TestClockConfiguration;
import com.auscomply.core.domain.RiskRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class RegulatorSubmissionServiceTest {

    private static final ActorContext ACTOR = ActorContext.system("regulator-submission");

    @Autowired
    private RiskScoringService scoringService;

    @Autowired
    private RegulatorSubmissionService submissionService;

    @Autowired
    private AmlAlertService alertService;

    @Autowired
    private MutableClock clock;

    @MockBean
    private RegulatorGateway regulatorGateway;

    @Test
    void failedSubmissionIsRecordedAndRetriedOnTheNextRun() {
        Instant start = Instant.parse("2024-06-03T00:00:00Z");
        clock.setInstant(start.plus(Duration.ofDays(5)));
        RiskRecord queued = queueHighRiskRecord(start);
        assertTrue(queued.isQueuedForReport());

        when(regulatorGateway.submitSuspiciousMatter(any()))
                .thenThrow(new RegulatorGateway.RegulatorSubmissionException("AUSTRAC endpoint unavailable"));

        RegulatorSubmissionService.SubmissionRun failedRun = submissionService.submitPending(ACTOR);

        assertTrue(failedRun.failed() >= 1);
        RiskRecord afterFailure = alertService.getRecord(queued.getId());
        assertFalse(afterFailure.isReportedToRegulator());
        assertEquals(1, afterFailure.getSubmissionAttempts());
        assertTrue(afterFailure.getLastSubmissionError().contains("AUSTRAC endpoint unavailable"));
        assertTrue(afterFailure.isQueuedForReport());

        when(regulatorGateway.submitSuspiciousMatter(any())).thenReturn("SMR-TEST-0001");

        RegulatorSubmissionService.SubmissionRun retry = submissionService.submitPending(ACTOR);

        assertTrue(retry.submitted() >= 1);
        RiskRecord reported = alertService.getRecord(queued.getId());
        assertTrue(reported.isReportedToRegulator());
        assertEquals("SMR-TEST-0001", reported.getReportReference());
        assertNotNull(reported.getReportedAt());
    }

    private RiskRecord queueHighRiskRecord(Instant start) {
        String userId = "smr-user-" + UUID.randomUUID();
        RiskRecord last = null;
        String[] amounts = {"9100", "9500", "9900", "9300"};
        for (int day = 0; day < amounts.length; day++) {
            last = scoringService.evaluate(new TransactionEvent("tx-" + UUID.randomUUID(), userId,
                    new BigDecimal(amounts[day]), "AUD", start.plus(Duration.ofDays(day)),
                    null, "Branch deposit", null, false, null), ACTOR);
        }
        return last;
    }
}
