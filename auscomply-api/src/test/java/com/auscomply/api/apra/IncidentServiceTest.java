package com.auscomply.api.apra;

import com.auscomply.api.apra.IncidentService.NewIncident;
import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.StateConflictException;
import com.auscomply.api.support.MutableClock;
import com.auscomply.api.support.TestClockConfiguration;
import com.auscomply.core.domain.IncidentReport;
import com.auscomply.core.domain.IncidentReport.IncidentStatus;
import com.auscomply.core.domain.IncidentReport.IncidentType;
import com.auscomply.core.domain.IncidentReport.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class IncidentServiceTest {

    private static final Instant DETECTED = Instant.parse("2024-09-10T22:15:00Z");
    private static final ActorContext ACTOR = new ActorContext("risk-officer", "10.2.3.4", "junit");

    @Autowired
    private IncidentService incidentService;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.setInstant(DETECTED.plus(Duration.ofHours(2)));
    }

    @Test
    void breachLifecycleEndsReportedToBothRegulators() {
        IncidentReport incident = incidentService.createIncident(breach(DETECTED), ACTOR);
        assertEquals(IncidentStatus.OPEN, incident.getStatus());
        assertTrue(incident.requiresRegulatorNotification());

        incidentService.updateStatus(incident.getId(), IncidentStatus.INVESTIGATING, null, ACTOR);
        clock.setInstant(DETECTED.plus(Duration.ofHours(20)));
        IncidentReport resolved = incidentService.updateStatus(incident.getId(), IncidentStatus.RESOLVED,
                "Misconfigured storage bucket", ACTOR);
        assertEquals(DETECTED.plus(Duration.ofHours(20)), resolved.getResolvedAt());
        assertEquals("Misconfigured storage bucket", resolved.getRootCause());

        clock.setInstant(Instant.parse("2024-09-12T01:00:00Z"));
        IncidentReport reported = incidentService.submitToApra(incident.getId(), ACTOR);

        String suffix = "20240912-" + incident.getId().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        assertEquals("APRA-" + suffix, reported.getApraReference());
        assertEquals("OAIC-NDB-" + suffix, reported.getOaicReference());
        assertTrue(reported.isReportedToOaic());
        assertTrue(reported.isReportedWithinWindow());
    }

    @Test
    void reportingTwiceConflicts() {
        IncidentReport incident = incidentService.createIncident(outage(DETECTED), ACTOR);
        incidentService.submitToApra(incident.getId(), ACTOR);

        assertThrows(StateConflictException.class, () -> incidentService.submitToApra(incident.getId(), ACTOR));
    }

    @Test
    void outageReportHasNoOaicReference() {
        IncidentReport incident = incidentService.createIncident(outage(DETECTED), ACTOR);

        IncidentReport reported = incidentService.submitToApra(incident.getId(), ACTOR);

        assertNull(reported.getOaicReference());
        assertFalse(reported.isReportedToOaic());
    }

    @Test
    void lateReportIsOutsideTheWindow() {
        IncidentReport incident = incidentService.createIncident(breach(DETECTED), ACTOR);
        clock.setInstant(DETECTED.plus(Duration.ofHours(73)));

        IncidentReport reported = incidentService.submitToApra(incident.getId(), ACTOR);

        assertFalse(reported.isReportedWithinWindow());
    }

    @Test
    void statusCannotGoBackwards() {
        IncidentReport incident = incidentService.createIncident(outage(DETECTED), ACTOR);
        incidentService.updateStatus(incident.getId(), IncidentStatus.CONTAINED, null, ACTOR);

        assertThrows(StateConflictException.class,
                () -> incidentService.updateStatus(incident.getId(), IncidentStatus.INVESTIGATING, null, ACTOR));
        assertThrows(StateConflictException.class,
                () -> incidentService.updateStatus(incident.getId(), IncidentStatus.CONTAINED, null, ACTOR));
    }

    @Test
    void detectionInTheFutureIsRejected() {
        assertThrows(ComplianceValidationException.class,
                () -> incidentService.createIncident(outage(DETECTED.plus(Duration.ofDays(1))), ACTOR));
    }

    @Test
    void listingFiltersByDetectionTime() {
        IncidentReport incident = incidentService.createIncident(outage(DETECTED), ACTOR);

        List<IncidentReport> inWindow = incidentService.listIncidents(
                DETECTED.minus(Duration.ofMinutes(1)), DETECTED.plus(Duration.ofMinutes(1)));
        List<IncidentReport> before = incidentService.listIncidents(
                DETECTED.minus(Duration.ofDays(2)), DETECTED.minus(Duration.ofDays(1)));

        assertTrue(inWindow.stream().anyMatch(i -> i.getId().equals(incident.getId())));
        assertTrue(before.stream().noneMatch(i -> i.getId().equals(incident.getId())));
        assertThrows(ComplianceValidationException.class, () -> incidentService.listIncidents(DETECTED, DETECTED));
    }

    @Test
    void dataResidencyIsCompliantWithDefaultRegions() {
        assertTrue(incidentService.checkDataResidency().compliant());
    }

    private static NewIncident breach(Instant detectedAt) {
        return new NewIncident(IncidentType.DATA_BREACH, Severity.HIGH, "Customer records exposed",
                "Public bucket contained statements", List.of("document-store"), true, false, detectedAt);
    }

    private static NewIncident outage(Instant detectedAt) {
        return new NewIncident(IncidentType.SYSTEM_OUTAGE, Severity.MEDIUM, "Payments API outage",
                null, List.of("payments-api"), false, true, detectedAt);
    }
}
