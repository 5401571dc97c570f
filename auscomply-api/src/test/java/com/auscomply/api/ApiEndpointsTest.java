package com.auscomply.api;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.support.MutableClock;
import com.auscomply.api.support.TestClockConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class ApiEndpointsTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.setInstant(Instant.parse("2021-09-10T00:00:00Z"));
    }

    @Test
    void classifiesGstTransactionAndRejectsDuplicate() throws Exception {
        String body = gstBody("api-gst-" + UUID.randomUUID());

        mockMvc.perform(post("/api/v1/gst/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(ActorContext.ACTOR_HEADER, "bookkeeper-1")
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.gstAmount").value(10.0))
                .andExpect(jsonPath("$.basReportingCode").value("G1"))
                .andExpect(jsonPath("$.taxPeriod").value("2021-09"))
                .andExpect(jsonPath("$.validated").value(true));

        mockMvc.perform(post("/api/v1/gst/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("CONFLICT_001"));
    }

    @Test
    void invalidRequestsMapToValidationErrors() throws Exception {
        mockMvc.perform(post("/api/v1/gst/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"totalAmount\":110.00,\"transactionDate\":\"2021-09-05T00:00:00Z\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_001"))
                .andExpect(jsonPath("$.message", containsString("transactionId")));

        mockMvc.perform(post("/api/v1/gst/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_002"));

        mockMvc.perform(get("/api/v1/gst/bas/2021-13"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_001"));
    }

    @Test
    void unknownRecordsAreNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/gst/transactions/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND_001"));

        mockMvc.perform(get("/api/v1/consents/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }

    @Test
    void consentGrantCapturesActorAndClientAddress() throws Exception {
        String userId = "api-user-" + UUID.randomUUID();

        mockMvc.perform(post("/api/v1/consents")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(ActorContext.ACTOR_HEADER, userId)
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1")
                        .content("""
                                {"userId":"%s","consentType":"MARKETING",
                                 "purposes":["newsletter"],"dataCategories":["email"]}
                                """.formatted(userId)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("GRANTED"))
                .andExpect(jsonPath("$.ipAddress").value("203.0.113.9"))
                .andExpect(jsonPath("$.legalBasis").value("Consent"));

        mockMvc.perform(get("/api/v1/consents/users/{userId}/valid", userId)
                        .param("type", "MARKETING")
                        .param("purpose", "newsletter"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true));

        mockMvc.perform(get("/api/v1/audit/entries")
                        .param("actorUserId", userId)
                        .param("operationType", "CONSENT_GRANTED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.entries[0].ipAddress").value("203.0.113.9"));

        mockMvc.perform(post("/api/v1/consents/withdraw")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"%s\",\"consentType\":\"DATA_SHARING\"}".formatted(userId)))
                .andExpect(status().isConflict());
    }

    @Test
    void auditExportAndIntegrityEndpoints() throws Exception {
        mockMvc.perform(post("/api/v1/gst/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(ActorContext.ACTOR_HEADER, "exporter-api")
                        .content(gstBody("api-export-" + UUID.randomUUID())))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/v1/audit/export.csv")
                        .param("actorUserId", "exporter-api"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(header().string("Content-Disposition", containsString("audit-log.csv")))
                .andExpect(content().string(startsWith("timestamp,actor,operation,resource,success\r\n")))
                .andExpect(content().string(containsString("exporter-api,GST_CLASSIFIED")));

        mockMvc.perform(get("/api/v1/audit/integrity")
                        .param("from", "2021-09-01T00:00:00Z")
                        .param("to", "2021-10-01T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true));

        mockMvc.perform(get("/api/v1/audit/entries").param("size", "501"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_001"));
    }

    private static String gstBody(String transactionId) {
        return """
                {"transactionId":"%s","totalAmount":110.00,"treatment":"TAXABLE_SUPPLY",
                 "direction":"SALE","category":"SOFTWARE","merchantName":"Acme Pty Ltd",
                 "transactionDate":"2021-09-05T00:00:00Z"}
                """.formatted(transactionId);
    }
}
