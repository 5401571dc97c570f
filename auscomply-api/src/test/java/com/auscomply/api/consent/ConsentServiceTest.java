package com.auscomply.api.consent;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.consent.ConsentService.ConsentGrant;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.StateConflictException;
import com.auscomply.api.support.MutableClock;
import com.auscomply.api.support.TestClockConfiguration;
import com.auscomply.core.domain.ConsentRecord;
import com.auscomply.core.domain.ConsentRecord.ConsentStatus;
import com.auscomply.core.domain.ConsentRecord.ConsentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class ConsentServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");
    private static final ActorContext ACTOR = new ActorContext("privacy-officer", "203.0.113.9", "junit");

    @Autowired
    private ConsentService consentService;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.setInstant(NOW);
    }

    @Test
    void grantedConsentCarriesVersionLegalBasisAndExpiry() {
        String userId = newUser();

        ConsentRecord consent = consentService.recordConsent(grant(userId, ConsentType.MARKETING, 30), ACTOR);

        assertThat(consent.getStatus()).isEqualTo(ConsentStatus.GRANTED);
        assertThat(consent.getConsentVersion()).isEqualTo("2.0");
        assertThat(consent.getLegalBasis()).isEqualTo("Consent");
        assertThat(consent.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(30)));
        assertThat(consent.getIpAddress()).isEqualTo("203.0.113.9");
        assertThat(consentService.hasValidConsent(userId, ConsentType.MARKETING, List.of("newsletter"))).isTrue();
        assertThat(consentService.hasValidConsent(userId, ConsentType.MARKETING, List.of("profiling"))).isFalse();
    }

    @Test
    void defaultExpiryAppliesWhenNoneRequested() {
        ConsentRecord consent = consentService.recordConsent(grant(newUser(), ConsentType.DATA_SHARING, null), ACTOR);

        assertThat(consent.getExpiresAt()).isEqualTo(NOW.plus(Duration.ofDays(365)));
    }

    @Test
    void expiryJobOnlyTouchesConsentsPastTheirExpiry() {
        String shortLived = newUser();
        String longLived = newUser();
        ConsentRecord expiring = consentService.recordConsent(grant(shortLived, ConsentType.MARKETING, 30), ACTOR);
        ConsentRecord lasting = consentService.recordConsent(grant(longLived, ConsentType.MARKETING, 90), ACTOR);

        clock.setInstant(NOW.plus(Duration.ofDays(31)));
        int expired = consentService.expireOldConsents(ACTOR);

        assertThat(expired).isGreaterThanOrEqualTo(1);
        assertThat(consentService.getConsent(expiring.getId()).getStatus()).isEqualTo(ConsentStatus.EXPIRED);
        assertThat(consentService.getConsent(lasting.getId()).getStatus()).isEqualTo(ConsentStatus.GRANTED);
        assertThat(consentService.hasValidConsent(shortLived, ConsentType.MARKETING, List.of("newsletter"))).isFalse();

        assertThat(consentService.expireOldConsents(ACTOR)).isZero();
    }

    @Test
    void withdrawalMovesLatestGrantToWithdrawn() {
        String userId = newUser();
        ConsentRecord consent = consentService.recordConsent(grant(userId, ConsentType.DATA_SHARING, 30), ACTOR);

        ConsentRecord withdrawn = consentService.withdrawConsent(userId, ConsentType.DATA_SHARING, "No longer needed", ACTOR);

        assertThat(withdrawn.getId()).isEqualTo(consent.getId());
        assertThat(withdrawn.getStatus()).isEqualTo(ConsentStatus.WITHDRAWN);
        assertThat(withdrawn.getWithdrawnAt()).isEqualTo(NOW);
        assertThat(withdrawn.getWithdrawalReason()).isEqualTo("No longer needed");
        assertThatThrownBy(() -> consentService.withdrawConsent(userId, ConsentType.DATA_SHARING, null, ACTOR))
                .isInstanceOf(StateConflictException.class);
    }

    @Test
    void concurrentWithdrawalsSucceedExactlyOnce() throws Exception {
        String userId = newUser();
        consentService.recordConsent(grant(userId, ConsentType.THIRD_PARTY_INTEGRATION, 30), ACTOR);

        CountDownLatch ready = new CountDownLatch(1);
        Callable<String> withdraw = () -> {
            ready.await();
            try {
                consentService.withdrawConsent(userId, ConsentType.THIRD_PARTY_INTEGRATION, "race", ACTOR);
                return "withdrawn";
            } catch (StateConflictException e) {
                return "conflict";
            }
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<String>> results = new ArrayList<>();
            results.add(executor.submit(withdraw));
            results.add(executor.submit(withdraw));
            ready.countDown();

            List<String> outcomes = new ArrayList<>();
            for (Future<String> result : results) {
                outcomes.add(getQuietly(result));
            }
            assertThat(outcomes).containsExactlyInAnyOrder("withdrawn", "conflict");
        } finally {
            executor.shutdownNow();
        }
        assertThat(consentService.getConsentHistory(userId))
                .singleElement()
                .extracting(ConsentRecord::getStatus)
                .isEqualTo(ConsentStatus.WITHDRAWN);
    }

    @Test
    void invalidGrantsAreRejected() {
        String userId = newUser();

        assertThatThrownBy(() -> consentService.recordConsent(
                new ConsentGrant(userId, ConsentType.MARKETING, List.of(), List.of("email"), List.of(), null), ACTOR))
                .isInstanceOf(ComplianceValidationException.class);
        assertThatThrownBy(() -> consentService.recordConsent(grant(userId, ConsentType.MARKETING, 0), ACTOR))
                .isInstanceOf(ComplianceValidationException.class);
        assertThat(consentService.getConsentHistory(userId)).isEmpty();
    }

    private static String getQuietly(Future<String> future) throws InterruptedException, ExecutionException {
        try {
            return future.get(30, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            throw new AssertionError("Withdrawal did not finish", e);
        }
    }

    private static String newUser() {
        return "consent-user-" + UUID.randomUUID();
    }

    private static ConsentGrant grant(String userId, ConsentType type, Integer expiryDays) {
        return new ConsentGrant(userId, type, List.of("newsletter", "offers"), List.of("email", "name"),
                List.of(), expiryDays);
    }
}
