package com.auscomply.api.consent;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.RecordNotFoundException;
import com.auscomply.api.error.StateConflictException;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.ConsentRecord;
import com.auscomply.core.domain.ConsentRecord.ConsentStatus;
import com.auscomply.core.domain.ConsentRecord.ConsentType;
import com.auscomply.core.repository.ConsentRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Consent lifecycle manager for Australian Privacy Principles consent.
 *
 * State machine: GRANTED to WITHDRAWN or EXPIRED, both terminal. Granting again always
 * creates a new record, so the history per consent type is append-only. Transitions are
 * conditional updates on the expected prior status. Each change commits before its audit
 * entry is written, so no connection is held while the audit trail appends.
 */
@Service
public class ConsentService {

    private static final Logger log = LoggerFactory.getLogger(ConsentService.class);

    static final String RESOURCE_TYPE = "ConsentRecord";

    private final ConsentRecordRepository consentRepository;
    private final AuditTrailService auditTrailService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final String consentVersion;
    private final int defaultExpiryDays;

    public ConsentService(
            ConsentRecordRepository consentRepository,
            AuditTrailService auditTrailService,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${auscomply.consent.version:2.0}") String consentVersion,
            @Value("${auscomply.consent.default-expiry-days:365}") int defaultExpiryDays) {
        this.consentRepository = consentRepository;
        this.auditTrailService = auditTrailService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.consentVersion = consentVersion;
        this.defaultExpiryDays = defaultExpiryDays;
    }

    /**
     * Records a new GRANTED consent. Earlier records of the same type are not touched.
     * When {@code expiryDays} is null the configured default applies; a default of 0
     * means consents do not expire.
     */
    public ConsentRecord recordConsent(ConsentGrant grant, ActorContext actor) {
        validate(grant);

        Instant now = clock.instant();
        int expiryDays = grant.expiryDays() != null ? grant.expiryDays() : defaultExpiryDays;
        Instant expiresAt = expiryDays > 0 ? now.plus(Duration.ofDays(expiryDays)) : null;

        ConsentRecord record = ConsentRecord.grant(
                grant.userId(),
                grant.consentType(),
                consentVersion,
                grant.purposes(),
                grant.dataCategories(),
                grant.thirdParties(),
                now,
                expiresAt,
                actor.ipAddress(),
                actor.userAgent());
        ConsentRecord saved = transactionTemplate.execute(status -> consentRepository.saveAndFlush(record));
        log.info("Consent {} granted: user={}, type={}, expiresAt={}",
                saved.getId(), saved.getUserId(), saved.getConsentType(), saved.getExpiresAt());

        auditTrailService.record(AuditEvent.of(actor, OperationType.CONSENT_GRANTED, RESOURCE_TYPE, saved.getId())
                .withData(null, snapshot(saved)));
        return saved;
    }

    /**
     * Withdraws the latest GRANTED consent of the type.
     *
     * @throws StateConflictException if nothing is GRANTED or a concurrent change won
     */
    public ConsentRecord withdrawConsent(String userId, ConsentType consentType, String reason, ActorContext actor) {
        if (userId == null || userId.isBlank()) {
            throw new ComplianceValidationException("User ID is required");
        }
        if (consentType == null) {
            throw new ComplianceValidationException("Consent type is required");
        }

        Withdrawal withdrawal = transactionTemplate.execute(status -> {
            ConsentRecord current = consentRepository
                    .findFirstByUserIdAndConsentTypeAndStatusOrderByGrantedAtDesc(userId, consentType, ConsentStatus.GRANTED)
                    .orElseThrow(() -> new StateConflictException(
                            "No granted " + consentType + " consent to withdraw for user " + userId));
            Map<String, Object> before = snapshot(current);

            int updated;
            try {
                updated = consentRepository.withdrawIfGranted(
                        current.getId(), reason, clock.instant(), ConsentStatus.GRANTED, ConsentStatus.WITHDRAWN);
            } catch (ConcurrencyFailureException e) {
                log.warn("Withdrawal of consent {} lost a concurrent update: {}", current.getId(), e.getMessage());
                updated = 0;
            }
            if (updated == 0) {
                throw new StateConflictException("Consent " + current.getId() + " is no longer GRANTED");
            }
            return new Withdrawal(before, getConsent(current.getId()));
        });

        ConsentRecord withdrawn = withdrawal.withdrawn();
        log.info("Consent {} withdrawn: user={}, type={}", withdrawn.getId(), userId, consentType);
        auditTrailService.record(AuditEvent.of(actor, OperationType.CONSENT_WITHDRAWN, RESOURCE_TYPE, withdrawn.getId())
                .withData(withdrawal.before(), snapshot(withdrawn)));
        return withdrawn;
    }

    /**
     * Expires every GRANTED consent whose expiry has passed. Safe to re-run: already
     * expired records are not matched again.
     *
     * @return the number of consents transitioned by this run
     */
    public int expireOldConsents(ActorContext actor) {
        Instant now = clock.instant();
        int expired = transactionTemplate.execute(status ->
                consentRepository.expireGrantedBefore(now, ConsentStatus.GRANTED, ConsentStatus.EXPIRED));
        if (expired > 0) {
            log.info("Expired {} consent(s) with expiry before {}", expired, now);
        }
        auditTrailService.record(AuditEvent.of(actor, OperationType.CONSENTS_EXPIRED, RESOURCE_TYPE, null)
                .withData(null, Map.of("expiredCount", expired, "asOf", now.toString())));
        return expired;
    }

    /**
     * True when the user holds a GRANTED, unexpired consent of the type covering every
     * requested purpose.
     */
    @Transactional(readOnly = true)
    public boolean hasValidConsent(String userId, ConsentType consentType, List<String> purposes) {
        Instant now = clock.instant();
        return consentRepository
                .findFirstByUserIdAndConsentTypeAndStatusOrderByGrantedAtDesc(userId, consentType, ConsentStatus.GRANTED)
                .filter(c -> c.isValidAt(now))
                .filter(c -> c.coversPurposes(purposes))
                .isPresent();
    }

    @Transactional(readOnly = true)
    public List<ConsentRecord> getConsentHistory(String userId) {
        return consentRepository.findByUserIdOrderByGrantedAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public ConsentRecord getConsent(UUID id) {
        return consentRepository.findById(id).orElseThrow(() -> RecordNotFoundException.of("Consent", id));
    }

    private void validate(ConsentGrant grant) {
        if (grant == null) {
            throw new ComplianceValidationException("Consent details are required");
        }
        if (grant.userId() == null || grant.userId().isBlank()) {
            throw new ComplianceValidationException("User ID is required");
        }
        if (grant.consentType() == null) {
            throw new ComplianceValidationException("Consent type is required");
        }
        if (grant.purposes() == null || grant.purposes().isEmpty()) {
            throw new ComplianceValidationException("At least one purpose is required");
        }
        if (grant.dataCategories() == null || grant.dataCategories().isEmpty()) {
            throw new ComplianceValidationException("At least one data category is required");
        }
        if (grant.expiryDays() != null && grant.expiryDays() <= 0) {
            throw new ComplianceValidationException("Expiry days must be positive");
        }
    }

    private static Map<String, Object> snapshot(ConsentRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("userId", record.getUserId());
        data.put("consentType", record.getConsentType().name());
        data.put("consentVersion", record.getConsentVersion());
        data.put("purposes", record.getPurposes());
        data.put("dataCategories", record.getDataCategories());
        data.put("thirdParties", record.getThirdParties());
        data.put("status", record.getStatus().name());
        data.put("grantedAt", record.getGrantedAt());
        data.put("expiresAt", record.getExpiresAt());
        data.put("withdrawnAt", record.getWithdrawnAt());
        return data;
    }

    private record Withdrawal(Map<String, Object> before, ConsentRecord withdrawn) {}

    public record ConsentGrant(
            String userId,
            ConsentType consentType,
            List<String> purposes,
            List<String> dataCategories,
            List<String> thirdParties,
            Integer expiryDays
    ) {}
}
