package com.auscomply.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A single privacy consent grant. History is append-only per consent type:
 * a new grant is always a new record, and a record leaves GRANTED at most once.
 */
@Entity
@Table(name = "consent_records", indexes = {
    @Index(name = "idx_consent_user_type", columnList = "user_id, consent_type, granted_at"),
    @Index(name = "idx_consent_status_expiry", columnList = "status, expires_at")
})
public class ConsentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "consent_type", nullable = false, updatable = false)
    private ConsentType consentType;

    @NotNull
    @Column(name = "consent_version", nullable = false, updatable = false)
    private String consentVersion;

    @Convert(converter = StringListJsonConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private List<String> purposes = new ArrayList<>();

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "data_categories", columnDefinition = "TEXT", nullable = false, updatable = false)
    private List<String> dataCategories = new ArrayList<>();

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "third_parties", columnDefinition = "TEXT", nullable = false, updatable = false)
    private List<String> thirdParties = new ArrayList<>();

    @NotNull
    @Column(name = "legal_basis", nullable = false, updatable = false)
    private String legalBasis;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ConsentStatus status;

    @NotNull
    @Column(name = "granted_at", nullable = false, updatable = false)
    private Instant grantedAt;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Column(name = "withdrawn_at")
    private Instant withdrawnAt;

    @Column(name = "withdrawal_reason")
    private String withdrawalReason;

    @Column(name = "ip_address", updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", updatable = false)
    private String userAgent;

    @Version
    private Long version;

    protected ConsentRecord() {}

    /**
     * Creates a GRANTED consent. A null {@code expiresAt} means the consent does not lapse.
     */
    public static ConsentRecord grant(
            String userId,
            ConsentType consentType,
            String consentVersion,
            List<String> purposes,
            List<String> dataCategories,
            List<String> thirdParties,
            Instant grantedAt,
            Instant expiresAt,
            String ipAddress,
            String userAgent) {

        if (expiresAt != null && expiresAt.isBefore(grantedAt)) {
            throw new IllegalArgumentException("Consent cannot expire before it is granted");
        }
        var record = new ConsentRecord();
        record.userId = userId;
        record.consentType = consentType;
        record.consentVersion = consentVersion;
        record.purposes = new ArrayList<>(purposes);
        record.dataCategories = new ArrayList<>(dataCategories);
        record.thirdParties = thirdParties == null ? new ArrayList<>() : new ArrayList<>(thirdParties);
        record.legalBasis = consentType.legalBasis();
        record.status = ConsentStatus.GRANTED;
        record.grantedAt = grantedAt;
        record.expiresAt = expiresAt;
        record.ipAddress = ipAddress;
        record.userAgent = userAgent;
        return record;
    }

    public boolean isValidAt(Instant now) {
        return status == ConsentStatus.GRANTED && (expiresAt == null || expiresAt.isAfter(now));
    }

    public boolean coversPurposes(List<String> required) {
        return required == null || purposes.containsAll(required);
    }

    // Getters
    public UUID getId() { return id; }
    public String getUserId() { return userId; }
    public ConsentType getConsentType() { return consentType; }
    public String getConsentVersion() { return consentVersion; }
    public List<String> getPurposes() { return List.copyOf(purposes); }
    public List<String> getDataCategories() { return List.copyOf(dataCategories); }
    public List<String> getThirdParties() { return List.copyOf(thirdParties); }
    public String getLegalBasis() { return legalBasis; }
    public ConsentStatus getStatus() { return status; }
    public Instant getGrantedAt() { return grantedAt; }
    public Instant getExpiresAt() { return expiresAt; }
    public Instant getWithdrawnAt() { return withdrawnAt; }
    public String getWithdrawalReason() { return withdrawalReason; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }

    public enum ConsentType {
        PRIVACY_POLICY("Contract performance"),
        TERMS_OF_SERVICE("Contract performance"),
        MARKETING("Consent"),
        DATA_SHARING("Consent"),
        THIRD_PARTY_INTEGRATION("Consent"),
        BIOMETRIC_DATA("Explicit consent");

        private final String legalBasis;

        ConsentType(String legalBasis) {
            this.legalBasis = legalBasis;
        }

        public String legalBasis() {
            return legalBasis;
        }
    }

    /**
     * Consent states. WITHDRAWN and EXPIRED are terminal.
     */
    public enum ConsentStatus {
        GRANTED,
        WITHDRAWN,
        EXPIRED;

        public boolean isTerminal() {
            return this != GRANTED;
        }

        public Set<ConsentStatus> allowedTransitions() {
            return this == GRANTED ? EnumSet.of(WITHDRAWN, EXPIRED) : EnumSet.noneOf(ConsentStatus.class);
        }

        public boolean canTransitionTo(ConsentStatus next) {
            return allowedTransitions().contains(next);
        }
    }
}
