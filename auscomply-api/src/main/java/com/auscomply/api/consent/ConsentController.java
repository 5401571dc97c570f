package com.auscomply.api.consent;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.core.domain.ConsentRecord;
import com.auscomply.core.domain.ConsentRecord.ConsentType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for privacy consent.
 */
@RestController
@RequestMapping("/api/v1/consents")
public class ConsentController {

    private final ConsentService consentService;

    public ConsentController(ConsentService consentService) {
        this.consentService = consentService;
    }

    /**
     * Grant consent.
     * POST /api/v1/consents
     */
    @PostMapping
    public ResponseEntity<ConsentRecord> grant(@Valid @RequestBody GrantConsentRequest body,
                                               HttpServletRequest request) {
        ConsentService.ConsentGrant grant = new ConsentService.ConsentGrant(
                body.userId(), body.consentType(), body.purposes(), body.dataCategories(),
                body.thirdParties(), body.expiryDays());
        ConsentRecord record = consentService.recordConsent(grant, ActorContext.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(record);
    }

    /**
     * Withdraw the latest granted consent of a type.
     * POST /api/v1/consents/withdraw
     */
    @PostMapping("/withdraw")
    public ResponseEntity<ConsentRecord> withdraw(@Valid @RequestBody WithdrawConsentRequest body,
                                                  HttpServletRequest request) {
        ConsentRecord record = consentService.withdrawConsent(
                body.userId(), body.consentType(), body.reason(), ActorContext.from(request));
        return ResponseEntity.ok(record);
    }

    /**
     * GET /api/v1/consents/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<ConsentRecord> get(@PathVariable UUID id) {
        return ResponseEntity.ok(consentService.getConsent(id));
    }

    /**
     * GET /api/v1/consents/users/{userId}
     */
    @GetMapping("/users/{userId}")
    public ResponseEntity<List<ConsentRecord>> history(@PathVariable String userId) {
        return ResponseEntity.ok(consentService.getConsentHistory(userId));
    }

    /**
     * GET /api/v1/consents/users/{userId}/valid?type=MARKETING&purpose=email
     */
    @GetMapping("/users/{userId}/valid")
    public ResponseEntity<ValidityResponse> hasValidConsent(
            @PathVariable String userId,
            @RequestParam ConsentType type,
            @RequestParam(required = false) List<String> purpose) {
        boolean valid = consentService.hasValidConsent(userId, type, purpose);
        return ResponseEntity.ok(new ValidityResponse(userId, type, valid));
    }

    public record GrantConsentRequest(
            @NotBlank String userId,
            @NotNull ConsentType consentType,
            @NotEmpty List<String> purposes,
            @NotEmpty List<String> dataCategories,
            List<String> thirdParties,
            Integer expiryDays
    ) {}

    public record WithdrawConsentRequest(
            @NotBlank String userId,
            @NotNull ConsentType consentType,
            String reason
    ) {}

    public record ValidityResponse(String userId, ConsentType consentType, boolean valid) {}
}
