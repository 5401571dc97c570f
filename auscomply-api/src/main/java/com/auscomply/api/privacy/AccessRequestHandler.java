package com.auscomply.api.privacy;

import com.auscomply.core.domain.ConsentRecord;
import com.auscomply.core.domain.DataSubjectRequest;
import com.auscomply.core.domain.DataSubjectRequest.RequestType;
import com.auscomply.core.repository.ConsentRecordRepository;
import com.auscomply.core.repository.DataSubjectRequestRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * APP 12 access: a full human-readable export of what is held about the user,
 * including consent and privacy request history.
 */
@Component
public class AccessRequestHandler implements DataSubjectRequestHandler {

    private final UserDataGateway userDataGateway;
    private final ConsentRecordRepository consentRepository;
    private final DataSubjectRequestRepository requestRepository;
    private final ExportStorage exportStorage;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AccessRequestHandler(
            UserDataGateway userDataGateway,
            ConsentRecordRepository consentRepository,
            DataSubjectRequestRepository requestRepository,
            ExportStorage exportStorage,
            ObjectMapper objectMapper,
            Clock clock) {
        this.userDataGateway = userDataGateway;
        this.consentRepository = consentRepository;
        this.requestRepository = requestRepository;
        this.exportStorage = exportStorage;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public RequestType getRequestType() {
        return RequestType.ACCESS;
    }

    @Override
    public HandlerOutcome handle(DataSubjectRequest request) {
        String userId = request.getUserId();

        Map<String, Object> export = new LinkedHashMap<>();
        export.put("userId", userId);
        export.put("requestId", request.getId().toString());
        export.put("generatedAt", clock.instant().toString());
        export.put("scope", request.getDetails().getDescription());
        export.put("personalData", userDataGateway.collectPersonalData(userId));
        export.put("consents", consentRepository.findByUserIdOrderByGrantedAtDesc(userId).stream()
                .map(AccessRequestHandler::describeConsent)
                .toList());
        export.put("privacyRequests", requestRepository.findByUserIdOrderByRequestDateDesc(userId).stream()
                .map(r -> Map.of(
                        "requestType", r.getRequestType().name(),
                        "status", r.getStatus().name(),
                        "requestDate", r.getRequestDate().toString()))
                .toList());

        byte[] content;
        try {
            content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(export);
        } catch (JsonProcessingException e) {
            throw new ExportStorage.ExportStorageException("Could not serialise access export for " + userId, e);
        }
        String url = exportStorage.store(request.getId(), "access-export.json", content);
        return HandlerOutcome.exported(url, "Access export prepared");
    }

    private static Map<String, Object> describeConsent(ConsentRecord consent) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("consentType", consent.getConsentType().name());
        data.put("legalBasis", consent.getLegalBasis());
        data.put("status", consent.getStatus().name());
        data.put("purposes", consent.getPurposes());
        data.put("dataCategories", consent.getDataCategories());
        data.put("thirdParties", consent.getThirdParties());
        data.put("grantedAt", consent.getGrantedAt().toString());
        data.put("expiresAt", consent.getExpiresAt() == null ? null : consent.getExpiresAt().toString());
        data.put("withdrawnAt", consent.getWithdrawnAt() == null ? null : consent.getWithdrawnAt().toString());
        return data;
    }
}
