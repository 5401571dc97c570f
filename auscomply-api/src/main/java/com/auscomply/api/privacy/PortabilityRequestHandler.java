package com.auscomply.api.privacy;

import com.auscomply.core.domain.ConsentRecord.ConsentStatus;
import com.auscomply.core.domain.DataSubjectRequest;
import com.auscomply.core.domain.DataSubjectRequest.RequestType;
import com.auscomply.core.repository.ConsentRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data portability: compact machine-readable JSON of the user's own data.
 */
@Component
public class PortabilityRequestHandler implements DataSubjectRequestHandler {

    static final String EXPORT_FORMAT = "auscomply-portable-v1";

    private final UserDataGateway userDataGateway;
    private final ConsentRecordRepository consentRepository;
    private final ExportStorage exportStorage;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PortabilityRequestHandler(
            UserDataGateway userDataGateway,
            ConsentRecordRepository consentRepository,
            ExportStorage exportStorage,
            ObjectMapper objectMapper,
            Clock clock) {
        this.userDataGateway = userDataGateway;
        this.consentRepository = consentRepository;
        this.exportStorage = exportStorage;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public RequestType getRequestType() {
        return RequestType.PORTABILITY;
    }

    @Override
    public HandlerOutcome handle(DataSubjectRequest request) {
        String userId = request.getUserId();

        Map<String, Object> export = new LinkedHashMap<>();
        export.put("format", EXPORT_FORMAT);
        export.put("exportedAt", clock.instant().toString());
        export.put("userId", userId);
        export.put("data", userDataGateway.collectPersonalData(userId));
        export.put("activeConsents", consentRepository.findByUserIdOrderByGrantedAtDesc(userId).stream()
                .filter(c -> c.getStatus() == ConsentStatus.GRANTED)
                .map(c -> c.getConsentType().name())
                .distinct()
                .toList());

        byte[] content;
        try {
            content = objectMapper.writeValueAsBytes(export);
        } catch (JsonProcessingException e) {
            throw new ExportStorage.ExportStorageException("Could not serialise portable export for " + userId, e);
        }
        String url = exportStorage.store(request.getId(), "portable-export.json", content);
        return HandlerOutcome.exported(url, "Portable export prepared in " + EXPORT_FORMAT);
    }
}
