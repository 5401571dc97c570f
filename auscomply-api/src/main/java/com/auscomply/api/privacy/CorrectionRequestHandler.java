package com.auscomply.api.privacy;

import com.auscomply.core.domain.DataSubjectRequest;
import com.auscomply.core.domain.DataSubjectRequest.RequestType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * APP 13 correction of personal data.
 */
@Component
public class CorrectionRequestHandler implements DataSubjectRequestHandler {

    private final UserDataGateway userDataGateway;

    public CorrectionRequestHandler(UserDataGateway userDataGateway) {
        this.userDataGateway = userDataGateway;
    }

    @Override
    public RequestType getRequestType() {
        return RequestType.CORRECTION;
    }

    @Override
    public HandlerOutcome handle(DataSubjectRequest request) {
        Map<String, String> corrections = request.getDetails().getCorrections();
        if (corrections.isEmpty()) {
            return HandlerOutcome.rejected("No corrections supplied");
        }
        Set<String> changed = userDataGateway.applyCorrections(request.getUserId(), corrections);
        if (changed.isEmpty()) {
            return HandlerOutcome.completed("No fields required correction");
        }
        return HandlerOutcome.completed("Corrected fields: " + String.join(", ", changed));
    }
}
