package com.auscomply.api.privacy;

import com.auscomply.core.domain.DataSubjectRequest;
import com.auscomply.core.domain.DataSubjectRequest.RequestType;

/**
 * Carries out one type of data-subject request once it is PROCESSING.
 */
public interface DataSubjectRequestHandler {

    RequestType getRequestType();

    HandlerOutcome handle(DataSubjectRequest request);
}
