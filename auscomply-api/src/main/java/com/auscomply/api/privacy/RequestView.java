package com.auscomply.api.privacy;

import com.auscomply.core.domain.DataSubjectRequest;
import com.auscomply.core.domain.DataSubjectRequest.RequestStatus;
import com.auscomply.core.domain.DataSubjectRequest.RequestType;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Read view of a data-subject request with the overdue flag derived at read time.
 */
public record RequestView(
        UUID id,
        String userId,
        RequestType requestType,
        RequestStatus status,
        String description,
        Map<String, String> corrections,
        Map<String, String> extensions,
        String verificationMethod,
        Instant requestDate,
        Instant dueDate,
        String processedBy,
        Instant processedAt,
        Instant completedAt,
        String exportUrl,
        Instant exportExpiresAt,
        String resolutionNotes,
        String rejectionReason,
        boolean overdue
) {

    public static RequestView of(DataSubjectRequest request, Instant now) {
        return new RequestView(
                request.getId(),
                request.getUserId(),
                request.getRequestType(),
                request.getStatus(),
                request.getDetails().getDescription(),
                request.getDetails().getCorrections(),
                request.getDetails().getExtensions(),
                request.getVerificationMethod(),
                request.getRequestDate(),
                request.getDueDate(),
                request.getProcessedBy(),
                request.getProcessedAt(),
                request.getCompletedAt(),
                request.getExportUrl(),
                request.getExportExpiresAt(),
                request.getResolutionNotes(),
                request.getRejectionReason(),
                request.isOverdueAt(now));
    }
}
