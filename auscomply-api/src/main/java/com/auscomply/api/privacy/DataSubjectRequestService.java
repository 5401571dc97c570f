package com.auscomply.api.privacy;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.audit.AuditEvent;
import com.auscomply.api.audit.AuditTrailService;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.api.error.RecordNotFoundException;
import com.auscomply.api.error.StateConflictException;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import com.auscomply.core.domain.DataSubjectRequest;
import com.auscomply.core.domain.DataSubjectRequest.RequestStatus;
import com.auscomply.core.domain.DataSubjectRequest.RequestType;
import com.auscomply.core.domain.RequestDetails;
import com.auscomply.core.repository.DataSubjectRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.IntSupplier;

/**
 * Privacy Act data-subject request workflow.
 *
 * Requests are due 30 days after they are made. Processing moves a request
 * PENDING to PROCESSING, runs the handler for its type and finalises it as COMPLETED
 * or REJECTED. Each step is a conditional update on the expected status, so two
 * processors racing on one request cannot both succeed. A handler failure rolls the
 * request back to PENDING. Audit entries are written once the change has committed.
 */
@Service
public class DataSubjectRequestService {

    private static final Logger log = LoggerFactory.getLogger(DataSubjectRequestService.class);

    static final String RESOURCE_TYPE = "DataSubjectRequest";

    private static final EnumSet<RequestStatus> OPEN_STATUSES = EnumSet.of(RequestStatus.PENDING, RequestStatus.PROCESSING);

    private final DataSubjectRequestRepository requestRepository;
    private final Map<RequestType, DataSubjectRequestHandler> handlers;
    private final AuditTrailService auditTrailService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DataSubjectRequestService(
            DataSubjectRequestRepository requestRepository,
            List<DataSubjectRequestHandler> handlers,
            AuditTrailService auditTrailService,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.requestRepository = requestRepository;
        this.handlers = new EnumMap<>(RequestType.class);
        for (DataSubjectRequestHandler handler : handlers) {
            if (this.handlers.put(handler.getRequestType(), handler) != null) {
                throw new IllegalStateException("Duplicate handler for " + handler.getRequestType());
            }
        }
        for (RequestType type : RequestType.values()) {
            if (!this.handlers.containsKey(type)) {
                throw new IllegalStateException("No handler registered for " + type);
            }
        }
        this.auditTrailService = auditTrailService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Creates a PENDING request due {@link DataSubjectRequest#RESPONSE_PERIOD} from now.
     * When {@code details} is null the default details for the type are used.
     */
    public RequestView createRequest(String userId, RequestType requestType, RequestDetails details,
                                     String verificationMethod, ActorContext actor) {
        if (userId == null || userId.isBlank()) {
            throw new ComplianceValidationException("User ID is required");
        }
        if (requestType == null) {
            throw new ComplianceValidationException("Request type is required");
        }
        if (verificationMethod == null || verificationMethod.isBlank()) {
            throw new ComplianceValidationException("Verification method is required");
        }
        if (details != null && details.getKind() != RequestDetails.Kind.forRequestType(requestType)) {
            throw new ComplianceValidationException(
                    "Details of kind " + details.getKind() + " do not match request type " + requestType);
        }

        Instant now = clock.instant();
        DataSubjectRequest saved = transactionTemplate.execute(status -> requestRepository.saveAndFlush(
                DataSubjectRequest.create(userId, requestType, details, verificationMethod, now)));
        log.info("Data subject request {} created: user={}, type={}, due={}",
                saved.getId(), userId, requestType, saved.getDueDate());

        auditTrailService.record(AuditEvent.of(actor, OperationType.DSR_CREATED, RESOURCE_TYPE, saved.getId())
                .withData(null, snapshot(saved)));
        return RequestView.of(saved, now);
    }

    /**
     * Processes a PENDING request with the handler for its type.
     *
     * @throws StateConflictException if the request is terminal or another processor got there first
     */
    public RequestView processRequest(UUID requestId, String processedBy, ActorContext actor) {
        if (processedBy == null || processedBy.isBlank()) {
            throw new ComplianceValidationException("Processor is required");
        }
        Processed processed = transactionTemplate.execute(status -> process(requestId, processedBy));

        DataSubjectRequest finalised = processed.finalised();
        log.info("Data subject request {} {} by {}", requestId, finalised.getStatus(), processedBy);

        auditTrailService.record(AuditEvent.of(actor, OperationType.DSR_PROCESSING, RESOURCE_TYPE, requestId)
                .withData(processed.before(), processed.processing()));
        OperationType finalOperation = finalised.getStatus() == RequestStatus.COMPLETED
                ? OperationType.DSR_COMPLETED
                : OperationType.DSR_REJECTED;
        auditTrailService.record(AuditEvent.of(actor, finalOperation, RESOURCE_TYPE, requestId)
                .withData(processed.processing(), snapshot(finalised)));
        return RequestView.of(finalised, processed.finishedAt());
    }

    private Processed process(UUID requestId, String processedBy) {
        DataSubjectRequest request = load(requestId);
        if (request.getStatus().isTerminal()) {
            throw new StateConflictException("Request " + requestId + " is already " + request.getStatus());
        }
        Map<String, Object> before = snapshot(request);

        Instant started = clock.instant();
        conditionalUpdate(
                () -> requestRepository.startProcessing(
                        requestId, processedBy, started, RequestStatus.PENDING, RequestStatus.PROCESSING),
                "Request " + requestId + " is already being processed");
        DataSubjectRequest processing = load(requestId);
        Map<String, Object> processingSnapshot = snapshot(processing);

        HandlerOutcome outcome = handlers.get(processing.getRequestType()).handle(processing);

        Instant finished = clock.instant();
        if (outcome.completed()) {
            Instant exportExpiresAt = outcome.exportUrl() == null
                    ? null
                    : finished.plus(DataSubjectRequest.EXPORT_RETENTION);
            conditionalUpdate(
                    () -> requestRepository.complete(requestId, outcome.exportUrl(), exportExpiresAt,
                            outcome.notes(), finished, RequestStatus.PROCESSING, RequestStatus.COMPLETED),
                    "Request " + requestId + " was finalised concurrently");
        } else {
            conditionalUpdate(
                    () -> requestRepository.reject(requestId, processedBy, outcome.rejectionReason(), finished,
                            EnumSet.of(RequestStatus.PROCESSING), RequestStatus.REJECTED),
                    "Request " + requestId + " was finalised concurrently");
            log.warn("Data subject request {} rejected during processing: {}", requestId, outcome.rejectionReason());
        }
        return new Processed(before, processingSnapshot, load(requestId), finished);
    }

    /**
     * Rejects an open request outright, e.g. when identity verification fails.
     */
    public RequestView rejectRequest(UUID requestId, String processedBy, String reason, ActorContext actor) {
        if (processedBy == null || processedBy.isBlank()) {
            throw new ComplianceValidationException("Processor is required");
        }
        if (reason == null || reason.isBlank()) {
            throw new ComplianceValidationException("Rejection reason is required");
        }
        Instant now = clock.instant();
        Processed rejection = transactionTemplate.execute(status -> {
            DataSubjectRequest request = load(requestId);
            if (request.getStatus().isTerminal()) {
                throw new StateConflictException("Request " + requestId + " is already " + request.getStatus());
            }
            Map<String, Object> before = snapshot(request);
            conditionalUpdate(
                    () -> requestRepository.reject(requestId, processedBy, reason, now, OPEN_STATUSES, RequestStatus.REJECTED),
                    "Request " + requestId + " was finalised concurrently");
            return new Processed(before, null, load(requestId), now);
        });

        DataSubjectRequest rejected = rejection.finalised();
        log.warn("Data subject request {} rejected by {}: {}", requestId, processedBy, reason);
        auditTrailService.record(AuditEvent.of(actor, OperationType.DSR_REJECTED, RESOURCE_TYPE, requestId)
                .withData(rejection.before(), snapshot(rejected)));
        return RequestView.of(rejected, now);
    }

    @Transactional(readOnly = true)
    public RequestView getRequest(UUID requestId) {
        return RequestView.of(load(requestId), clock.instant());
    }

    @Transactional(readOnly = true)
    public List<RequestView> listForUser(String userId) {
        Instant now = clock.instant();
        return requestRepository.findByUserIdOrderByRequestDateDesc(userId).stream()
                .map(r -> RequestView.of(r, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<RequestView> listOverdue() {
        Instant now = clock.instant();
        return requestRepository.findOverdue(now, OPEN_STATUSES).stream()
                .map(r -> RequestView.of(r, now))
                .toList();
    }

    private DataSubjectRequest load(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> RecordNotFoundException.of("Data subject request", requestId));
    }

    private static void conditionalUpdate(IntSupplier update, String conflictMessage) {
        int updated;
        try {
            updated = update.getAsInt();
        } catch (ConcurrencyFailureException e) {
            log.warn("{}: {}", conflictMessage, e.getMessage());
            throw new StateConflictException(conflictMessage);
        }
        if (updated == 0) {
            throw new StateConflictException(conflictMessage);
        }
    }

    private static Map<String, Object> snapshot(DataSubjectRequest request) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("userId", request.getUserId());
        data.put("requestType", request.getRequestType().name());
        data.put("status", request.getStatus().name());
        data.put("requestDate", request.getRequestDate());
        data.put("dueDate", request.getDueDate());
        data.put("processedBy", request.getProcessedBy());
        data.put("completedAt", request.getCompletedAt());
        data.put("exportUrl", request.getExportUrl());
        data.put("rejectionReason", request.getRejectionReason());
        return data;
    }

    private record Processed(
            Map<String, Object> before,
            Map<String, Object> processing,
            DataSubjectRequest finalised,
            Instant finishedAt
    ) {}
}
