package com.auscomply.api.privacy;

import com.auscomply.api.audit.ActorContext;
import com.auscomply.api.error.ComplianceValidationException;
import com.auscomply.core.domain.DataSubjectRequest.RequestType;
import com.auscomply.core.domain.RequestDetails;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for data-subject (privacy) requests.
 */
@RestController
@RequestMapping("/api/v1/privacy/requests")
public class DataSubjectRequestController {

    private final DataSubjectRequestService requestService;

    public DataSubjectRequestController(DataSubjectRequestService requestService) {
        this.requestService = requestService;
    }

    /**
     * POST /api/v1/privacy/requests
     */
    @PostMapping
    public ResponseEntity<RequestView> create(@Valid @RequestBody CreateRequest body, HttpServletRequest request) {
        RequestDetails details;
        try {
            details = RequestDetails.of(
                    RequestDetails.Kind.forRequestType(body.requestType()),
                    body.description(),
                    body.corrections(),
                    body.extensions());
        } catch (IllegalArgumentException e) {
            throw new ComplianceValidationException(e.getMessage(), e);
        }
        RequestView view = requestService.createRequest(
                body.userId(), body.requestType(), details, body.verificationMethod(), ActorContext.from(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    /**
     * POST /api/v1/privacy/requests/{id}/process
     */
    @PostMapping("/{id}/process")
    public ResponseEntity<RequestView> process(@PathVariable UUID id,
                                               @Valid @RequestBody ProcessRequest body,
                                               HttpServletRequest request) {
        return ResponseEntity.ok(requestService.processRequest(id, body.processedBy(), ActorContext.from(request)));
    }

    /**
     * POST /api/v1/privacy/requests/{id}/reject
     */
    @PostMapping("/{id}/reject")
    public ResponseEntity<RequestView> reject(@PathVariable UUID id,
                                              @Valid @RequestBody RejectRequest body,
                                              HttpServletRequest request) {
        return ResponseEntity.ok(requestService.rejectRequest(
                id, body.processedBy(), body.reason(), ActorContext.from(request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RequestView> get(@PathVariable UUID id) {
        return ResponseEntity.ok(requestService.getRequest(id));
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<List<RequestView>> listForUser(@PathVariable String userId) {
        return ResponseEntity.ok(requestService.listForUser(userId));
    }

    @GetMapping("/overdue")
    public ResponseEntity<List<RequestView>> listOverdue() {
        return ResponseEntity.ok(requestService.listOverdue());
    }

    public record CreateRequest(
            @NotBlank String userId,
            @NotNull RequestType requestType,
            @NotBlank String verificationMethod,
            String description,
            Map<String, String> corrections,
            Map<String, String> extensions
    ) {}

    public record ProcessRequest(@NotBlank String processedBy) {}

    public record RejectRequest(@NotBlank String processedBy, @NotBlank String reason) {}
}
