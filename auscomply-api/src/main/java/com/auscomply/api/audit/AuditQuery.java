package com.auscomply.api.audit;

import com.auscomply.core.domain.AuditLogEntry;
import com.auscomply.core.domain.AuditLogEntry.OperationType;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Audit log filter. Every field is optional; {@code to} is exclusive.
 */
public record AuditQuery(
        Instant from,
        Instant to,
        String actorUserId,
        Set<OperationType> operationTypes,
        String resourceType,
        String resourceId,
        Boolean success
) {

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, null, null, null);
    }

    public Specification<AuditLogEntry> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("timestamp"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThan(root.get("timestamp"), to));
            }
            if (actorUserId != null && !actorUserId.isBlank()) {
                predicates.add(cb.equal(root.get("actorUserId"), actorUserId));
            }
            if (operationTypes != null && !operationTypes.isEmpty()) {
                predicates.add(root.get("operationType").in(operationTypes));
            }
            if (resourceType != null && !resourceType.isBlank()) {
                predicates.add(cb.equal(root.get("resourceType"), resourceType));
            }
            if (resourceId != null && !resourceId.isBlank()) {
                predicates.add(cb.equal(root.get("resourceId"), resourceId));
            }
            if (success != null) {
                predicates.add(cb.equal(root.get("success"), success));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
