package com.auscomply.api.audit;

import com.auscomply.core.domain.AuditLogEntry.OperationType;

import java.math.BigDecimal;
import java.util.Map;

/**
 * A compliance-relevant event to append to the audit trail.
 * previousData/currentData hold the state before and after the change.
 */
public record AuditEvent(
        ActorContext actor,
        OperationType operationType,
        String resourceType,
        String resourceId,
        Map<String, Object> previousData,
        Map<String, Object> currentData,
        BigDecimal amount,
        BigDecimal gstAmount,
        boolean success,
        String errorMessage
) {

    public static AuditEvent of(ActorContext actor, OperationType operationType,
                                String resourceType, Object resourceId) {
        return new AuditEvent(actor, operationType, resourceType,
                resourceId == null ? null : resourceId.toString(),
                null, null, null, null, true, null);
    }

    public AuditEvent withData(Map<String, Object> previous, Map<String, Object> current) {
        return new AuditEvent(actor, operationType, resourceType, resourceId,
                previous, current, amount, gstAmount, success, errorMessage);
    }

    public AuditEvent withAmounts(BigDecimal amount, BigDecimal gstAmount) {
        return new AuditEvent(actor, operationType, resourceType, resourceId,
                previousData, currentData, amount, gstAmount, success, errorMessage);
    }

    public AuditEvent failed(String error) {
        return new AuditEvent(actor, operationType, resourceType, resourceId,
                previousData, currentData, amount, gstAmount, false, error);
    }
}
