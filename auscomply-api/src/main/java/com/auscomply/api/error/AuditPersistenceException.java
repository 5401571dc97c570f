package com.auscomply.api.error;

/**
 * The audit trail could not be written after all retries. The triggering business
 * change may already be committed; callers surface this as an operational failure.
 */
public class AuditPersistenceException extends RuntimeException {
    public AuditPersistenceException(String message, Throwable cause) { super(message, cause); }
}
