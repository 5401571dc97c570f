package com.auscomply.api.error;

/**
 * Malformed input (bad period, unknown enum value, missing field). Raised before any write.
 */
public class ComplianceValidationException extends RuntimeException {
    public ComplianceValidationException(String message) { super(message); }
    public ComplianceValidationException(String message, Throwable cause) { super(message, cause); }
}
