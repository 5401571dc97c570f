package com.auscomply.api.error;

/**
 * Neither the risk evaluation nor its fail-safe record could be persisted.
 */
public class RiskEvaluationException extends RuntimeException {
    public RiskEvaluationException(String message, Throwable cause) { super(message, cause); }
}
