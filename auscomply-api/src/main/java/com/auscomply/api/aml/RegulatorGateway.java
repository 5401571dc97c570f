package com.auscomply.api.aml;

import com.auscomply.core.domain.RiskRecord;

/**
 * Outbound channel for suspicious matter reports to AUSTRAC.
 */
public interface RegulatorGateway {

    /**
     * Submits the report and returns the regulator's reference.
     *
     * @throws RegulatorSubmissionException when the regulator rejects or cannot be reached
     */
    String submitSuspiciousMatter(RiskRecord record);

    class RegulatorSubmissionException extends RuntimeException {
        public RegulatorSubmissionException(String message) { super(message); }
        public RegulatorSubmissionException(String message, Throwable cause) { super(message, cause); }
    }
}
