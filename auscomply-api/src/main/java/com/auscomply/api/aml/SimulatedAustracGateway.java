package com.auscomply.api.aml;

import com.auscomply.core.domain.RiskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;

/**
 * Default gateway used until an AUSTRAC Online integration is configured. Issues a
 * local SMR reference and logs the submission. Replace with a {@code @Primary} bean to integrate.
 */
@Component
public class SimulatedAustracGateway implements RegulatorGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedAustracGateway.class);

    private final Clock clock;

    public SimulatedAustracGateway(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String submitSuspiciousMatter(RiskRecord record) {
        String reference = "SMR-" + clock.millis() + "-" + record.getId().toString().substring(0, 8).toUpperCase(Locale.ROOT);
        log.info("Suspicious matter report {} lodged for transaction {} (score {})",
                reference, record.getTransactionId(), record.getRiskScore());
        return reference;
    }
}
