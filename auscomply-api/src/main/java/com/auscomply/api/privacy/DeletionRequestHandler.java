package com.auscomply.api.privacy;

import com.auscomply.core.domain.DataSubjectRequest;
import com.auscomply.core.domain.DataSubjectRequest.RequestType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Deletion with retention rules: users with an active subscription are refused, and
 * tax records younger than the retention period keep the account anonymised instead
 * of erased.
 */
@Component
public class DeletionRequestHandler implements DataSubjectRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(DeletionRequestHandler.class);

    static final int TAX_RECORD_RETENTION_YEARS = 7;

    private final UserDataGateway userDataGateway;
    private final Clock clock;

    public DeletionRequestHandler(UserDataGateway userDataGateway, Clock clock) {
        this.userDataGateway = userDataGateway;
        this.clock = clock;
    }

    @Override
    public RequestType getRequestType() {
        return RequestType.DELETION;
    }

    @Override
    public HandlerOutcome handle(DataSubjectRequest request) {
        String userId = request.getUserId();
        if (userDataGateway.hasActiveSubscription(userId)) {
            return HandlerOutcome.rejected("Active subscription must be cancelled before deletion");
        }

        Instant retentionCutoff = clock.instant().atZone(ZoneOffset.UTC)
                .minusYears(TAX_RECORD_RETENTION_YEARS)
                .toInstant();
        Optional<Instant> latestTaxRecord = userDataGateway.latestTaxRecordDate(userId);
        if (latestTaxRecord.isPresent() && latestTaxRecord.get().isAfter(retentionCutoff)) {
            userDataGateway.anonymise(userId);
            Instant retainUntil = latestTaxRecord.get().atZone(ZoneOffset.UTC)
                    .plusYears(TAX_RECORD_RETENTION_YEARS)
                    .toInstant();
            log.info("User {} anonymised; tax records retained until {}", userId, retainUntil);
            return HandlerOutcome.completed("Personal data anonymised; tax records retained until " + retainUntil);
        }

        userDataGateway.erase(userId);
        return HandlerOutcome.completed("Personal data erased");
    }
}
