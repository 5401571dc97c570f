package com.auscomply.api.privacy;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Access to the personal data the host application holds for a user.
 * Data-subject request handlers read and change user data only through this seam.
 */
public interface UserDataGateway {

    /**
     * All personal data held for the user, keyed by field name. Empty when unknown.
     */
    Map<String, String> collectPersonalData(String userId);

    boolean hasActiveSubscription(String userId);

    /**
     * Date of the most recent record the user must keep for tax purposes, if any.
     */
    Optional<Instant> latestTaxRecordDate(String userId);

    /**
     * Replaces identifying fields while keeping records needed for retention.
     */
    void anonymise(String userId);

    void erase(String userId);

    /**
     * @return the field names that were changed
     */
    Set<String> applyCorrections(String userId, Map<String, String> corrections);
}
