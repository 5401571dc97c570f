package com.auscomply.api.privacy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default user data store kept in memory. Host applications replace it with a
 * {@code @Primary} gateway over their own user records.
 */
@Component
public class InMemoryUserDataGateway implements UserDataGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUserDataGateway.class);

    static final String ANONYMISED = "[anonymised]";

    private final Map<String, StoredUser> users = new ConcurrentHashMap<>();

    /**
     * Registers or replaces a user's data.
     */
    public void putUser(String userId, Map<String, String> personalData,
                        boolean activeSubscription, Instant latestTaxRecordDate) {
        users.put(userId, new StoredUser(new TreeMap<>(personalData), activeSubscription, latestTaxRecordDate));
    }

    public boolean contains(String userId) {
        return users.containsKey(userId);
    }

    @Override
    public Map<String, String> collectPersonalData(String userId) {
        StoredUser user = users.get(userId);
        return user == null ? Map.of() : Map.copyOf(user.personalData());
    }

    @Override
    public boolean hasActiveSubscription(String userId) {
        StoredUser user = users.get(userId);
        return user != null && user.activeSubscription();
    }

    @Override
    public Optional<Instant> latestTaxRecordDate(String userId) {
        StoredUser user = users.get(userId);
        return user == null ? Optional.empty() : Optional.ofNullable(user.latestTaxRecordDate());
    }

    @Override
    public void anonymise(String userId) {
        users.computeIfPresent(userId, (id, user) -> {
            Map<String, String> masked = new TreeMap<>();
            user.personalData().keySet().forEach(field -> masked.put(field, ANONYMISED));
            return new StoredUser(masked, false, user.latestTaxRecordDate());
        });
        log.info("Anonymised personal data for user {}", userId);
    }

    @Override
    public void erase(String userId) {
        users.remove(userId);
        log.info("Erased personal data for user {}", userId);
    }

    @Override
    public Set<String> applyCorrections(String userId, Map<String, String> corrections) {
        Set<String> changed = new TreeSet<>();
        users.computeIfPresent(userId, (id, user) -> {
            Map<String, String> updated = new TreeMap<>(user.personalData());
            corrections.forEach((field, value) -> {
                if (!value.equals(updated.put(field, value))) {
                    changed.add(field);
                }
            });
            return new StoredUser(updated, user.activeSubscription(), user.latestTaxRecordDate());
        });
        return changed;
    }

    private record StoredUser(Map<String, String> personalData, boolean activeSubscription,
                              Instant latestTaxRecordDate) {}
}
