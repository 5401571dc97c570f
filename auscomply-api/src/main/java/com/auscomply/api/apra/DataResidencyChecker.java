package com.auscomply.api.apra;

import com.auscomply.api.config.ApraProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Checks that configured data locations stay within the allowed (onshore) regions.
 */
@Component
public class DataResidencyChecker {

    private final ApraProperties properties;

    public DataResidencyChecker(ApraProperties properties) {
        this.properties = properties;
    }

    public ResidencyStatus check() {
        List<String> violations = new ArrayList<>();
        checkRegion("database", properties.getDatabaseRegion(), violations);
        checkRegion("storage", properties.getStorageRegion(), violations);
        checkRegion("backup", properties.getBackupRegion(), violations);
        return new ResidencyStatus(
                violations.isEmpty(),
                properties.getDatabaseRegion(),
                properties.getStorageRegion(),
                properties.getBackupRegion(),
                List.copyOf(violations));
    }

    private void checkRegion(String location, String region, List<String> violations) {
        if (region == null || region.isBlank()) {
            violations.add("No " + location + " region configured");
            return;
        }
        boolean allowed = properties.getAllowedRegions().stream()
                .anyMatch(r -> r.toLowerCase(Locale.ROOT).equals(region.trim().toLowerCase(Locale.ROOT)));
        if (!allowed) {
            violations.add("The " + location + " region " + region + " is outside the allowed regions");
        }
    }

    public record ResidencyStatus(
            boolean compliant,
            String databaseRegion,
            String storageRegion,
            String backupRegion,
            List<String> violations
    ) {}
}
