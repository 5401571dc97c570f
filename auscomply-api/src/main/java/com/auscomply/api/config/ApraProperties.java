package com.auscomply.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Data residency settings checked against APRA CPS 234 expectations.
 */
@Configuration
@ConfigurationProperties(prefix = "auscomply.apra")
public class ApraProperties {

    private String databaseRegion = "ap-southeast-2";
    private String storageRegion = "ap-southeast-2";
    private String backupRegion = "ap-southeast-2";
    private List<String> allowedRegions = new ArrayList<>(
            List.of("ap-southeast-2", "ap-southeast-4", "australia-southeast1", "australia-southeast2", "au-syd"));

    public String getDatabaseRegion() { return databaseRegion; }
    public void setDatabaseRegion(String databaseRegion) { this.databaseRegion = databaseRegion; }
    public String getStorageRegion() { return storageRegion; }
    public void setStorageRegion(String storageRegion) { this.storageRegion = storageRegion; }
    public String getBackupRegion() { return backupRegion; }
    public void setBackupRegion(String backupRegion) { this.backupRegion = backupRegion; }
    public List<String> getAllowedRegions() { return allowedRegions; }
    public void setAllowedRegions(List<String> allowedRegions) { this.allowedRegions = allowedRegions; }
}
