package com.auscomply.api.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * In-process scheduling for the periodic compliance jobs. Off by default; an external
 * scheduler normally calls the job endpoints instead.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "auscomply.jobs", name = "scheduling-enabled", havingValue = "true")
public class JobSchedulingConfig {
}
