package com.auscomply.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * AusComply Platform API Application
 *
 * Compliance engine for Australian financial services: AML/CTF monitoring,
 * privacy consent and data-subject requests, GST classification, APRA incidents,
 * audit trail and periodic compliance reporting.
 */
@SpringBootApplication(scanBasePackages = "com.auscomply")
@EntityScan(basePackages = "com.auscomply.core.domain")
@EnableJpaRepositories(basePackages = "com.auscomply.core.repository")
public class AuscomplyApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuscomplyApiApplication.class, args);
    }
}
