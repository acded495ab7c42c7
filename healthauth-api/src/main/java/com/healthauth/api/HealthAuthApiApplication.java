package com.healthauth.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * HealthAuth API Application
 *
 * Consent-gated medical record authorization with replay protection.
 */
@SpringBootApplication(scanBasePackages = "com.healthauth")
public class HealthAuthApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthAuthApiApplication.class, args);
    }
}
