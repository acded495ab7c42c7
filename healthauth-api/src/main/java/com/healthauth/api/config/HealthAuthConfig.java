package com.healthauth.api.config;

import com.healthauth.core.audit.AuthorityAuditLog;
import com.healthauth.core.authority.AuthorityState;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the authority, its clock and its audit chain.
 */
@Configuration
public class HealthAuthConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AuthorityState authorityState(HealthAuthProperties properties, Clock clock) {
        String administrator = properties.getInitialAdministrator();
        if (administrator == null || administrator.isBlank()) {
            throw new IllegalStateException("healthauth.authority.initial-administrator must be set");
        }
        return new AuthorityState(administrator, clock);
    }

    @Bean
    public AuthorityAuditLog authorityAuditLog(HealthAuthProperties properties, Clock clock) {
        return new AuthorityAuditLog(properties.getAuthorityId(), clock);
    }
}
