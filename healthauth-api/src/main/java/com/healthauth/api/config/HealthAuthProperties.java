package com.healthauth.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the record authority.
 */
@Configuration
@ConfigurationProperties(prefix = "healthauth.authority")
public class HealthAuthProperties {

    private String authorityId = "healthauth-authority";
    private String initialAdministrator;
    private boolean auditEnabled = true;

    public String getAuthorityId() { return authorityId; }
    public void setAuthorityId(String authorityId) { this.authorityId = authorityId; }
    public String getInitialAdministrator() { return initialAdministrator; }
    public void setInitialAdministrator(String initialAdministrator) { this.initialAdministrator = initialAdministrator; }
    public boolean isAuditEnabled() { return auditEnabled; }
    public void setAuditEnabled(boolean auditEnabled) { this.auditEnabled = auditEnabled; }
}
