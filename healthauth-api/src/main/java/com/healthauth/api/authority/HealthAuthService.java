package com.healthauth.api.authority;

import com.healthauth.api.config.HealthAuthProperties;
import com.healthauth.core.audit.AuthorityAuditLog;
import com.healthauth.core.audit.AuthorityAuditLog.VerificationResult;
import com.healthauth.core.authority.AuthorityState;
import com.healthauth.core.domain.LedgerErrorKind;
import com.healthauth.core.domain.LedgerResult;
import com.healthauth.core.domain.MedicalRecord;
import com.healthauth.core.domain.Principal;
import com.healthauth.core.domain.Role;
import com.healthauth.core.event.LedgerEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Service facade over the record authority.
 * <p>
 * Supplies record timestamps from the configured clock, logs every outcome and records it in
 * the audit chain. Results are returned exactly as the authority produced them.
 */
@Service
public class HealthAuthService {

    private static final Logger log = LoggerFactory.getLogger(HealthAuthService.class);

    private final AuthorityState authority;
    private final AuthorityAuditLog auditLog;
    private final Clock clock;
    private final boolean auditEnabled;

    public HealthAuthService(
            AuthorityState authority,
            AuthorityAuditLog auditLog,
            Clock clock,
            HealthAuthProperties properties) {
        this.authority = authority;
        this.auditLog = auditLog;
        this.clock = clock;
        this.auditEnabled = properties.isAuditEnabled();
        if (auditEnabled) {
            authority.events().subscribe(LedgerEventType.ALL, auditLog::logAccepted);
        }
        authority.events().subscribe(LedgerEventType.ADMINISTRATOR_CHANGED,
                event -> log.info("Administrator changed from {} to {}", event.actor(), event.subject()));
        log.info("Record authority started with administrator {}", authority.administrator());
    }

    public LedgerResult<Principal> register(String caller, String identity, Role role) {
        LedgerResult<Principal> result = authority.register(caller, identity, role);
        if (result.success()) {
            log.info("Principal {} registered as {} by {}", identity, role, caller);
        }
        return observe("register", caller, result);
    }

    public LedgerResult<Void> grantAccess(String patient, String doctor) {
        LedgerResult<Void> result = authority.grant(patient, doctor);
        if (result.success()) {
            log.info("Patient {} granted access to {}", patient, doctor);
        }
        return observe("grant", patient, result);
    }

    public LedgerResult<Void> revokeAccess(String patient, String doctor) {
        LedgerResult<Void> result = authority.revoke(patient, doctor);
        if (result.success()) {
            log.info("Patient {} revoked access from {}", patient, doctor);
        }
        return observe("revoke", patient, result);
    }

    /**
     * Commits a record written by {@code doctor}, timestamped with the service clock.
     */
    public LedgerResult<Long> addRecord(String doctor, String patient, String fingerprint) {
        Instant now = clock.instant();
        LedgerResult<Long> result = authority.addRecord(doctor, patient, fingerprint, now);
        if (result.success()) {
            log.info("Record #{} added by {} for {}", result.value(), doctor, patient);
        } else if (result.error() == LedgerErrorKind.REPLAY_DETECTED) {
            log.warn("Replay attempt blocked for fingerprint {} submitted by {}", fingerprint, doctor);
        }
        return observe("addRecord", doctor, result);
    }

    public LedgerResult<Void> transferAuthority(String caller, String newAdministrator) {
        return observe("transfer", caller, authority.transfer(caller, newAdministrator));
    }

    public String getAdministrator() {
        return authority.administrator();
    }

    public Optional<Principal> getPrincipal(String identity) {
        return authority.principal(identity);
    }

    public boolean isGranted(String patient, String doctor) {
        return authority.isGranted(patient, doctor);
    }

    public Set<String> getGrantedDoctors(String patient) {
        return authority.grantedDoctors(patient);
    }

    public Optional<MedicalRecord> getRecord(long recordId) {
        return authority.record(recordId);
    }

    public List<MedicalRecord> getRecordsFor(String patient) {
        return authority.recordsFor(patient);
    }

    public VerificationResult verifyAudit() {
        return auditLog.verifyIntegrity();
    }

    private <T> LedgerResult<T> observe(String operation, String caller, LedgerResult<T> result) {
        if (result.isFailure()) {
            log.warn("{} by {} rejected: {} ({})", operation, caller, result.error(), result.message());
            if (auditEnabled) {
                auditLog.logRejected(operation, caller, result.error(), result.message());
            }
        }
        return result;
    }
}
