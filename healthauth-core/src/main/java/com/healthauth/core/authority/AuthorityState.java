package com.healthauth.core.authority;

import com.healthauth.core.consent.ConsentMatrix;
import com.healthauth.core.consent.ConsentMatrix.ConsentEntry;
import com.healthauth.core.domain.LedgerErrorKind;
import com.healthauth.core.domain.LedgerResult;
import com.healthauth.core.domain.MedicalRecord;
import com.healthauth.core.domain.Principal;
import com.healthauth.core.domain.Role;
import com.healthauth.core.event.LedgerEvent;
import com.healthauth.core.event.LedgerEventBus;
import com.healthauth.core.ledger.RecordLedger;
import com.healthauth.core.registry.PrincipalRegistry;
import com.healthauth.core.snapshot.LedgerSnapshot;
import com.healthauth.core.snapshot.SnapshotException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Single administrator authority over principals, consents and records.
 * <p>
 * Every operation enters here. The caller's role is checked against the registry, then the
 * consent matrix or record ledger is mutated. All public methods synchronize on the instance,
 * so a check and the mutation it guards never interleave with another operation.
 * A rejected operation changes nothing and emits no event.
 * <p>
 * Instances share no state; each one is an isolated unit of consistency.
 */
public class AuthorityState {

    private final PrincipalRegistry registry;
    private final ConsentMatrix consents;
    private final RecordLedger ledger;
    private final LedgerEventBus events;
    private final Clock clock;
    private String administrator;

    public AuthorityState(String initialAdministrator) {
        this(initialAdministrator, Clock.systemUTC());
    }

    /**
     * Creates an authority whose initial administrator exists with no clinical role.
     *
     * @param initialAdministrator administrator identity
     * @param clock                clock used to timestamp events
     */
    public AuthorityState(String initialAdministrator, Clock clock) {
        this(clock);
        if (!PrincipalRegistry.isValidIdentity(initialAdministrator)) {
            throw new IllegalArgumentException("Initial administrator cannot be null or blank");
        }
        this.administrator = initialAdministrator;
        registry.assign(initialAdministrator, Role.NONE);
    }

    private AuthorityState(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.clock = clock;
        this.registry = new PrincipalRegistry();
        this.consents = new ConsentMatrix(registry);
        this.ledger = new RecordLedger(registry, consents);
        this.events = new LedgerEventBus();
    }

    // ==================== Registration ====================

    /**
     * Binds {@code role} to {@code identity}, overwriting any previous role.
     */
    public synchronized LedgerResult<Principal> register(String caller, String identity, Role role) {
        if (!isAdministrator(caller)) {
            return LedgerResult.failure(LedgerErrorKind.UNAUTHORIZED, "Only the administrator can register principals");
        }
        LedgerResult<Principal> result = registry.assign(identity, role);
        if (result.success()) {
            events.emit(LedgerEvent.registered(caller, identity, role, clock.instant()));
        }
        return result;
    }

    public LedgerResult<Principal> registerDoctor(String caller, String identity) {
        return register(caller, identity, Role.DOCTOR);
    }

    public LedgerResult<Principal> registerPatient(String caller, String identity) {
        return register(caller, identity, Role.PATIENT);
    }

    // ==================== Consent ====================

    /**
     * Lets the calling patient grant {@code doctor} write access. Granting twice is a no-op.
     */
    public synchronized LedgerResult<Void> grant(String caller, String doctor) {
        if (!registry.hasRole(caller, Role.PATIENT)) {
            return LedgerResult.failure(LedgerErrorKind.UNAUTHORIZED, "Only a patient can grant access");
        }
        LedgerResult<Void> result = consents.grant(caller, doctor);
        if (result.success()) {
            events.emit(LedgerEvent.granted(caller, doctor, clock.instant()));
        }
        return result;
    }

    public synchronized LedgerResult<Void> revoke(String caller, String doctor) {
        if (!registry.hasRole(caller, Role.PATIENT)) {
            return LedgerResult.failure(LedgerErrorKind.UNAUTHORIZED, "Only a patient can revoke access");
        }
        LedgerResult<Void> result = consents.revoke(caller, doctor);
        if (result.success()) {
            events.emit(LedgerEvent.revoked(caller, doctor, clock.instant()));
        }
        return result;
    }

    // ==================== Records ====================

    /**
     * Commits a record written by the calling doctor.
     *
     * @param caller      writing doctor
     * @param patient     patient the record belongs to
     * @param fingerprint opaque record fingerprint
     * @param now         record timestamp
     * @return the new record ID
     */
    public synchronized LedgerResult<Long> addRecord(String caller, String patient, String fingerprint, Instant now) {
        LedgerResult<Long> result = ledger.add(caller, patient, fingerprint, now);
        if (result.success()) {
            events.emit(LedgerEvent.recordAdded(caller, patient, result.value(), now));
        }
        return result;
    }

    // ==================== Administration ====================

    /**
     * Hands the administrator role to {@code newAdministrator}.
     * The outgoing administrator keeps its registry entry with no role; the incoming one
     * exists with no role.
     */
    public synchronized LedgerResult<Void> transfer(String caller, String newAdministrator) {
        if (!isAdministrator(caller)) {
            return LedgerResult.failure(LedgerErrorKind.UNAUTHORIZED, "Only the administrator can transfer authority");
        }
        if (!PrincipalRegistry.isValidIdentity(newAdministrator)) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_IDENTITY, "New administrator cannot be null or blank");
        }
        String previous = administrator;
        registry.resetRole(previous);
        administrator = newAdministrator;
        registry.assign(newAdministrator, Role.NONE);
        events.emit(LedgerEvent.administratorChanged(previous, newAdministrator, clock.instant()));
        return LedgerResult.ok();
    }

    // ==================== Queries ====================

    public synchronized String administrator() {
        return administrator;
    }

    public synchronized boolean isAdministrator(String identity) {
        return identity != null && identity.equals(administrator);
    }

    public synchronized Optional<Role> roleOf(String identity) {
        return registry.roleOf(identity);
    }

    public synchronized Optional<Principal> principal(String identity) {
        return registry.find(identity);
    }

    public synchronized boolean isGranted(String patient, String doctor) {
        return consents.isGranted(patient, doctor);
    }

    public synchronized Set<String> grantedDoctors(String patient) {
        return consents.grantedDoctors(patient);
    }

    public synchronized Optional<MedicalRecord> record(long recordId) {
        return ledger.find(recordId);
    }

    public synchronized List<MedicalRecord> records() {
        return ledger.records();
    }

    public synchronized List<MedicalRecord> recordsFor(String patient) {
        return ledger.recordsFor(patient);
    }

    public synchronized int recordCount() {
        return ledger.size();
    }

    public synchronized boolean isCommitted(String fingerprint) {
        return ledger.isCommitted(fingerprint);
    }

    /**
     * Event bus announcing committed transitions. Handlers run while the authority is locked.
     */
    public LedgerEventBus events() {
        return events;
    }

    // ==================== Snapshots ====================

    public synchronized LedgerSnapshot snapshot() {
        List<String> fingerprints = new ArrayList<>();
        for (MedicalRecord record : ledger.records()) {
            fingerprints.add(record.fingerprint());
        }
        return new LedgerSnapshot(
                administrator,
                registry.principals(),
                consents.entries(),
                ledger.records(),
                fingerprints
        );
    }

    public static AuthorityState restore(LedgerSnapshot snapshot) {
        return restore(snapshot, Clock.systemUTC());
    }

    /**
     * Rebuilds an independent authority from a snapshot.
     *
     * @throws SnapshotException if the snapshot is internally inconsistent
     */
    public static AuthorityState restore(LedgerSnapshot snapshot, Clock clock) {
        if (snapshot == null) {
            throw new IllegalArgumentException("Snapshot cannot be null");
        }
        if (!PrincipalRegistry.isValidIdentity(snapshot.administrator())) {
            throw new SnapshotException("Snapshot has no administrator");
        }

        AuthorityState state = new AuthorityState(clock);
        for (Principal principal : snapshot.principals()) {
            if (state.registry.assign(principal.identity(), principal.role()).isFailure()) {
                throw new SnapshotException("Snapshot contains an invalid principal identity");
            }
        }
        if (!state.registry.contains(snapshot.administrator())) {
            throw new SnapshotException("Administrator " + snapshot.administrator() + " has no principal entry");
        }
        state.administrator = snapshot.administrator();

        for (ConsentEntry entry : snapshot.consents()) {
            requirePrincipal(state, entry.patient());
            requirePrincipal(state, entry.doctor());
            state.consents.restore(entry);
        }

        for (MedicalRecord record : snapshot.records()) {
            requirePrincipal(state, record.patient());
            requirePrincipal(state, record.doctor());
            if (record.id() != state.ledger.size()) {
                throw new SnapshotException("Record IDs are not dense at " + record.id());
            }
            if (state.ledger.isCommitted(record.fingerprint())) {
                throw new SnapshotException("Fingerprint committed twice: " + record.fingerprint());
            }
            state.ledger.restore(record);
        }

        if (snapshot.fingerprints().size() != state.ledger.size()
                || !new HashSet<>(snapshot.fingerprints()).equals(state.ledger.committedFingerprints())) {
            throw new SnapshotException("Replay set does not match committed records");
        }
        return state;
    }

    private static void requirePrincipal(AuthorityState state, String identity) {
        if (!state.registry.contains(identity)) {
            throw new SnapshotException("Unknown principal referenced: " + identity);
        }
    }
}
