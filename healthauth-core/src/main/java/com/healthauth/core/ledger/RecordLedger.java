package com.healthauth.core.ledger;

import com.healthauth.core.consent.ConsentMatrix;
import com.healthauth.core.domain.LedgerErrorKind;
import com.healthauth.core.domain.LedgerResult;
import com.healthauth.core.domain.MedicalRecord;
import com.healthauth.core.domain.Role;
import com.healthauth.core.registry.PrincipalRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only record sequence with ledger-wide replay protection.
 * <p>
 * A fingerprint accepted once is never accepted again, whatever the patient, doctor,
 * role or consent state of a later call. The replay set only grows.
 */
public class RecordLedger {

    private final PrincipalRegistry registry;
    private final ConsentMatrix consents;
    private final List<MedicalRecord> records;
    private final Set<String> committedFingerprints;

    public RecordLedger(PrincipalRegistry registry, ConsentMatrix consents) {
        if (registry == null) {
            throw new IllegalArgumentException("Registry cannot be null");
        }
        if (consents == null) {
            throw new IllegalArgumentException("Consent matrix cannot be null");
        }
        this.registry = registry;
        this.consents = consents;
        this.records = new ArrayList<>();
        this.committedFingerprints = new HashSet<>();
    }

    /**
     * Commits a record written by {@code doctor} for {@code patient}.
     * <p>
     * Checks run in a fixed order and are re-evaluated on every call:
     * writer role, patient role, consent, then replay.
     *
     * @return the new record ID, or the first failed check
     */
    public LedgerResult<Long> add(String doctor, String patient, String fingerprint, Instant now) {
        if (!registry.hasRole(doctor, Role.DOCTOR)) {
            return LedgerResult.failure(LedgerErrorKind.UNAUTHORIZED, "Only a doctor can add records");
        }
        if (fingerprint == null) {
            throw new IllegalArgumentException("Fingerprint cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("Timestamp cannot be null");
        }
        if (!registry.hasRole(patient, Role.PATIENT)) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_COUNTERPARTY, "Invalid patient: " + patient);
        }
        if (!consents.isGranted(patient, doctor)) {
            return LedgerResult.failure(LedgerErrorKind.ACCESS_DENIED, "Access not granted by patient");
        }
        if (committedFingerprints.contains(fingerprint)) {
            return LedgerResult.failure(LedgerErrorKind.REPLAY_DETECTED,
                    "Record fingerprint already committed: " + fingerprint);
        }

        long id = records.size();
        records.add(new MedicalRecord(id, patient, doctor, fingerprint, now));
        committedFingerprints.add(fingerprint);
        return LedgerResult.success(id);
    }

    public Optional<MedicalRecord> find(long recordId) {
        if (recordId < 0 || recordId >= records.size()) {
            return Optional.empty();
        }
        return Optional.of(records.get((int) recordId));
    }

    /**
     * All records in ID order.
     */
    public List<MedicalRecord> records() {
        return List.copyOf(records);
    }

    public List<MedicalRecord> recordsFor(String patient) {
        return records.stream()
                .filter(r -> r.patient().equals(patient))
                .toList();
    }

    public boolean isCommitted(String fingerprint) {
        return fingerprint != null && committedFingerprints.contains(fingerprint);
    }

    public Set<String> committedFingerprints() {
        return Set.copyOf(committedFingerprints);
    }

    public int size() {
        return records.size();
    }

    /**
     * Appends a previously committed record verbatim. Used when rebuilding from a snapshot;
     * the caller guarantees IDs arrive in order.
     */
    public void restore(MedicalRecord record) {
        if (record.id() != records.size()) {
            throw new IllegalArgumentException("Record " + record.id() + " restored out of order");
        }
        records.add(record);
        committedFingerprints.add(record.fingerprint());
    }
}
