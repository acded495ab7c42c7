package com.healthauth.core.consent;

import com.healthauth.core.domain.LedgerErrorKind;
import com.healthauth.core.domain.LedgerResult;
import com.healthauth.core.domain.Role;
import com.healthauth.core.registry.PrincipalRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Patient to doctor access grants.
 * <p>
 * An absent entry reads as not granted. Grants behave like a capability list: the doctor's
 * role is checked when the grant is made, and a later role change does not clear it.
 * The caller's patient role is checked by the authority before {@link #grant} or
 * {@link #revoke} is invoked.
 */
public class ConsentMatrix {

    private final PrincipalRegistry registry;
    private final Map<String, Map<String, Boolean>> grants;

    public ConsentMatrix(PrincipalRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("Registry cannot be null");
        }
        this.registry = registry;
        this.grants = new LinkedHashMap<>();
    }

    /**
     * Grants {@code doctor} write access to records of {@code patient}. Idempotent.
     */
    public LedgerResult<Void> grant(String patient, String doctor) {
        if (!registry.hasRole(doctor, Role.DOCTOR)) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_COUNTERPARTY, "Invalid doctor: " + doctor);
        }
        grants.computeIfAbsent(patient, k -> new LinkedHashMap<>()).put(doctor, Boolean.TRUE);
        return LedgerResult.ok();
    }

    public LedgerResult<Void> revoke(String patient, String doctor) {
        if (!isGranted(patient, doctor)) {
            return LedgerResult.failure(LedgerErrorKind.NOT_GRANTED,
                    "Access not granted by " + patient + " to " + doctor);
        }
        grants.get(patient).put(doctor, Boolean.FALSE);
        return LedgerResult.ok();
    }

    public boolean isGranted(String patient, String doctor) {
        if (patient == null || doctor == null) {
            return false;
        }
        return grants.getOrDefault(patient, Map.of()).getOrDefault(doctor, Boolean.FALSE);
    }

    /**
     * Doctors currently holding an active grant from the patient.
     */
    public Set<String> grantedDoctors(String patient) {
        Map<String, Boolean> row = patient != null ? grants.get(patient) : null;
        if (row == null) {
            return Set.of();
        }
        Set<String> doctors = new LinkedHashSet<>();
        row.forEach((doctor, granted) -> {
            if (granted) {
                doctors.add(doctor);
            }
        });
        return Collections.unmodifiableSet(doctors);
    }

    /**
     * Every stored entry, revoked ones included, in insertion order.
     */
    public List<ConsentEntry> entries() {
        List<ConsentEntry> entries = new ArrayList<>();
        grants.forEach((patient, row) ->
                row.forEach((doctor, granted) -> entries.add(new ConsentEntry(patient, doctor, granted))));
        return List.copyOf(entries);
    }

    /**
     * Writes an entry verbatim. Used when rebuilding from a snapshot.
     */
    public void restore(ConsentEntry entry) {
        grants.computeIfAbsent(entry.patient(), k -> new LinkedHashMap<>()).put(entry.doctor(), entry.granted());
    }

    /**
     * A single patient/doctor cell of the matrix.
     */
    public record ConsentEntry(String patient, String doctor, boolean granted) {}
}
