package com.healthauth.core.snapshot;

import com.healthauth.core.consent.ConsentMatrix.ConsentEntry;
import com.healthauth.core.domain.MedicalRecord;
import com.healthauth.core.domain.Principal;

import java.util.List;

/**
 * Point-in-time copy of an authority's full state.
 *
 * @param administrator current administrator identity
 * @param principals    registry entries in registration order
 * @param consents      every consent cell, revoked ones included
 * @param records       committed records in ID order
 * @param fingerprints  the replay set
 */
public record LedgerSnapshot(
        String administrator,
        List<Principal> principals,
        List<ConsentEntry> consents,
        List<MedicalRecord> records,
        List<String> fingerprints
) {
    public LedgerSnapshot {
        principals = principals != null ? List.copyOf(principals) : List.of();
        consents = consents != null ? List.copyOf(consents) : List.of();
        records = records != null ? List.copyOf(records) : List.of();
        fingerprints = fingerprints != null ? List.copyOf(fingerprints) : List.of();
    }
}
