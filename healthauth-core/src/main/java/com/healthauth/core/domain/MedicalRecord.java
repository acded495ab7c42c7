package com.healthauth.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable reference to a committed medical record.
 *
 * @param id          dense 0-based sequence number assigned by the ledger
 * @param patient     identity of the patient the record belongs to
 * @param doctor      identity of the doctor who wrote it
 * @param fingerprint opaque content fingerprint, unique across the ledger
 * @param createdAt   commit timestamp
 */
public record MedicalRecord(
        long id,
        String patient,
        String doctor,
        String fingerprint,
        Instant createdAt
) {
    public MedicalRecord {
        if (id < 0) {
            throw new IllegalArgumentException("Record ID cannot be negative");
        }
        Objects.requireNonNull(patient, "Patient cannot be null");
        Objects.requireNonNull(doctor, "Doctor cannot be null");
        Objects.requireNonNull(fingerprint, "Fingerprint cannot be null");
        Objects.requireNonNull(createdAt, "Creation time cannot be null");
    }
}
