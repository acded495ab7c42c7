package com.healthauth.core.event;

import com.healthauth.core.domain.Role;

import java.time.Instant;

/**
 * Announcement of a committed transition.
 *
 * @param eventType what happened
 * @param actor     identity that performed the operation
 * @param subject   identity the operation targeted (registered principal, doctor, patient or new administrator)
 * @param role      role bound by a registration, otherwise null
 * @param recordId  ID of an added record, otherwise null
 * @param timestamp when the transition was committed
 */
public record LedgerEvent(
        LedgerEventType eventType,
        String actor,
        String subject,
        Role role,
        Long recordId,
        Instant timestamp
) {
    public static LedgerEvent registered(String actor, String subject, Role role, Instant timestamp) {
        return new LedgerEvent(LedgerEventType.PRINCIPAL_REGISTERED, actor, subject, role, null, timestamp);
    }

    public static LedgerEvent granted(String patient, String doctor, Instant timestamp) {
        return new LedgerEvent(LedgerEventType.ACCESS_GRANTED, patient, doctor, null, null, timestamp);
    }

    public static LedgerEvent revoked(String patient, String doctor, Instant timestamp) {
        return new LedgerEvent(LedgerEventType.ACCESS_REVOKED, patient, doctor, null, null, timestamp);
    }

    public static LedgerEvent recordAdded(String doctor, String patient, long recordId, Instant timestamp) {
        return new LedgerEvent(LedgerEventType.RECORD_ADDED, doctor, patient, null, recordId, timestamp);
    }

    public static LedgerEvent administratorChanged(String previous, String next, Instant timestamp) {
        return new LedgerEvent(LedgerEventType.ADMINISTRATOR_CHANGED, previous, next, null, null, timestamp);
    }
}
