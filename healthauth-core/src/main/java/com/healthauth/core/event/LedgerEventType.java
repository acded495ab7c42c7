package com.healthauth.core.event;

/**
 * Accepted transitions announced by the authority.
 */
public enum LedgerEventType {
    PRINCIPAL_REGISTERED,
    ACCESS_GRANTED,
    ACCESS_REVOKED,
    RECORD_ADDED,
    ADMINISTRATOR_CHANGED,

    // Wildcard for subscribing to all events
    ALL
}
