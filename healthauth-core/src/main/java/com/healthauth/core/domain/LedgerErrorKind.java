package com.healthauth.core.domain;

/**
 * Reasons an authority operation can be rejected.
 * Every rejection leaves the authority state untouched.
 */
public enum LedgerErrorKind {
    /** Caller lacks the role or identity the operation requires. */
    UNAUTHORIZED,
    /** A supplied identity is null or blank. */
    INVALID_IDENTITY,
    /** A referenced principal is missing or holds the wrong role. */
    INVALID_COUNTERPARTY,
    /** Revoke attempted on a pair with no active grant. */
    NOT_GRANTED,
    /** The patient has not granted the writing doctor access. */
    ACCESS_DENIED,
    /** The fingerprint was already committed. */
    REPLAY_DETECTED
}
