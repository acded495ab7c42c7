package com.healthauth.core.domain;

/**
 * Clinical role held by a principal.
 * The administrator holds {@link #NONE} while serving.
 */
public enum Role {
    NONE,
    DOCTOR,
    PATIENT
}
