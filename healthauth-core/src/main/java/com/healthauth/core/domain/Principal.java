package com.healthauth.core.domain;

import java.util.Objects;

/**
 * An identity known to the authority, with its current role.
 * Entries are never removed; only the role is reassigned.
 */
public record Principal(
        String identity,
        Role role,
        boolean exists
) {
    public Principal {
        Objects.requireNonNull(identity, "Identity cannot be null");
        Objects.requireNonNull(role, "Role cannot be null");
    }

    public static Principal of(String identity, Role role) {
        return new Principal(identity, role, true);
    }

    public Principal withRole(Role newRole) {
        return new Principal(identity, newRole, true);
    }

    public boolean holds(Role expected) {
        return exists && role == expected;
    }
}
