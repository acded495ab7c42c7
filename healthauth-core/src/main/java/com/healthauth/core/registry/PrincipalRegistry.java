package com.healthauth.core.registry;

import com.healthauth.core.domain.LedgerErrorKind;
import com.healthauth.core.domain.LedgerResult;
import com.healthauth.core.domain.Principal;
import com.healthauth.core.domain.Role;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Identity to role bindings.
 * Identities are permanent once seen; only their role can be reassigned.
 * Administrator checks happen in the authority before a call reaches this class.
 */
public class PrincipalRegistry {

    private final Map<String, Principal> principals;

    public PrincipalRegistry() {
        this.principals = new LinkedHashMap<>();
    }

    /**
     * Inserts or overwrites the role of an identity and marks it as existing.
     *
     * @param identity principal identity
     * @param role     role to bind
     * @return the stored principal, or {@code INVALID_IDENTITY} for a null or blank identity
     */
    public LedgerResult<Principal> assign(String identity, Role role) {
        if (role == null) {
            throw new IllegalArgumentException("Role cannot be null");
        }
        if (!isValidIdentity(identity)) {
            return LedgerResult.failure(LedgerErrorKind.INVALID_IDENTITY, "Identity cannot be null or blank");
        }
        Principal principal = Principal.of(identity, role);
        principals.put(identity, principal);
        return LedgerResult.success(principal);
    }

    /**
     * Clears the role of an existing identity. Unknown identities are left alone.
     */
    public void resetRole(String identity) {
        Principal existing = identity != null ? principals.get(identity) : null;
        if (existing != null) {
            principals.put(identity, existing.withRole(Role.NONE));
        }
    }

    public Optional<Role> roleOf(String identity) {
        return find(identity).map(Principal::role);
    }

    public Optional<Principal> find(String identity) {
        if (identity == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(principals.get(identity));
    }

    public boolean hasRole(String identity, Role role) {
        return find(identity).map(p -> p.holds(role)).orElse(false);
    }

    public boolean contains(String identity) {
        return identity != null && principals.containsKey(identity);
    }

    /**
     * Principals in registration order.
     */
    public List<Principal> principals() {
        return List.copyOf(principals.values());
    }

    public int size() {
        return principals.size();
    }

    public static boolean isValidIdentity(String identity) {
        return identity != null && !identity.isBlank();
    }
}
