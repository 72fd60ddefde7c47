package com.example.access.privilege.model;

import java.util.Objects;

/**
 * Administrator-set exception to a role default for one member and one privilege.
 *
 * <p>The privilege code is kept as a raw string: rows may outlive a catalog change
 * and name a code that no longer exists.
 */
public record PrivilegeOverride(
        String memberId,
        String privilegeCode,
        Scope scope
) {
    public PrivilegeOverride {
        Objects.requireNonNull(privilegeCode, "privilegeCode");
        Objects.requireNonNull(scope, "scope");
    }

    /**
     * Build an override from a persisted row.
     *
     * @throws IllegalArgumentException if {@code scopeCode} is not a valid scope code
     */
    public static PrivilegeOverride of(String memberId, String privilegeCode, String scopeCode) {
        return new PrivilegeOverride(memberId, privilegeCode, Scope.fromCode(scopeCode));
    }
}
