package com.example.access.privilege.model;

import java.util.Objects;

/**
 * One controllable action in the privilege catalog.
 *
 * @param code        stable identifier, unique across the catalog
 * @param displayName human-readable name
 * @param category    grouping shown to administrators
 * @param future      reserved for a feature that is not active yet
 */
public record PrivilegeDefinition(
        String code,
        String displayName,
        String category,
        boolean future
) {
    public PrivilegeDefinition {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(category, "category");
    }

    public static PrivilegeDefinition active(String code, String displayName, String category) {
        return new PrivilegeDefinition(code, displayName, category, false);
    }

    public static PrivilegeDefinition future(String code, String displayName, String category) {
        return new PrivilegeDefinition(code, displayName, category, true);
    }
}
