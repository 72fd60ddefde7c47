package com.example.access.privilege.defaults;

import com.example.access.exception.PolicyConfigurationException;
import com.example.access.exception.UnknownPrivilegeException;
import com.example.access.privilege.catalog.PrivilegeCatalog;
import com.example.access.privilege.model.PrivilegeDefinition;
import com.example.access.privilege.model.Scope;
import com.example.access.privilege.model.UnitRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense lookup table from (unit role, privilege) to default scope.
 *
 * <p>Stored as a two-dimensional array indexed by role ordinal and catalog index.
 * A table can only be obtained through {@link Builder#build()}, which rejects any
 * missing cell, so every lookup for a catalog code returns a scope.
 *
 * <p>Unrecognized roles resolve to the {@link UnitRole#LOWEST_TRUST} row.
 */
@Slf4j
public final class RoleDefaultTable {

    private final PrivilegeCatalog catalog;
    private final Scope[][] cells;

    private RoleDefaultTable(PrivilegeCatalog catalog, Scope[][] cells) {
        this.catalog = catalog;
        this.cells = cells;
    }

    public static Builder builder(PrivilegeCatalog catalog) {
        return new Builder(catalog);
    }

    /**
     * Built-in defaults for the standard catalog.
     */
    public static RoleDefaultTable standard(PrivilegeCatalog catalog) {
        Builder builder = builder(catalog);
        StandardRoleDefaults.populate(builder);
        return builder.build();
    }

    public PrivilegeCatalog catalog() {
        return catalog;
    }

    /**
     * Default scope of a privilege for a role.
     *
     * @param role role, or {@code null} when the caller's role is not recognized
     * @throws UnknownPrivilegeException if the code is not in the catalog
     */
    @NonNull
    public Scope defaultScope(@Nullable UnitRole role, String privilegeCode) {
        return scopeAt(effectiveRole(role), catalog.indexOf(privilegeCode));
    }

    /**
     * Default scope looked up by persisted role code, failing closed on unknown roles.
     */
    @NonNull
    public Scope defaultScope(@Nullable String roleCode, String privilegeCode) {
        return defaultScope(roleOrLowestTrust(roleCode), privilegeCode);
    }

    /**
     * Default row for a role, keyed by privilege code in catalog order.
     */
    public Map<String, Scope> row(@Nullable UnitRole role) {
        Scope[] row = cells[effectiveRole(role).ordinal()];
        Map<String, Scope> result = new LinkedHashMap<>();
        for (int i = 0; i < row.length; i++) {
            result.put(catalog.get(i).code(), row[i]);
        }
        return Collections.unmodifiableMap(result);
    }

    @NonNull
    public UnitRole roleOrLowestTrust(@Nullable String roleCode) {
        return UnitRole.fromCode(roleCode).orElseGet(() -> {
            log.warn("Unrecognized unit role '{}', using defaults of '{}'",
                    roleCode, UnitRole.LOWEST_TRUST.getCode());
            return UnitRole.LOWEST_TRUST;
        });
    }

    Scope scopeAt(UnitRole role, int privilegeIndex) {
        return cells[role.ordinal()][privilegeIndex];
    }

    private static UnitRole effectiveRole(@Nullable UnitRole role) {
        return role != null ? role : UnitRole.LOWEST_TRUST;
    }

    /**
     * Collects cells and validates density and code coverage on {@link #build()}.
     */
    public static final class Builder {

        private final PrivilegeCatalog catalog;
        private final Scope[][] cells;

        private Builder(PrivilegeCatalog catalog) {
            this.catalog = catalog;
            this.cells = new Scope[UnitRole.values().length][catalog.size()];
        }

        /**
         * @throws UnknownPrivilegeException if the code is not in the catalog
         */
        public Builder set(UnitRole role, String privilegeCode, Scope scope) {
            if (!catalog.contains(privilegeCode)) {
                throw new UnknownPrivilegeException(
                        "Default for role '" + role.getCode() + "' names unknown privilege: " + privilegeCode,
                        privilegeCode);
            }
            cells[role.ordinal()][catalog.indexOf(privilegeCode)] = scope;
            return this;
        }

        /**
         * Set one privilege for every role at once, scopes given in {@link UnitRole} declaration order.
         */
        public Builder column(String privilegeCode, Scope... scopesByRole) {
            UnitRole[] roles = UnitRole.values();
            if (scopesByRole.length != roles.length) {
                throw new PolicyConfigurationException(String.format(
                        "Defaults for '%s' list %d scopes, expected one per role (%d)",
                        privilegeCode, scopesByRole.length, roles.length));
            }
            for (int i = 0; i < roles.length; i++) {
                set(roles[i], privilegeCode, scopesByRole[i]);
            }
            return this;
        }

        public Builder row(UnitRole role, Map<String, Scope> scopesByCode) {
            scopesByCode.forEach((code, scope) -> set(role, code, scope));
            return this;
        }

        /**
         * @throws PolicyConfigurationException if any (role, privilege) cell is undefined
         */
        public RoleDefaultTable build() {
            List<String> missing = new ArrayList<>();
            Scope[][] copy = new Scope[cells.length][];
            for (UnitRole role : UnitRole.values()) {
                Scope[] row = cells[role.ordinal()];
                for (int i = 0; i < row.length; i++) {
                    if (row[i] == null) {
                        PrivilegeDefinition definition = catalog.get(i);
                        missing.add(role.getCode() + "/" + definition.code());
                    }
                }
                copy[role.ordinal()] = row.clone();
            }
            if (!missing.isEmpty()) {
                throw new PolicyConfigurationException(
                        "Role default table is incomplete, missing " + missing.size() + " cell(s): " + missing);
            }
            return new RoleDefaultTable(catalog, copy);
        }
    }
}
