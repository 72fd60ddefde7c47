package com.example.access.privilege.model;

/**
 * Override-aware view of one catalog entry for one member. Computed per call, never stored.
 */
public record EffectivePrivilege(
        String code,
        String name,
        String category,
        boolean future,
        Scope defaultScope,
        Scope effectiveScope,
        boolean hasOverride
) {
    static EffectivePrivilege inherited(PrivilegeDefinition definition, Scope defaultScope) {
        return new EffectivePrivilege(definition.code(), definition.displayName(), definition.category(),
                definition.future(), defaultScope, defaultScope, false);
    }

    static EffectivePrivilege overridden(PrivilegeDefinition definition, Scope defaultScope, Scope overrideScope) {
        return new EffectivePrivilege(definition.code(), definition.displayName(), definition.category(),
                definition.future(), defaultScope, overrideScope, true);
    }

    public static EffectivePrivilege of(PrivilegeDefinition definition, Scope defaultScope, Scope overrideScope) {
        return overrideScope == null
                ? inherited(definition, defaultScope)
                : overridden(definition, defaultScope, overrideScope);
    }
}
