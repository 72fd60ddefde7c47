package com.example.access.privilege.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Breadth of data a granted privilege exposes.
 *
 * <p>Declaration order is the display ranking (broadest first). It is never used
 * to decide whether one scope subsumes another.
 */
public enum Scope {
    TROOP("T", "Troop"),          // whole unit
    DEN("D", "Den"),              // actor's sub-group of the unit
    HOUSEHOLD("H", "Household"),  // actor's linked family members
    SELF("S", "Self"),            // actor's own records
    NONE("none", "None");         // no access

    private final String code;
    private final String displayName;

    Scope(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean grantsAccess() {
        return this != NONE;
    }

    /**
     * Parse a persisted scope code.
     *
     * @throws IllegalArgumentException if the code is not one of T, D, H, S, none
     */
    @JsonCreator
    public static Scope fromCode(String code) {
        if (code != null) {
            for (Scope scope : values()) {
                if (scope.code.equals(code)) {
                    return scope;
                }
            }
        }
        throw new IllegalArgumentException("Invalid scope code: " + code);
    }
}
