package com.example.access.privilege.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Role a member holds within one unit. A member holds exactly one role per unit membership.
 *
 * <p>The trust level drives the coarse endpoint-class gate only; per-resource
 * access is decided by scopes.
 */
public enum UnitRole {
    MEMBER("member", "Member", 1),
    PARENT("parent", "Parent/Guardian", 1),
    VOLUNTEER("volunteer", "Volunteer", 1),
    ASSISTANT("assistant", "Assistant", 1),
    CO_LEADER("co-leader", "Co-Leader", 2),
    COOKIE_LEADER("cookie_leader", "Cookie Leader", 2),
    TROOP_LEADER("troop_leader", "Troop Leader", 2),
    COUNCIL_ADMIN("council_admin", "Council Administrator", 3);

    /** Role used when a caller supplies a role code nobody recognizes. */
    public static final UnitRole LOWEST_TRUST = MEMBER;

    private final String code;
    private final String displayName;
    private final int level;

    UnitRole(String code, String displayName, int level) {
        this.code = code;
        this.displayName = displayName;
        this.level = level;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getLevel() {
        return level;
    }

    public boolean isAdministrator() {
        return this == COUNCIL_ADMIN;
    }

    /**
     * Monotonic level comparison used to gate whole endpoint classes.
     */
    public boolean hasLevelOf(UnitRole required) {
        return level >= required.level;
    }

    public static Optional<UnitRole> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (UnitRole role : values()) {
            if (role.code.equals(code)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
