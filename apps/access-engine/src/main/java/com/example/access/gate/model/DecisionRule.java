package com.example.access.gate.model;

/**
 * Rule that produced an authorization decision.
 */
public enum DecisionRule {
    NO_SESSION,
    SESSION_EXPIRED,
    ROLE_LEVEL,
    UNKNOWN_PRIVILEGE,
    INVALID_OVERRIDES,
    ADMINISTRATOR_BYPASS,
    SUPERUSER_BYPASS,
    SCOPE_NONE,
    TARGET_OUT_OF_SCOPE,
    SCOPE_GRANTED;

    public boolean isBypass() {
        return this == ADMINISTRATOR_BYPASS || this == SUPERUSER_BYPASS;
    }
}
