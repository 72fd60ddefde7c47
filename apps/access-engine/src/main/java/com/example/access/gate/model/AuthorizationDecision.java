package com.example.access.gate.model;

import com.example.access.privilege.model.Scope;

/**
 * Outcome of one gate evaluation.
 *
 * <p>{@code reason} is safe to return to clients and never names scopes or levels.
 * {@code grantedScope} is set only for allowed decisions, so the caller can filter
 * the data it returns.
 */
public record AuthorizationDecision(
        Outcome outcome,
        DecisionRule rule,
        String privilegeCode,
        String reason,
        Scope grantedScope
) {
    public enum Outcome {
        ALLOWED,
        FORBIDDEN,
        UNAUTHENTICATED
    }

    static final String REASON_AUTHENTICATION_REQUIRED = "Authentication required";
    static final String REASON_INSUFFICIENT_ROLE = "Insufficient permissions";
    static final String REASON_INSUFFICIENT_PRIVILEGES = "Insufficient privileges";
    static final String REASON_OUT_OF_SCOPE = "Target member is outside your access scope";

    public static AuthorizationDecision allowed(DecisionRule rule, String privilegeCode, Scope grantedScope) {
        return new AuthorizationDecision(Outcome.ALLOWED, rule, privilegeCode, null, grantedScope);
    }

    public static AuthorizationDecision unauthenticated(DecisionRule rule, String privilegeCode) {
        return new AuthorizationDecision(Outcome.UNAUTHENTICATED, rule, privilegeCode,
                REASON_AUTHENTICATION_REQUIRED, null);
    }

    public static AuthorizationDecision forbidden(DecisionRule rule, String privilegeCode) {
        String reason = switch (rule) {
            case ROLE_LEVEL -> REASON_INSUFFICIENT_ROLE;
            case TARGET_OUT_OF_SCOPE -> REASON_OUT_OF_SCOPE;
            default -> REASON_INSUFFICIENT_PRIVILEGES;
        };
        return new AuthorizationDecision(Outcome.FORBIDDEN, rule, privilegeCode, reason, null);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }

    public boolean isForbidden() {
        return outcome == Outcome.FORBIDDEN;
    }

    public boolean isUnauthenticated() {
        return outcome == Outcome.UNAUTHENTICATED;
    }
}
