package com.example.access.audit;

import com.example.access.gate.model.AccessRequest;
import com.example.access.gate.model.AuthenticationContext;
import com.example.access.gate.model.AuthorizationDecision;
import com.example.access.privilege.model.Scope;
import com.example.access.privilege.model.UnitRole;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.example.access.common.util.StringSanitizer.orEmpty;

/**
 * Structured audit record of an authorization-relevant decision.
 */
public record AccessAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,
        Action action,

        // Actor
        String actorId,
        String unitId,
        String actorRole,

        // Decision inputs
        String privilegeCode,
        Integer requiredLevel,
        Integer actualLevel,
        Scope actualScope,
        String targetOwnerId,

        // Decision
        String ruleId,
        String reason
) {
    public enum Action {
        GRANT, DENY, BYPASS, ANOMALY
    }

    /**
     * Creates an event for a gate decision.
     *
     * @param context     session, may be {@code null} for unauthenticated requests
     * @param actorRole   role the decision was evaluated with, {@code null} if not reached
     * @param actualScope effective scope the decision was evaluated with, {@code null} if not reached
     * @param decidedAt   instant the decision was evaluated against
     */
    public static AccessAuditEvent forDecision(
            Instant decidedAt,
            AuthenticationContext context,
            UnitRole actorRole,
            AccessRequest request,
            AuthorizationDecision decision,
            Scope actualScope) {

        Action action;
        if (decision.isAllowed()) {
            action = decision.rule().isBypass() ? Action.BYPASS : Action.GRANT;
        } else {
            action = Action.DENY;
        }

        return new AccessAuditEvent(
                UUID.randomUUID().toString(),
                decidedAt,
                action,
                context != null ? context.userId() : null,
                context != null ? context.unitId() : null,
                actorRole != null ? actorRole.getCode() : null,
                request.privilegeCode(),
                request.requiredRole().getLevel(),
                actorRole != null ? actorRole.getLevel() : null,
                actualScope,
                request.targetOwnerId(),
                decision.rule().name(),
                decision.reason()
        );
    }

    /**
     * Creates an event for overrides that name privilege codes missing from the catalog.
     */
    public static AccessAuditEvent anomalousOverrides(
            Instant detectedAt, String memberId, UnitRole role, List<String> unknownCodes) {
        return new AccessAuditEvent(
                UUID.randomUUID().toString(),
                detectedAt,
                Action.ANOMALY,
                memberId,
                null,
                role != null ? role.getCode() : null,
                String.join(",", unknownCodes),
                null,
                role != null ? role.getLevel() : null,
                null,
                null,
                "UNKNOWN_OVERRIDE_CODE",
                "Override references privilege codes missing from the catalog"
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "access_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("action", action.name().toLowerCase()),
                Map.entry("actor_id", orEmpty(actorId)),
                Map.entry("unit_id", orEmpty(unitId)),
                Map.entry("actor_role", orEmpty(actorRole)),
                Map.entry("privilege_code", orEmpty(privilegeCode)),
                Map.entry("required_level", requiredLevel != null ? requiredLevel : ""),
                Map.entry("actual_level", actualLevel != null ? actualLevel : ""),
                Map.entry("actual_scope", actualScope != null ? actualScope.getCode() : ""),
                Map.entry("target_owner_id", orEmpty(targetOwnerId)),
                Map.entry("rule", orEmpty(ruleId)),
                Map.entry("reason", orEmpty(reason))
        );
    }
}
