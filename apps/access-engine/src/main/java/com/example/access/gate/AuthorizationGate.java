package com.example.access.gate;

import com.example.access.audit.AccessAuditEvent;
import com.example.access.audit.AccessAuditService;
import com.example.access.common.util.StringSanitizer;
import com.example.access.config.properties.AccessProperties;
import com.example.access.exception.AnomalousOverrideException;
import com.example.access.gate.model.AccessRequest;
import com.example.access.gate.model.AuthenticationContext;
import com.example.access.gate.model.AuthorizationDecision;
import com.example.access.gate.model.DecisionRule;
import com.example.access.membership.MemberRelations;
import com.example.access.membership.ScopeMatcher;
import com.example.access.observability.AccessMetrics;
import com.example.access.privilege.model.PrivilegeOverride;
import com.example.access.privilege.model.Scope;
import com.example.access.privilege.model.UnitRole;
import com.example.access.privilege.resolver.EffectivePrivilegeResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Request-time authorization decision for protected operations.
 *
 * <p>Checks run in order and stop at the first failure:
 * <ol>
 *   <li>a live {@link AuthenticationContext} is required, otherwise UNAUTHENTICATED</li>
 *   <li>the privilege must exist in the catalog; a missing code counts as unknown</li>
 *   <li>administrator bypass: a council administrator (or configured superuser) is
 *       allowed without role-level or scope checks. This is the only exception to
 *       scope matching and is always audited as a bypass.</li>
 *   <li>the actor's role level must reach the required role's level</li>
 *   <li>the effective scope must not be {@link Scope#NONE}; a Den scope without a
 *       den assignment degrades to Self when configured</li>
 *   <li>if a target is given, it must fall within the effective scope</li>
 * </ol>
 *
 * <p>The gate never throws for request input. Denials, bypasses and anomalies are
 * reported to the audit service; reporting cannot change the decision.
 */
@Slf4j
@Component
public class AuthorizationGate {

    private final EffectivePrivilegeResolver resolver;
    private final AccessProperties properties;
    private final Clock clock;

    @Nullable
    private final AccessAuditService auditService;

    @Nullable
    private final AccessMetrics metrics;

    public AuthorizationGate(
            EffectivePrivilegeResolver resolver,
            AccessProperties properties,
            Clock clock,
            @Nullable AccessAuditService auditService,
            @Nullable AccessMetrics metrics) {
        this.resolver = resolver;
        this.properties = properties;
        this.clock = clock;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    /**
     * Decide whether the actor may perform {@code privilegeCode} on resources owned by {@code targetOwnerId}.
     */
    @NonNull
    public AuthorizationDecision authorize(
            @Nullable AuthenticationContext context,
            UnitRole requiredRole,
            String privilegeCode,
            @Nullable String targetOwnerId,
            List<PrivilegeOverride> overrides,
            MemberRelations relations) {
        return authorize(context,
                new AccessRequest(privilegeCode, requiredRole, targetOwnerId, overrides, relations));
    }

    @NonNull
    public AuthorizationDecision authorize(@Nullable AuthenticationContext context, @Nullable AccessRequest request) {
        Instant now = clock.instant();
        if (request == null) {
            request = new AccessRequest(null, null, null, null, null);
        }
        String code = request.privilegeCode();

        if (context == null) {
            return finish(now, null, null, request,
                    AuthorizationDecision.unauthenticated(DecisionRule.NO_SESSION, code), null);
        }
        if (!context.isLive(now)) {
            return finish(now, context, null, request,
                    AuthorizationDecision.unauthenticated(DecisionRule.SESSION_EXPIRED, code), null);
        }

        UnitRole actorRole = context.unitRole() != null ? context.unitRole() : UnitRole.LOWEST_TRUST;

        if (!resolver.defaults().catalog().contains(code)) {
            log.warn("Authorization requested for unknown privilege {}", StringSanitizer.forLog(code));
            return finish(now, context, actorRole, request,
                    AuthorizationDecision.forbidden(DecisionRule.UNKNOWN_PRIVILEGE, code), null);
        }

        DecisionRule bypass = bypassRule(context, actorRole);
        if (bypass != null) {
            return finish(now, context, actorRole, request,
                    AuthorizationDecision.allowed(bypass, code, Scope.TROOP), Scope.TROOP);
        }

        if (!actorRole.hasLevelOf(request.requiredRole())) {
            return finish(now, context, actorRole, request,
                    AuthorizationDecision.forbidden(DecisionRule.ROLE_LEVEL, code), null);
        }

        Scope scope;
        try {
            scope = resolver.effectiveScope(actorRole, request.overrides(), code);
        } catch (AnomalousOverrideException e) {
            return finish(now, context, actorRole, request,
                    AuthorizationDecision.forbidden(DecisionRule.INVALID_OVERRIDES, code), null);
        }

        if (!scope.grantsAccess()) {
            return finish(now, context, actorRole, request,
                    AuthorizationDecision.forbidden(DecisionRule.SCOPE_NONE, code), scope);
        }

        MemberRelations relations = request.relations();
        if (scope == Scope.DEN && properties.denFallbackToSelf()
                && relations.denOf(context.userId()).isEmpty()) {
            log.debug("Member {} has no den, narrowing {} from Den to Self",
                    StringSanitizer.forLog(context.userId()), code);
            scope = Scope.SELF;
        }

        if (request.hasTarget()
                && !ScopeMatcher.isInScope(scope, context.userId(), request.targetOwnerId(), relations)) {
            return finish(now, context, actorRole, request,
                    AuthorizationDecision.forbidden(DecisionRule.TARGET_OUT_OF_SCOPE, code), scope);
        }

        return finish(now, context, actorRole, request,
                AuthorizationDecision.allowed(DecisionRule.SCOPE_GRANTED, code, scope), scope);
    }

    /**
     * Check if access is allowed (convenience method).
     */
    public boolean isAllowed(@Nullable AuthenticationContext context, @Nullable AccessRequest request) {
        return authorize(context, request).isAllowed();
    }

    @Nullable
    private DecisionRule bypassRule(AuthenticationContext context, UnitRole actorRole) {
        AccessProperties.AdministratorBypassProperties bypass = properties.administratorBypass();
        if (!bypass.enabled()) {
            return null;
        }
        if (actorRole.isAdministrator()) {
            return DecisionRule.ADMINISTRATOR_BYPASS;
        }
        if (bypass.isSuperuser(context.userId())) {
            return DecisionRule.SUPERUSER_BYPASS;
        }
        return null;
    }

    private AuthorizationDecision finish(
            Instant now,
            @Nullable AuthenticationContext context,
            @Nullable UnitRole actorRole,
            AccessRequest request,
            AuthorizationDecision decision,
            @Nullable Scope actualScope) {

        log.debug("Access {} by {}: actor={}, privilege={}, target={}",
                decision.outcome(), decision.rule(),
                context != null ? StringSanitizer.forLog(context.userId()) : "anonymous",
                StringSanitizer.forLog(request.privilegeCode()),
                StringSanitizer.forLog(request.targetOwnerId()));

        if (metrics != null) {
            metrics.recordDecision(decision);
        }
        if (auditService != null) {
            auditService.record(AccessAuditEvent.forDecision(now, context, actorRole, request, decision, actualScope));
        }
        return decision;
    }
}
