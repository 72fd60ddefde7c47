package com.example.access.privilege.resolver;

import com.example.access.audit.AccessAuditEvent;
import com.example.access.audit.AccessAuditService;
import com.example.access.common.util.StringSanitizer;
import com.example.access.config.properties.AccessProperties;
import com.example.access.config.properties.AccessProperties.OverridePolicy;
import com.example.access.exception.AnomalousOverrideException;
import com.example.access.exception.UnknownPrivilegeException;
import com.example.access.membership.MembershipGrant;
import com.example.access.membership.UnitMembership;
import com.example.access.observability.AccessMetrics;
import com.example.access.privilege.catalog.PrivilegeCatalog;
import com.example.access.privilege.defaults.RoleDefaultTable;
import com.example.access.privilege.model.EffectivePrivilege;
import com.example.access.privilege.model.PrivilegeDefinition;
import com.example.access.privilege.model.PrivilegeOverride;
import com.example.access.privilege.model.Scope;
import com.example.access.privilege.model.UnitRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combines role defaults with a member's overrides into effective privileges.
 *
 * <p>Resolution is pure apart from anomaly reporting: inputs are never mutated and
 * nothing is cached, since overrides can change between requests. When several
 * overrides name the same code, the last one in the list wins.
 *
 * <p>Overrides naming codes missing from the catalog are left out of the result and
 * reported as an anomaly. Under {@link OverridePolicy#STRICT} the call then fails
 * with {@link AnomalousOverrideException}.
 */
@Slf4j
@Component
public class EffectivePrivilegeResolver {

    private final RoleDefaultTable defaults;
    private final PrivilegeCatalog catalog;
    private final OverridePolicy overridePolicy;
    private final Clock clock;

    @Nullable
    private final AccessAuditService auditService;

    @Nullable
    private final AccessMetrics metrics;

    public EffectivePrivilegeResolver(
            RoleDefaultTable defaults,
            AccessProperties properties,
            Clock clock,
            @Nullable AccessAuditService auditService,
            @Nullable AccessMetrics metrics) {
        this.defaults = defaults;
        this.catalog = defaults.catalog();
        this.overridePolicy = properties.overridePolicy();
        this.clock = clock;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    public List<PrivilegeDefinition> listPrivileges() {
        return catalog.listPrivileges();
    }

    /**
     * Effective privileges for every catalog entry, in catalog order.
     *
     * @param role role in the unit, {@code null} if unrecognized (lowest-trust defaults apply)
     */
    @NonNull
    public List<EffectivePrivilege> resolve(@Nullable UnitRole role, @Nullable List<PrivilegeOverride> overrides) {
        List<PrivilegeOverride> input = overrides != null ? overrides : List.of();

        Map<String, Scope> overrideScopes = new HashMap<>();
        List<PrivilegeOverride> unknown = new ArrayList<>();
        for (PrivilegeOverride override : input) {
            if (catalog.contains(override.privilegeCode())) {
                overrideScopes.put(override.privilegeCode(), override.scope());
            } else {
                unknown.add(override);
            }
        }
        handleUnknownCodes(role, unknown);

        Map<String, Scope> row = defaults.row(role);
        List<EffectivePrivilege> result = new ArrayList<>(catalog.size());
        for (PrivilegeDefinition definition : catalog.listPrivileges()) {
            result.add(EffectivePrivilege.of(definition,
                    row.get(definition.code()),
                    overrideScopes.get(definition.code())));
        }
        return result;
    }

    /**
     * Resolution by persisted role code, failing closed to lowest-trust defaults.
     */
    @NonNull
    public List<EffectivePrivilege> resolve(@Nullable String roleCode, @Nullable List<PrivilegeOverride> overrides) {
        return resolve(defaults.roleOrLowestTrust(roleCode), overrides);
    }

    /**
     * Effective scope of a single privilege. Agrees with the matching entry of
     * {@link #resolve(UnitRole, List)} without building the whole list.
     *
     * @throws UnknownPrivilegeException if {@code privilegeCode} is not in the catalog
     */
    @NonNull
    public Scope effectiveScope(
            @Nullable UnitRole role,
            @Nullable List<PrivilegeOverride> overrides,
            String privilegeCode) {
        Scope defaultScope = defaults.defaultScope(role, privilegeCode);
        List<PrivilegeOverride> input = overrides != null ? overrides : List.of();

        Scope overrideScope = null;
        List<PrivilegeOverride> unknown = new ArrayList<>();
        for (PrivilegeOverride override : input) {
            if (privilegeCode.equals(override.privilegeCode())) {
                overrideScope = override.scope();
            } else if (!catalog.contains(override.privilegeCode())) {
                unknown.add(override);
            }
        }
        handleUnknownCodes(role, unknown);

        return overrideScope != null ? overrideScope : defaultScope;
    }

    /**
     * First membership, in the given order, whose effective scope for the privilege is not {@link Scope#NONE}.
     */
    @NonNull
    public Optional<MembershipGrant> firstGrantingMembership(
            @NonNull List<UnitMembership> memberships, String privilegeCode) {
        for (UnitMembership membership : memberships) {
            Scope scope = effectiveScope(membership.role(), membership.overrides(), privilegeCode);
            if (scope.grantsAccess()) {
                return Optional.of(new MembershipGrant(membership, privilegeCode, scope));
            }
        }
        log.debug("No membership grants privilege {} ({} membership(s) checked)",
                privilegeCode, memberships.size());
        return Optional.empty();
    }

    public RoleDefaultTable defaults() {
        return defaults;
    }

    private void handleUnknownCodes(UnitRole role, List<PrivilegeOverride> unknown) {
        if (unknown.isEmpty()) {
            return;
        }

        Map<String, List<String>> codesByMember = new LinkedHashMap<>();
        for (PrivilegeOverride override : unknown) {
            codesByMember.computeIfAbsent(override.memberId(), k -> new ArrayList<>()).add(override.privilegeCode());
        }

        Instant detectedAt = clock.instant();
        List<String> unknownCodes = new ArrayList<>(unknown.size());
        codesByMember.forEach((memberId, codes) -> {
            log.debug("Ignoring {} override(s) with unknown privilege codes for member {}",
                    codes.size(), StringSanitizer.forLog(memberId));
            if (auditService != null) {
                auditService.record(AccessAuditEvent.anomalousOverrides(detectedAt, memberId, role, codes));
            }
            unknownCodes.addAll(codes);
        });
        if (metrics != null) {
            metrics.recordOverrideAnomaly(unknownCodes.size());
        }
        if (overridePolicy == OverridePolicy.STRICT) {
            throw new AnomalousOverrideException(unknownCodes);
        }
    }
}
