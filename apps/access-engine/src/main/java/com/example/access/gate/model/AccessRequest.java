package com.example.access.gate.model;

import com.example.access.membership.MemberRelations;
import com.example.access.membership.RosterMemberRelations;
import com.example.access.privilege.model.PrivilegeOverride;
import com.example.access.privilege.model.UnitRole;

import java.util.List;
import java.util.Objects;

/**
 * What a protected operation asks the gate, plus the snapshot data loaded for it.
 *
 * <p>Missing fields never fail construction: the gate decides on whatever it is given.
 *
 * @param privilegeCode action being performed, {@code null} is denied as an unknown privilege
 * @param requiredRole  minimum role for the endpoint class
 * @param targetOwnerId member owning the target resource, {@code null} for unit-wide operations
 * @param overrides     actor's overrides in the unit
 * @param relations     membership linkage of the unit, {@code null} means no linkage
 */
public record AccessRequest(
        String privilegeCode,
        UnitRole requiredRole,
        String targetOwnerId,
        List<PrivilegeOverride> overrides,
        MemberRelations relations
) {
    private static final MemberRelations NO_RELATIONS = new RosterMemberRelations(List.of());

    public AccessRequest {
        if (requiredRole == null) {
            requiredRole = UnitRole.LOWEST_TRUST;
        }
        overrides = overrides == null
                ? List.of()
                : overrides.stream().filter(Objects::nonNull).toList();
        if (relations == null) {
            relations = NO_RELATIONS;
        }
    }

    public boolean hasTarget() {
        return targetOwnerId != null;
    }
}
