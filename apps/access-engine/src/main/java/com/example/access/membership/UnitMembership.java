package com.example.access.membership;

import com.example.access.privilege.model.PrivilegeOverride;
import com.example.access.privilege.model.UnitRole;

import java.util.List;

/**
 * One unit membership of a member with the overrides that apply in that unit.
 *
 * @param role role in the unit, or {@code null} if the stored role code was not recognized
 */
public record UnitMembership(
        String unitId,
        UnitRole role,
        List<PrivilegeOverride> overrides
) {
    public UnitMembership {
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
    }
}
