package com.example.access.membership;

import com.example.access.privilege.model.Scope;

/**
 * Membership through which a privilege is granted, with the effective scope.
 */
public record MembershipGrant(
        UnitMembership membership,
        String privilegeCode,
        Scope scope
) {}
