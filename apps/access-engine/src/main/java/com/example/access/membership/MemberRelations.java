package com.example.access.membership;

import java.util.Optional;

/**
 * Membership linkage of one unit, loaded by the caller before authorization.
 * Implementations must answer from memory; the engine never waits on I/O.
 */
public interface MemberRelations {

    /**
     * Whether the member holds an active membership in the unit.
     */
    boolean isUnitMember(String memberId);

    /**
     * Den (sub-group) of an active member, empty when unassigned or not a member.
     */
    Optional<String> denOf(String memberId);

    /**
     * Whether the target belongs to the actor's household. A member is always in their own household.
     */
    boolean isSameHousehold(String actorId, String targetId);
}
