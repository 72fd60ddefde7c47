package com.example.access.membership;

import com.example.access.privilege.model.Scope;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a target member falls within an actor's scope.
 */
public final class ScopeMatcher {

    private ScopeMatcher() {}

    public static boolean isInScope(Scope scope, String actorId, String targetId, MemberRelations relations) {
        if (actorId == null || targetId == null) {
            return false;
        }
        return switch (scope) {
            case TROOP -> relations.isUnitMember(targetId);
            case DEN -> sameDen(actorId, targetId, relations);
            case HOUSEHOLD -> relations.isSameHousehold(actorId, targetId);
            case SELF -> actorId.equals(targetId);
            case NONE -> false;
        };
    }

    /**
     * Subset of candidates visible under a scope, in candidate order.
     */
    public static Set<String> visibleMembers(
            Scope scope, String actorId, MemberRelations relations, Collection<String> candidates) {
        Set<String> visible = new LinkedHashSet<>();
        if (!scope.grantsAccess()) {
            return visible;
        }
        for (String candidate : candidates) {
            if (isInScope(scope, actorId, candidate, relations)) {
                visible.add(candidate);
            }
        }
        return visible;
    }

    private static boolean sameDen(String actorId, String targetId, MemberRelations relations) {
        Optional<String> actorDen = relations.denOf(actorId);
        return actorDen.isPresent() && actorDen.equals(relations.denOf(targetId));
    }
}
