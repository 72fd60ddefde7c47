package com.example.access.membership;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link MemberRelations} over a roster snapshot of one unit.
 *
 * <p>The household of member A contains A, every member whose linked parent or
 * linked scout is A, and A's own linked parent and linked scout, restricted to
 * members present on the roster.
 */
public final class RosterMemberRelations implements MemberRelations {

    private final Map<String, RosterEntry> entries;

    public RosterMemberRelations(Collection<RosterEntry> roster) {
        Map<String, RosterEntry> byId = new LinkedHashMap<>();
        for (RosterEntry entry : roster) {
            byId.put(entry.memberId(), entry);
        }
        this.entries = Map.copyOf(byId);
    }

    @Override
    public boolean isUnitMember(String memberId) {
        return memberId != null && entries.containsKey(memberId);
    }

    @Override
    public Optional<String> denOf(String memberId) {
        RosterEntry entry = memberId != null ? entries.get(memberId) : null;
        return entry != null ? Optional.ofNullable(entry.den()) : Optional.empty();
    }

    @Override
    public boolean isSameHousehold(String actorId, String targetId) {
        return targetId != null && householdOf(actorId).contains(targetId);
    }

    /**
     * Member ids in the actor's household, empty if the actor is not on the roster.
     */
    public Set<String> householdOf(String actorId) {
        RosterEntry actor = actorId != null ? entries.get(actorId) : null;
        if (actor == null) {
            return Set.of();
        }

        Set<String> household = new LinkedHashSet<>();
        household.add(actorId);
        addIfPresent(household, actor.linkedParentId());
        addIfPresent(household, actor.linkedScoutId());
        for (RosterEntry entry : entries.values()) {
            if (actorId.equals(entry.linkedParentId()) || actorId.equals(entry.linkedScoutId())) {
                household.add(entry.memberId());
            }
        }
        return household;
    }

    private void addIfPresent(Set<String> household, String memberId) {
        if (memberId != null && entries.containsKey(memberId)) {
            household.add(memberId);
        }
    }
}
