package com.example.access.membership;

import java.util.Objects;

/**
 * One active roster row of a unit.
 *
 * @param memberId       member's user id
 * @param den            den assignment, or {@code null}
 * @param linkedParentId parent/guardian this member is linked to, or {@code null}
 * @param linkedScoutId  scout this member is linked to, or {@code null}
 */
public record RosterEntry(
        String memberId,
        String den,
        String linkedParentId,
        String linkedScoutId
) {
    public RosterEntry {
        Objects.requireNonNull(memberId, "memberId");
        if (den != null && den.isBlank()) {
            den = null;
        }
    }

    public static RosterEntry of(String memberId) {
        return new RosterEntry(memberId, null, null, null);
    }
}
