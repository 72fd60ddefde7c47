package com.example.access.gate.model;

import com.example.access.privilege.model.UnitRole;

import java.time.Instant;

/**
 * Live session of the acting member, held by the request-handling layer for one request.
 *
 * @param userId          acting member
 * @param unitId          unit the request is evaluated in
 * @param unitRole        role in that unit, {@code null} if the stored role was not recognized
 * @param authenticatedAt login time
 * @param expiresAt       session expiry, {@code null} for no expiry
 */
public record AuthenticationContext(
        String userId,
        String unitId,
        UnitRole unitRole,
        Instant authenticatedAt,
        Instant expiresAt
) {
    public static AuthenticationContext of(String userId, String unitId, UnitRole unitRole, Instant authenticatedAt) {
        return new AuthenticationContext(userId, unitId, unitRole, authenticatedAt, null);
    }

    public boolean isLive(Instant now) {
        return userId != null && !userId.isBlank()
                && (expiresAt == null || now.isBefore(expiresAt));
    }
}
