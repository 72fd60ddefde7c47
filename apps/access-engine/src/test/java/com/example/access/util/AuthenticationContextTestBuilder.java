package com.example.access.util;

import com.example.access.gate.model.AuthenticationContext;
import com.example.access.privilege.model.UnitRole;

import java.time.Instant;

/**
 * Test builder for AuthenticationContext.
 */
public class AuthenticationContextTestBuilder {

    public static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private String userId = "member-001";
    private String unitId = "troop-100";
    private UnitRole unitRole = UnitRole.MEMBER;
    private Instant authenticatedAt = NOW.minusSeconds(600);
    private Instant expiresAt = NOW.plusSeconds(3600);

    public static AuthenticationContextTestBuilder anAuthenticationContext() {
        return new AuthenticationContextTestBuilder();
    }

    public static AuthenticationContext aContextFor(String userId, UnitRole role) {
        return anAuthenticationContext()
                .withUserId(userId)
                .withUnitRole(role)
                .build();
    }

    public AuthenticationContextTestBuilder withUserId(String userId) {
        this.userId = userId;
        return this;
    }

    public AuthenticationContextTestBuilder withUnitId(String unitId) {
        this.unitId = unitId;
        return this;
    }

    public AuthenticationContextTestBuilder withUnitRole(UnitRole unitRole) {
        this.unitRole = unitRole;
        return this;
    }

    public AuthenticationContextTestBuilder withAuthenticatedAt(Instant authenticatedAt) {
        this.authenticatedAt = authenticatedAt;
        return this;
    }

    public AuthenticationContextTestBuilder withExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
        return this;
    }

    public AuthenticationContext build() {
        return new AuthenticationContext(userId, unitId, unitRole, authenticatedAt, expiresAt);
    }
}
