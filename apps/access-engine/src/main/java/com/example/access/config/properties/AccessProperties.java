package com.example.access.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Set;

@ConfigurationProperties(prefix = "app.access")
public record AccessProperties(
        OverridePolicy overridePolicy,
        AdministratorBypassProperties administratorBypass,
        Boolean denFallbackToSelf,
        AuditProperties audit
) {
    public AccessProperties {
        if (overridePolicy == null) {
            overridePolicy = OverridePolicy.LENIENT;
        }
        if (administratorBypass == null) {
            administratorBypass = new AdministratorBypassProperties(true, Set.of());
        }
        if (denFallbackToSelf == null) {
            denFallbackToSelf = true;
        }
        if (audit == null) {
            audit = new AuditProperties(true, true, false);
        }
    }

    public static AccessProperties defaults() {
        return new AccessProperties(null, null, null, null);
    }

    /**
     * Handling of overrides that name a privilege code missing from the catalog.
     */
    public enum OverridePolicy {
        /** Ignore the override and report an anomaly. */
        LENIENT,
        /** Report an anomaly and fail the resolution. */
        STRICT
    }

    public record AdministratorBypassProperties(
            boolean enabled,
            Set<String> superusers
    ) {
        public AdministratorBypassProperties {
            superusers = superusers == null ? Set.of() : Set.copyOf(superusers);
        }

        public boolean isSuperuser(String userId) {
            return userId != null && superusers.contains(userId);
        }
    }

    public record AuditProperties(
            boolean enabled,
            boolean async,
            boolean includeGrants
    ) {}
}
