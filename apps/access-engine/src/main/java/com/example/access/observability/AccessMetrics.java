package com.example.access.observability;

import com.example.access.common.util.StringSanitizer;
import com.example.access.gate.model.AuthorizationDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

/**
 * Counters for authorization outcomes, override anomalies and audit delivery.
 * Tag values are bounded to prevent high-cardinality series.
 */
@Component
public class AccessMetrics {

    private final MeterRegistry registry;

    private final Counter decisionAllowed;
    private final Counter decisionForbidden;
    private final Counter decisionUnauthenticated;
    private final Counter overrideAnomaly;
    private final Counter auditFailure;

    public AccessMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.decisionAllowed = Counter.builder("access.decision")
                .tag("outcome", "allowed")
                .description("Authorization requests allowed")
                .register(registry);

        this.decisionForbidden = Counter.builder("access.decision")
                .tag("outcome", "forbidden")
                .description("Authorization requests forbidden")
                .register(registry);

        this.decisionUnauthenticated = Counter.builder("access.decision")
                .tag("outcome", "unauthenticated")
                .description("Authorization requests without a live session")
                .register(registry);

        this.overrideAnomaly = Counter.builder("access.override.anomaly")
                .description("Overrides naming privilege codes missing from the catalog")
                .register(registry);

        this.auditFailure = Counter.builder("access.audit.failure")
                .description("Audit events the sink failed to accept")
                .register(registry);
    }

    public void recordDecision(@NonNull AuthorizationDecision decision) {
        switch (decision.outcome()) {
            case ALLOWED -> decisionAllowed.increment();
            case FORBIDDEN -> decisionForbidden.increment();
            case UNAUTHENTICATED -> decisionUnauthenticated.increment();
        }

        registry.counter("access.decision.detailed",
                Tags.of("rule", StringSanitizer.forTag(decision.rule().name()),
                        "privilege", StringSanitizer.forTag(decision.privilegeCode())))
                .increment();
    }

    public void recordOverrideAnomaly(int count) {
        overrideAnomaly.increment(count);
    }

    public void recordAuditFailure() {
        auditFailure.increment();
    }
}
