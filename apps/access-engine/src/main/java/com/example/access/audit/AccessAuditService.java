package com.example.access.audit;

import com.example.access.common.util.StringSanitizer;
import com.example.access.config.properties.AccessProperties;
import com.example.access.observability.AccessMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Best-effort delivery of audit events to the {@link AccessAuditSink}.
 *
 * <p>Delivery never throws to the caller. Failures are logged and counted; the
 * authorization decision that produced the event is already final.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.access.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AccessAuditService {

    private final AccessAuditSink sink;
    private final AccessProperties.AuditProperties properties;

    @Nullable
    private final AccessMetrics metrics;

    public AccessAuditService(
            AccessAuditSink sink,
            AccessProperties accessProperties,
            @Nullable AccessMetrics metrics) {
        this.sink = sink;
        this.properties = accessProperties.audit();
        this.metrics = metrics;
    }

    public void record(@NonNull AccessAuditEvent event) {
        if (event.action() == AccessAuditEvent.Action.GRANT && !properties.includeGrants()) {
            return;
        }

        try {
            if (properties.async()) {
                Mono.fromRunnable(() -> sink.publish(event))
                        .subscribeOn(Schedulers.boundedElastic())
                        .subscribe(
                                v -> {},
                                e -> onFailure(event, e)
                        );
            } else {
                sink.publish(event);
            }
        } catch (RuntimeException e) {
            onFailure(event, e);
        }
    }

    private void onFailure(AccessAuditEvent event, Throwable error) {
        log.error("Failed to deliver audit event {} ({} {}): {}",
                event.eventId(),
                event.action(),
                StringSanitizer.forLog(event.privilegeCode()),
                StringSanitizer.forLog(error.getMessage()));
        if (metrics != null) {
            metrics.recordAuditFailure();
        }
    }
}
