package com.example.access.audit;

import com.example.access.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;

/**
 * Writes audit events as one JSON object per line to the {@code ACCESS_AUDIT} logger.
 */
@RequiredArgsConstructor
public class LoggingAccessAuditSink implements AccessAuditSink {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("ACCESS_AUDIT");

    private final ObjectMapper objectMapper;

    @Override
    public void publish(@NonNull AccessAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByAction(event.action(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByAction(AccessAuditEvent.Action action, String json) {
        switch (action) {
            case GRANT, BYPASS -> AUDIT_LOG.info(json);
            case DENY, ANOMALY -> AUDIT_LOG.warn(json);
        }
    }

    private void logFallback(@NonNull AccessAuditEvent event) {
        AUDIT_LOG.warn("Access {} - actor={}, unit={}, privilege={}, target={}, rule={}",
                event.action(),
                StringSanitizer.forLog(event.actorId()),
                StringSanitizer.forLog(event.unitId()),
                StringSanitizer.forLog(event.privilegeCode()),
                StringSanitizer.forLog(event.targetOwnerId()),
                StringSanitizer.forLog(event.ruleId()));
    }
}
