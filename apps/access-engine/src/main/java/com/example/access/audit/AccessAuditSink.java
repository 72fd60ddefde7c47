package com.example.access.audit;

/**
 * Append-only destination for audit events.
 */
public interface AccessAuditSink {

    /**
     * Accept one event. May throw; callers treat delivery as best-effort.
     */
    void publish(AccessAuditEvent event);
}
