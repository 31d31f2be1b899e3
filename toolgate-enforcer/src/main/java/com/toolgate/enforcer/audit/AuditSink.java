package com.toolgate.enforcer.audit;

/**
 * Destination for audit events. Implementations must be thread-safe; they are
 * called without any enforcer lock held.
 */
@FunctionalInterface
public interface AuditSink {

    void emit(AuditEvent event);
}
