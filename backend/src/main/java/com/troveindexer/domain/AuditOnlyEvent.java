package com.troveindexer.domain;

import java.util.Map;

/**
 * Any decoded event without position semantics (TroveCreated, BaseRateUpdated, ...). Written to the
 * audit trail only.
 */
public record AuditOnlyEvent(String name, LogMeta meta, Map<String, Object> auditFields) implements DomainEvent {

    public AuditOnlyEvent {
        auditFields = auditFields != null ? Map.copyOf(auditFields) : Map.of();
    }
}
