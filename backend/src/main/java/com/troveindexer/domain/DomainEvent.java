package com.troveindexer.domain;

import java.util.Map;

/**
 * A decoded contract log. One variant per event the indexer acts on; everything else resolved by the
 * decoding table is carried as {@link AuditOnlyEvent}.
 */
public sealed interface DomainEvent permits TroveUpdatedEvent, AuditOnlyEvent {

    String name();

    LogMeta meta();

    /** Decoded non-indexed fields by ABI name, for the raw audit trail. */
    Map<String, Object> auditFields();
}
