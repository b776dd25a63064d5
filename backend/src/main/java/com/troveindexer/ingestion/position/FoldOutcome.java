package com.troveindexer.ingestion.position;

/**
 * Result of folding one lifecycle event.
 */
public enum FoldOutcome {
    CREATED,
    UPDATED,
    /** Source log already applied (batch replay); nothing written. */
    REPLAYED
}
