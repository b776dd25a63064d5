package com.troveindexer.ingestion.job;

/**
 * Tailing loop state. HALTED is entered only on an identity collision and is never left.
 */
public enum IndexerState {
    STOPPED,
    CATCHING_UP,
    IDLE,
    HALTED
}
