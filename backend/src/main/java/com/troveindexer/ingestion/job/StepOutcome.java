package com.troveindexer.ingestion.job;

/**
 * What one loop iteration did and therefore how long the loop pauses before the next one.
 */
public enum StepOutcome {
    /** A batch was processed and the cursor advanced; continue immediately. */
    ADVANCED,
    /** Cursor is past the head; wait the poll interval. */
    IDLE,
    /** Fetch or store failed; cursor unchanged, wait the retry interval. */
    RETRY,
    /** Fatal; the loop stops. */
    HALTED
}
