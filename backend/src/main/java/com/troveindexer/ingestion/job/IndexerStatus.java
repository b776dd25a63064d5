package com.troveindexer.ingestion.job;

import java.time.Instant;

/**
 * Point-in-time view of the tailing loop.
 *
 * @param lastProcessedBlock null until the first checkpoint exists
 * @param lastHead           null until the head has been queried once
 */
public record IndexerStatus(
        IndexerState state,
        Long lastProcessedBlock,
        long nextBlock,
        Long lastHead,
        Instant lastBatchAt,
        String lastError
) {
}
