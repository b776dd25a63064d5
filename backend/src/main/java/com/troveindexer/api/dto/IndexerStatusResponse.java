package com.troveindexer.api.dto;

import java.time.Instant;

public record IndexerStatusResponse(
        String state,
        Long lastProcessedBlock,
        long nextBlock,
        Long lastHead,
        Instant lastBatchAt,
        String lastError
) {
}
