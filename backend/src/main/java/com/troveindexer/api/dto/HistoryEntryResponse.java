package com.troveindexer.api.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record HistoryEntryResponse(
        String txHash,
        long logIndex,
        long blockNumber,
        String operation,
        BigDecimal collateral,
        BigDecimal debt,
        Instant timestamp
) {
}
